package work.formgraph.ui;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.formgraph.compile.SchemaCompiler;
import work.formgraph.graph.Combinator;
import work.formgraph.graph.Condition;
import work.formgraph.graph.ConditionalGroups;
import work.formgraph.graph.EdgeType;
import work.formgraph.graph.GraphMutations;
import work.formgraph.graph.NodeAdded;
import work.formgraph.graph.NodeDetails;
import work.formgraph.graph.NodeKind;
import work.formgraph.graph.NodePatch;
import work.formgraph.graph.Operator;
import work.formgraph.graph.Predicate;
import work.formgraph.graph.SchemaGraph;
import work.formgraph.graph.SchemaNode;
import work.formgraph.shared.JsonValues;

class UiSchemaGeneratorTest {
    private final SchemaCompiler compiler = new SchemaCompiler();
    private final UiSchemaGenerator generator = new UiSchemaGenerator(WidgetRegistry.standard(), compiler);

    @Test
    void emptyGraphHasAnEmptyUiSchema() {
        assertEquals(Map.of(), generator.generate(SchemaGraph.empty()));
    }

    @Test
    void assignsWidgetsAndOrder() {
        SchemaGraph graph = inspectionForm();

        Map<String, Object> ui = generator.generate(graph);

        assertEquals(List.of("site", "score", "passed", "photos", "address", "*"), ui.get(UiSchemaGenerator.ORDER));
        assertEquals(Map.of(UiSchemaGenerator.WIDGET, "text"), ui.get("site"));
        assertEquals(Map.of(UiSchemaGenerator.WIDGET, "number"), ui.get("score"));

        Map<String, Object> passed = JsonValues.objectAt(ui, "passed");
        assertEquals("yesno", passed.get(UiSchemaGenerator.WIDGET));
        assertEquals(2, JsonValues.arrayAt(JsonValues.objectAt(passed, UiSchemaGenerator.OPTIONS), "enumOptions")
            .size());

        Map<String, Object> photos = JsonValues.objectAt(ui, "photos");
        assertEquals("photo-gallery", photos.get(UiSchemaGenerator.WIDGET));
        assertEquals(Map.of("addable", true, "orderable", true, "removable", true),
            photos.get(UiSchemaGenerator.OPTIONS));
        assertEquals(Map.of(UiSchemaGenerator.WIDGET, "text"), photos.get(UiSchemaGenerator.ITEMS));

        Map<String, Object> address = JsonValues.objectAt(ui, "address");
        assertEquals(true, address.get(UiSchemaGenerator.COLLAPSIBLE));
        assertEquals(false, address.get(UiSchemaGenerator.COLLAPSED));
        assertEquals(List.of("street", "*"), address.get(UiSchemaGenerator.ORDER));
        assertFalse(address.containsKey(UiSchemaGenerator.WIDGET));
        assertOrdersMatchProperties(ui, compiler.compile(graph));
    }

    @Test
    void branchFieldsGetEntriesButStayOutOfTheOrder() {
        NodeAdded account = GraphMutations.addNode(SchemaGraph.empty(), SchemaNode.string("account", "Account"));
        NodeAdded group = ConditionalGroups.addGroup(account.graph(), Combinator.ALL_OF, SchemaGraph.ROOT_ID);
        NodeAdded company = GraphMutations.addNode(group.graph(), SchemaNode.object("company", "Company"),
            group.nodeId(), EdgeType.THEN);
        NodeAdded vat = GraphMutations.addNode(company.graph(), SchemaNode.string("vat", "VAT"), company.nodeId());
        NodeAdded nickname = GraphMutations.addNode(vat.graph(), SchemaNode.string("nickname", "Nickname"),
            group.nodeId(), EdgeType.ELSE);
        SchemaGraph graph = ConditionalGroups.addCondition(nickname.graph(), group.nodeId(),
            new Condition(Predicate.of("account", Operator.EQUALS, "business"), company.nodeId(),
                nickname.nodeId()));

        Map<String, Object> ui = generator.generate(graph);

        assertEquals(List.of("account", "*"), ui.get(UiSchemaGenerator.ORDER));
        assertFalse(ui.containsKey("allOf_group"));
        assertEquals(Map.of(UiSchemaGenerator.WIDGET, "text"), ui.get("nickname"));
        Map<String, Object> companyUi = JsonValues.objectAt(ui, "company");
        assertEquals(List.of("vat", "*"), companyUi.get(UiSchemaGenerator.ORDER));
        assertOrdersMatchProperties(ui, compiler.compile(graph));
    }

    @Test
    void explicitWidgetIsKeptVerbatim() {
        var notes = SchemaNode.builder(NodeKind.STRING).key("notes").widget("textarea")
            .widgetOptions(Map.of("rows", 5)).build();
        var signature = SchemaNode.builder(NodeKind.STRING).key("signature").widget("signature-pad").build();
        SchemaGraph graph = GraphMutations.addNode(SchemaGraph.empty(), notes).graph();
        graph = GraphMutations.addNode(graph, signature).graph();

        Map<String, Object> ui = generator.generate(graph);

        assertEquals(Map.of(UiSchemaGenerator.WIDGET, "textarea", UiSchemaGenerator.OPTIONS, Map.of("rows", 5)),
            ui.get("notes"));
        assertEquals(Map.of(UiSchemaGenerator.WIDGET, "signature-pad"), ui.get("signature"));
    }

    @Test
    void referencedDefinitionsGetTheirOrder() {
        NodeAdded address = GraphMutations.createDefinition(SchemaGraph.empty(), "address",
            SchemaNode.object("address", "Address"));
        SchemaGraph graph = GraphMutations.addNode(address.graph(), SchemaNode.string("street", "Street"),
            address.nodeId()).graph();
        graph = GraphMutations.addNode(graph, SchemaNode.string("city", "City"), address.nodeId()).graph();
        graph = GraphMutations.createRefToDefinition(graph, "address", SchemaGraph.ROOT_ID, "home").graph();

        Map<String, Object> ui = generator.generate(graph);

        assertEquals(List.of("home", "*"), ui.get(UiSchemaGenerator.ORDER));
        assertEquals(List.of("street", "city"), UiSchemaGenerator.orderKeys(JsonValues.objectAt(ui, "home")));
    }

    @Test
    void ordersFollowEveryMutation() {
        SchemaGraph graph = inspectionForm();
        String scoreId = nodeId(graph, "score");
        String streetId = nodeId(graph, "street");

        graph = GraphMutations.reorderNode(graph, scoreId, 0);
        graph = GraphMutations.moveNode(graph, streetId, SchemaGraph.ROOT_ID);
        graph = GraphMutations.updateNode(graph, nodeId(graph, "site"), NodePatch.empty().key("location"));
        graph = GraphMutations.removeNode(graph, nodeId(graph, "photos"));

        Map<String, Object> ui = generator.generate(graph);

        assertEquals(List.of("score", "location", "passed", "address", "street"), UiSchemaGenerator.orderKeys(ui));
        assertFalse(JsonValues.objectAt(ui, "address").containsKey(UiSchemaGenerator.ORDER));
        assertOrdersMatchProperties(ui, compiler.compile(graph));
    }

    @Test
    void resultsAreCachedPerGraph() {
        SchemaGraph graph = inspectionForm();
        assertFalse(generator.isCached(graph));
        Map<String, Object> first = generator.generate(graph);
        assertSame(first, generator.generate(graph));
        assertTrue(generator.isCached(graph));
        generator.clearCache();
        assertFalse(generator.isCached(graph));
    }

    @Test
    void wildcardIsAppendedOnceAfterTrimmedKeys() {
        assertEquals(List.of("a", "b", "*"), UiSchemaGenerator.withWildcard(List.of(" a", "b", "a ", "")));
    }

    private static SchemaGraph inspectionForm() {
        SchemaGraph graph = GraphMutations.addNode(SchemaGraph.empty(), SchemaNode.string("site", "Site")).graph();
        graph = GraphMutations.addNode(graph, SchemaNode.number("score", "Score")).graph();
        graph = GraphMutations.addNode(graph,
            SchemaNode.builder(NodeDetails.EnumField.of("yes", "no")).key("passed").title("Passed").build()).graph();
        NodeAdded photos = GraphMutations.addNode(graph,
            SchemaNode.builder(NodeKind.ARRAY).key("photos").title("Photos").build());
        graph = GraphMutations.addNode(photos.graph(), SchemaNode.string("photo", "Photo"), photos.nodeId()).graph();
        NodeAdded address = GraphMutations.addNode(graph, SchemaNode.object("address", "Address"));
        return GraphMutations.addNode(address.graph(), SchemaNode.string("street", "Street"), address.nodeId())
            .graph();
    }

    private static String nodeId(SchemaGraph graph, String key) {
        return graph.nodes().values().stream()
            .filter(node -> key.equals(node.key()))
            .findFirst()
            .orElseThrow()
            .id();
    }

    /** Every UI level's order keys equal the compiled property keys at the same path. */
    private static void assertOrdersMatchProperties(Map<String, Object> ui, Map<String, Object> schema) {
        Map<String, Object> properties = JsonValues.objectAt(schema, "properties");
        List<String> expected = properties == null ? List.of() : new ArrayList<>(properties.keySet());
        assertEquals(expected, UiSchemaGenerator.orderKeys(ui));
        if (properties == null) {
            return;
        }
        for (var entry : properties.entrySet()) {
            Map<String, Object> child = JsonValues.asObject(entry.getValue());
            if ("object".equals(child.get("type")) && child.containsKey("properties")) {
                assertOrdersMatchProperties(JsonValues.objectAt(ui, entry.getKey()), child);
            }
        }
    }
}
