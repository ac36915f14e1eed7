package work.formgraph.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.formgraph.graph.Combinator;
import work.formgraph.graph.Condition;
import work.formgraph.graph.ConditionalGroups;
import work.formgraph.graph.EdgeType;
import work.formgraph.graph.GraphMutations;
import work.formgraph.graph.NodeAdded;
import work.formgraph.graph.NodeDetails;
import work.formgraph.graph.NodeKind;
import work.formgraph.graph.Operator;
import work.formgraph.graph.Predicate;
import work.formgraph.graph.SchemaGraph;
import work.formgraph.graph.SchemaNode;
import work.formgraph.shared.JsonValues;

class SchemaCompilerTest {
    private static final Predicate BUSINESS = Predicate.of("account", Operator.EQUALS, "business");
    private static final Predicate ADULT = Predicate.of("age", Operator.GREATER_EQUAL, 18);
    private static final Predicate EU = Predicate.of("region", Operator.EQUALS, "eu");

    private SchemaCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new SchemaCompiler();
    }

    @Test
    void compilesFieldsWithRequiredAndAttributes() {
        SchemaGraph graph = GraphMutations.addNode(SchemaGraph.empty(),
            SchemaNode.builder(NodeKind.STRING).key("name").title("Name").required(true).build()).graph();
        graph = GraphMutations.addNode(graph, SchemaNode.builder(new NodeDetails.NumberField(0, null, null, null, null))
            .key("age").title("Age").build()).graph();

        Map<String, Object> schema = compiler.compile(graph);

        assertEquals("object", schema.get("type"));
        assertEquals(List.of("name"), schema.get("required"));
        Map<String, Object> properties = JsonValues.objectAt(schema, "properties");
        assertEquals(List.of("name", "age"), List.copyOf(properties.keySet()));
        assertEquals(Map.of("type", "string", "title", "Name"), properties.get("name"));
        assertEquals(Map.of("type", "number", "title", "Age", "minimum", 0), properties.get("age"));
        assertFalse(schema.containsKey("definitions"));
    }

    @Test
    void emptyRootHasNoProperties() {
        Map<String, Object> schema = compiler.compile(SchemaGraph.empty());
        assertEquals(Map.of("type", "object", "title", "Root"), schema);
    }

    @Test
    void enumAndDefaultsAreEmitted() {
        var choice = SchemaNode.builder(new NodeDetails.EnumField(List.of("s", "m", "l"), List.of("Small", "Medium")))
            .key("size").title("Size").defaultValue("m").build();
        Map<String, Object> size = property(compiler.compile(GraphMutations.addNode(SchemaGraph.empty(), choice)
            .graph()), "size");
        assertEquals("string", size.get("type"));
        assertEquals("m", size.get("default"));
        assertEquals(List.of("s", "m", "l"), size.get("enum"));
        assertEquals(List.of("Small", "Medium"), size.get("enumNames"));
    }

    @Test
    void arrayCompilesFirstChildAsItems() {
        NodeAdded tags = GraphMutations.addNode(SchemaGraph.empty(),
            SchemaNode.builder(new NodeDetails.ArrayField(1, null, null, null)).key("tags").title("Tags").build());
        SchemaGraph graph = GraphMutations.addNode(tags.graph(), SchemaNode.string("tag", "Tag"), tags.nodeId())
            .graph();

        Map<String, Object> array = property(compiler.compile(graph), "tags");
        assertEquals("array", array.get("type"));
        assertEquals(1, array.get("minItems"));
        assertEquals(Map.of("type", "string", "title", "Tag"), array.get("items"));
    }

    @Test
    void conditionsSharingBranchesCompactIntoOneIf() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ALL_OF, SchemaGraph.ROOT_ID);
        NodeAdded company = GraphMutations.addNode(group.graph(), SchemaNode.string("company", "Company"),
            group.nodeId(), EdgeType.THEN);
        SchemaGraph graph = company.graph();
        for (Predicate predicate : List.of(BUSINESS, ADULT, EU)) {
            graph = ConditionalGroups.addCondition(graph, group.nodeId(),
                new Condition(predicate, company.nodeId(), null));
        }

        Map<String, Object> schema = compiler.compile(graph);

        assertEquals(Map.of(), schema.get("properties"));
        List<Object> allOf = JsonValues.arrayAt(schema, "allOf");
        assertEquals(1, allOf.size());
        Map<String, Object> compact = JsonValues.asObject(allOf.get(0));
        assertEquals(3, JsonValues.arrayAt(JsonValues.objectAt(compact, "if"), "allOf").size());
        assertEquals(List.of("company"),
            List.copyOf(JsonValues.objectAt(JsonValues.objectAt(compact, "then"), "properties").keySet()));
        assertFalse(compact.containsKey("else"));
    }

    @Test
    void strictCombinatorsGetAFailingElse() {
        for (Combinator combinator : List.of(Combinator.ANY_OF, Combinator.ONE_OF)) {
            NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), combinator, SchemaGraph.ROOT_ID);
            NodeAdded vat = GraphMutations.addNode(group.graph(), SchemaNode.string("vat", "VAT"),
                group.nodeId(), EdgeType.THEN);
            SchemaGraph graph = ConditionalGroups.addCondition(vat.graph(), group.nodeId(),
                new Condition(BUSINESS, vat.nodeId(), null));
            graph = ConditionalGroups.addCondition(graph, group.nodeId(), new Condition(EU, vat.nodeId(), null));

            Map<String, Object> compact = JsonValues.asObject(JsonValues.arrayAt(compiler.compile(graph), "allOf")
                .get(0));
            assertEquals(Map.of("not", Map.of()), compact.get("else"));
            assertEquals(2, JsonValues.arrayAt(JsonValues.objectAt(compact, "if"), combinator.keyword()).size());
        }
    }

    @Test
    void singleConditionGroupKeepsItsCombinator() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ONE_OF, SchemaGraph.ROOT_ID);
        NodeAdded vat = GraphMutations.addNode(group.graph(), SchemaNode.string("vat", "VAT"),
            group.nodeId(), EdgeType.THEN);
        SchemaGraph graph = ConditionalGroups.addCondition(vat.graph(), group.nodeId(),
            new Condition(BUSINESS, vat.nodeId(), null));

        Map<String, Object> schema = compiler.compile(graph);

        assertFalse(schema.containsKey("allOf"));
        List<Object> oneOf = JsonValues.arrayAt(schema, "oneOf");
        assertEquals(1, oneOf.size());
        Map<String, Object> entry = JsonValues.asObject(oneOf.get(0));
        assertEquals(PredicateCompiler.compile(BUSINESS), entry.get("if"));
    }

    @Test
    void distinctBranchesProduceOneEntryPerCondition() {
        SchemaGraph graph = twoBranchGroup(Combinator.ALL_OF);

        List<Object> allOf = JsonValues.arrayAt(compiler.compile(graph), "allOf");
        assertEquals(2, allOf.size());
        Map<String, Object> first = JsonValues.asObject(allOf.get(0));
        Map<String, Object> second = JsonValues.asObject(allOf.get(1));
        assertEquals(List.of("company"), List.copyOf(JsonValues.objectAt(
            JsonValues.objectAt(first, "then"), "properties").keySet()));
        assertEquals(List.of("vat"), List.copyOf(JsonValues.objectAt(
            JsonValues.objectAt(second, "then"), "properties").keySet()));
        assertEquals(List.of("vat"), JsonValues.objectAt(second, "then").get("required"));
        assertFalse(first.containsKey("else"));
    }

    @Test
    void sameCombinatorGroupsConcatenate() {
        SchemaGraph graph = singleConditionGroup(SchemaGraph.empty(), Combinator.ANY_OF, BUSINESS, "company");
        graph = singleConditionGroup(graph, Combinator.ANY_OF, EU, "vat");

        Map<String, Object> schema = compiler.compile(graph);
        assertEquals(2, JsonValues.arrayAt(schema, "anyOf").size());
        assertFalse(schema.containsKey("allOf"));
    }

    @Test
    void mixedCombinatorsAreWrappedInAllOf() {
        SchemaGraph graph = singleConditionGroup(SchemaGraph.empty(), Combinator.ANY_OF, BUSINESS, "company");
        graph = singleConditionGroup(graph, Combinator.ONE_OF, EU, "vat");

        Map<String, Object> schema = compiler.compile(graph);
        List<Object> allOf = JsonValues.arrayAt(schema, "allOf");
        assertEquals(2, allOf.size());
        assertTrue(JsonValues.asObject(allOf.get(0)).containsKey("anyOf"));
        assertTrue(JsonValues.asObject(allOf.get(1)).containsKey("oneOf"));
        assertFalse(schema.containsKey("anyOf"));
    }

    @Test
    void ifBlockCompilesToIfThenInAllOf() {
        NodeAdded block = GraphMutations.addNode(SchemaGraph.empty(),
            SchemaNode.builder(new NodeDetails.IfBlock(ADULT, null, null)).key("adult_check").build());
        SchemaGraph graph = GraphMutations.addNode(block.graph(), SchemaNode.string("licence", "Licence"),
            block.nodeId(), EdgeType.THEN).graph();

        Map<String, Object> entry = JsonValues.asObject(JsonValues.arrayAt(compiler.compile(graph), "allOf").get(0));
        assertEquals(PredicateCompiler.compile(ADULT), entry.get("if"));
        assertEquals(List.of("licence"), List.copyOf(JsonValues.objectAt(
            JsonValues.objectAt(entry, "then"), "properties").keySet()));
        assertNull(entry.get("else"));
    }

    @Test
    void onlyReachableDefinitionsAreEmittedTransitively() {
        NodeAdded address = GraphMutations.createDefinition(SchemaGraph.empty(), "address",
            SchemaNode.object("address", "Address"));
        SchemaGraph graph = GraphMutations.addNode(address.graph(), SchemaNode.string("street", "Street"),
            address.nodeId()).graph();
        graph = GraphMutations.createDefinition(graph, "unused", SchemaNode.string("unused", "Unused")).graph();
        NodeAdded country = GraphMutations.createDefinition(graph, "country", SchemaNode.string("code", "Country"));
        graph = GraphMutations.createRefToDefinition(country.graph(), "country", address.nodeId()).graph();
        graph = GraphMutations.createRefToDefinition(graph, "address", SchemaGraph.ROOT_ID, "home").graph();

        Map<String, Object> schema = compiler.compile(graph);

        assertEquals(Map.of("$ref", "#/definitions/address", "title", "Address"), property(schema, "home"));
        Map<String, Object> definitions = JsonValues.objectAt(schema, "definitions");
        assertEquals(List.of("address", "country"), List.copyOf(definitions.keySet()));
        Map<String, Object> nested = property(JsonValues.objectAt(definitions, "address"), "country");
        assertEquals("#/definitions/country", nested.get("$ref"));
    }

    @Test
    void unresolvedReferenceFailsCompilation() {
        NodeAdded address = GraphMutations.createDefinition(SchemaGraph.empty(), "address",
            SchemaNode.object("address", "Address"));
        SchemaGraph graph = GraphMutations.createRefToDefinition(address.graph(), "address", SchemaGraph.ROOT_ID)
            .graph();
        SchemaGraph broken = GraphMutations.removeNode(graph, address.nodeId());

        var error = assertThrows(SchemaCompileException.class, () -> compiler.compile(broken));
        assertTrue(error.getMessage().startsWith("Unresolved reference 'address'"), error.getMessage());
    }

    @Test
    void resultsAreCachedPerGraphAndReadOnly() {
        SchemaGraph graph = GraphMutations.addNode(SchemaGraph.empty(), SchemaNode.string("name", "Name")).graph();
        assertFalse(compiler.isCached(graph));

        Map<String, Object> first = compiler.compile(graph);
        assertSame(first, compiler.compile(graph));
        assertTrue(compiler.isCached(graph));
        assertThrows(UnsupportedOperationException.class, () -> first.put("extra", 1));

        compiler.clearCache();
        assertFalse(compiler.isCached(graph));
        assertEquals(first, compiler.compile(graph));
    }

    private static SchemaGraph twoBranchGroup(Combinator combinator) {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), combinator, SchemaGraph.ROOT_ID);
        NodeAdded company = GraphMutations.addNode(group.graph(), SchemaNode.string("company", "Company"),
            group.nodeId(), EdgeType.THEN);
        NodeAdded vat = GraphMutations.addNode(company.graph(),
            SchemaNode.builder(NodeKind.STRING).key("vat").title("VAT").required(true).build(),
            group.nodeId(), EdgeType.THEN);
        SchemaGraph graph = ConditionalGroups.addCondition(vat.graph(), group.nodeId(),
            new Condition(BUSINESS, company.nodeId(), null));
        return ConditionalGroups.addCondition(graph, group.nodeId(), new Condition(EU, vat.nodeId(), null));
    }

    private static SchemaGraph singleConditionGroup(SchemaGraph graph, Combinator combinator, Predicate when,
                                                    String thenKey) {
        NodeAdded group = ConditionalGroups.addGroup(graph, combinator, SchemaGraph.ROOT_ID);
        NodeAdded member = GraphMutations.addNode(group.graph(), SchemaNode.string(thenKey, thenKey),
            group.nodeId(), EdgeType.THEN);
        return ConditionalGroups.addCondition(member.graph(), group.nodeId(),
            new Condition(when, member.nodeId(), null));
    }

    private static Map<String, Object> property(Map<String, Object> schema, String key) {
        return JsonValues.objectAt(JsonValues.objectAt(schema, "properties"), key);
    }
}
