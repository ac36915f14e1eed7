package work.formgraph.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionalGroupsTest {
    private static final Predicate IS_BUSINESS = Predicate.of("account", Operator.EQUALS, "business");

    @Test
    void addGroupUsesCombinatorNaming() {
        NodeAdded first = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ANY_OF, SchemaGraph.ROOT_ID);
        NodeAdded second = ConditionalGroups.addGroup(first.graph(), Combinator.ANY_OF, SchemaGraph.ROOT_ID);

        assertEquals("anyOf_group", first.node().key());
        assertEquals("anyOf Group", first.node().title());
        assertEquals(NodeKind.ANY_OF, first.node().kind());
        assertEquals("anyOf_group_2", second.node().key());
        assertTrue(ConditionalGroups.conditions(second.graph(), first.nodeId()).isEmpty());
    }

    @Test
    void addConditionLinksDetachedBranchTargets() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ALL_OF, SchemaGraph.ROOT_ID);
        NodeAdded company = GraphMutations.createDefinition(group.graph(), "company",
            SchemaNode.string("company", "Company"));
        assertTrue(company.graph().incoming(company.nodeId()).isEmpty());

        SchemaGraph linked = ConditionalGroups.addCondition(company.graph(), group.nodeId(),
            new Condition(IS_BUSINESS, company.nodeId(), null));
        assertEquals(1, linked.outgoing(group.nodeId(), EdgeType.THEN).size());
        assertEquals(List.of(new Condition(IS_BUSINESS, company.nodeId(), null)),
            ConditionalGroups.conditions(linked, group.nodeId()));
        assertEquals(List.of("company"), ConditionalGroups.thenBranch(linked, group.nodeId()).stream()
            .map(SchemaNode::key).toList());
        assertTrue(ConditionalGroups.elseBranch(linked, group.nodeId()).isEmpty());
    }

    @Test
    void existingBranchEdgesAreNotDuplicated() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ALL_OF, SchemaGraph.ROOT_ID);
        NodeAdded company = GraphMutations.addNode(group.graph(), SchemaNode.string("company", "Company"),
            group.nodeId(), EdgeType.THEN);
        SchemaGraph linked = ConditionalGroups.addCondition(company.graph(), group.nodeId(),
            new Condition(IS_BUSINESS, company.nodeId(), null));
        assertEquals(1, linked.incoming(company.nodeId()).size());
    }

    @Test
    void branchTargetWithAnotherParentIsRejected() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ALL_OF, SchemaGraph.ROOT_ID);
        NodeAdded name = GraphMutations.addNode(group.graph(), SchemaNode.string("name", "Name"));
        assertThrows(InvalidEdgeException.class, () -> ConditionalGroups.addCondition(name.graph(), group.nodeId(),
            new Condition(IS_BUSINESS, name.nodeId(), null)));
    }

    @Test
    void groupCannotBeItsOwnBranch() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ONE_OF, SchemaGraph.ROOT_ID);
        assertThrows(CycleException.class, () -> ConditionalGroups.addCondition(group.graph(), group.nodeId(),
            new Condition(IS_BUSINESS, group.nodeId(), null)));
        assertThrows(CycleException.class, () -> ConditionalGroups.addCondition(group.graph(), group.nodeId(),
            new Condition(IS_BUSINESS, SchemaGraph.ROOT_ID, null)));
    }

    @Test
    void updateAndRemoveConditionsByIndex() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ALL_OF, SchemaGraph.ROOT_ID);
        SchemaGraph graph = ConditionalGroups.addCondition(group.graph(), group.nodeId(), Condition.of(IS_BUSINESS));
        graph = ConditionalGroups.addCondition(graph, group.nodeId(),
            Condition.of(Predicate.of("age", Operator.GREATER_THAN, 17)));

        Predicate replaced = Predicate.of("account", Operator.NOT_EQUALS, "personal");
        SchemaGraph updated = ConditionalGroups.updateCondition(graph, group.nodeId(), 0, Condition.of(replaced));
        assertEquals(replaced, ConditionalGroups.conditions(updated, group.nodeId()).get(0).when());

        SchemaGraph removed = ConditionalGroups.removeCondition(updated, group.nodeId(), 1);
        assertEquals(1, ConditionalGroups.conditions(removed, group.nodeId()).size());

        SchemaGraph finalGraph = removed;
        assertThrows(IllegalArgumentException.class,
            () -> ConditionalGroups.removeCondition(finalGraph, group.nodeId(), 3));
        assertThrows(IllegalArgumentException.class,
            () -> ConditionalGroups.updateCondition(finalGraph, group.nodeId(), -1, Condition.of(IS_BUSINESS)));
    }

    @Test
    void syncBranchesPointsEveryConditionAtTheSameNodes() {
        NodeAdded group = ConditionalGroups.addGroup(SchemaGraph.empty(), Combinator.ALL_OF, SchemaGraph.ROOT_ID);
        NodeAdded details = GraphMutations.addNode(group.graph(), SchemaNode.string("details", "Details"),
            group.nodeId(), EdgeType.THEN);
        SchemaGraph graph = ConditionalGroups.addCondition(details.graph(), group.nodeId(), Condition.of(IS_BUSINESS));
        graph = ConditionalGroups.addCondition(graph, group.nodeId(),
            Condition.of(Predicate.of("vat", Operator.NOT_EMPTY, null)));

        SchemaGraph synced = ConditionalGroups.syncBranches(graph, group.nodeId(), details.nodeId(), null);
        for (Condition condition : ConditionalGroups.conditions(synced, group.nodeId())) {
            assertEquals(details.nodeId(), condition.thenId());
        }
        assertSame(synced, ConditionalGroups.syncBranches(synced, group.nodeId(), details.nodeId(), null));
    }

    @Test
    void nonGroupNodesAreRejected() {
        NodeAdded field = GraphMutations.addNode(SchemaGraph.empty(), SchemaNode.string("name", "Name"));
        assertThrows(InvalidEdgeException.class,
            () -> ConditionalGroups.addCondition(field.graph(), field.nodeId(), Condition.of(IS_BUSINESS)));
        assertThrows(InvalidEdgeException.class, () -> ConditionalGroups.conditions(field.graph(), field.nodeId()));
    }
}
