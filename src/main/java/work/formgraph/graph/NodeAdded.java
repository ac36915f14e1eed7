package work.formgraph.graph;

/**
 * Result of an insertion: the new graph value and the id allocated for the inserted node.
 */
public record NodeAdded(SchemaGraph graph, String nodeId) {
    public SchemaNode node() {
        return graph.requireNode(nodeId);
    }
}
