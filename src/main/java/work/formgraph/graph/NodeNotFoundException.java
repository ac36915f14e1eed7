package work.formgraph.graph;

/**
 * Raised when an operation names a node id absent from the graph.
 */
public final class NodeNotFoundException extends GraphStructureException {
    public NodeNotFoundException(String message) {
        super("node_not_found", message);
    }
}
