package work.formgraph.graph;

/**
 * Raised when an edge type is not allowed between two nodes (e.g. a then edge from a plain field).
 */
public final class InvalidEdgeException extends GraphStructureException {
    public InvalidEdgeException(String message) {
        super("invalid_edge", message);
    }
}
