package work.formgraph.graph;

/**
 * Raised when an edge would make a node its own structural ancestor.
 */
public final class CycleException extends GraphStructureException {
    public CycleException(String message) {
        super("cycle", message);
    }
}
