package work.formgraph.graph;

/**
 * Raised on any attempt to remove the root node.
 */
public final class RootRemovalException extends GraphStructureException {
    public RootRemovalException(String message) {
        super("root_removal", message);
    }
}
