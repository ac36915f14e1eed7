package work.formgraph.graph;

/**
 * Raised when a definition name is already registered.
 */
public final class DuplicateDefinitionException extends GraphStructureException {
    public DuplicateDefinitionException(String message) {
        super("duplicate_definition", message);
    }
}
