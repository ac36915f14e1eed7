package work.formgraph.graph;

/**
 * Raised when a definition name is not registered.
 */
public final class DefinitionNotFoundException extends GraphStructureException {
    public DefinitionNotFoundException(String message) {
        super("definition_not_found", message);
    }
}
