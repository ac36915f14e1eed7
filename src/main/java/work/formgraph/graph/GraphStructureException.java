package work.formgraph.graph;

import work.formgraph.shared.FormGraphException;

/**
 * Raised when a mutation would break a structural invariant of the graph.
 * The graph value passed to the failing call is never modified.
 */
public class GraphStructureException extends FormGraphException {
    public GraphStructureException(String code, String message) {
        super(code, message);
    }
}
