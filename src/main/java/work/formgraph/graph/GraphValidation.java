package work.formgraph.graph;

import java.util.List;

/**
 * Advisory report produced by {@link GraphValidator}. {@code valid} is true when there are no errors; warnings do not
 * affect it.
 */
public record GraphValidation(boolean valid, List<String> errors, List<String> warnings) {
    public GraphValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static GraphValidation of(List<String> errors, List<String> warnings) {
        return new GraphValidation(errors.isEmpty(), errors, warnings);
    }
}
