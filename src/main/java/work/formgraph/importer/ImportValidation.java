package work.formgraph.importer;

import java.util.List;

/**
 * Outcome of {@link ImportValidator}. Warnings never make a document invalid.
 */
public record ImportValidation(boolean valid, List<String> errors, List<String> warnings) {
    public ImportValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    static ImportValidation of(List<String> errors, List<String> warnings) {
        return new ImportValidation(errors.isEmpty(), errors, warnings);
    }
}
