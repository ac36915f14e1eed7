package work.formgraph.compile;

import work.formgraph.shared.FormGraphException;

/**
 * Terminal compile failure, raised instead of emitting a schema that would point nowhere.
 */
public final class SchemaCompileException extends FormGraphException {
    public SchemaCompileException(String message) {
        super("compile_error", message);
    }
}
