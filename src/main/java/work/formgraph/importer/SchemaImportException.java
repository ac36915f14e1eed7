package work.formgraph.importer;

import work.formgraph.shared.FormGraphException;

/**
 * Terminal import failure: the document is not an object, or a reference stays dangling under strict references.
 */
public final class SchemaImportException extends FormGraphException {
    public SchemaImportException(String message) {
        super("import_error", message);
    }
}
