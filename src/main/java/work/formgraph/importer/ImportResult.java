package work.formgraph.importer;

import java.util.List;
import work.formgraph.graph.SchemaGraph;

/**
 * Imported graph plus the fragments that were skipped or approximated on the way.
 */
public record ImportResult(SchemaGraph graph, List<String> warnings) {
    public ImportResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
