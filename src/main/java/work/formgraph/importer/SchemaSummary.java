package work.formgraph.importer;

/**
 * Top-level counts shown before an import is confirmed.
 */
public record SchemaSummary(int fieldCount, int definitionCount, int conditionalCount) {
    public static final SchemaSummary EMPTY = new SchemaSummary(0, 0, 0);
}
