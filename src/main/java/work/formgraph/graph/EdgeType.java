package work.formgraph.graph;

/**
 * Relationship carried by an {@link Edge}.
 */
public enum EdgeType {
    /** Structural containment (object property, array item). */
    CHILD("child"),
    /** Member of a conditional group's then branch. */
    THEN("then"),
    /** Member of a conditional group's else branch. */
    ELSE("else");

    private final String wireName;

    EdgeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isBranch() {
        return this != CHILD;
    }
}
