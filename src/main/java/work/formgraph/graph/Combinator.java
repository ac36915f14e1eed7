package work.formgraph.graph;

import java.util.Optional;

/**
 * JSON Schema combinator carried by a conditional group.
 */
public enum Combinator {
    ALL_OF("allOf", NodeKind.ALL_OF),
    ANY_OF("anyOf", NodeKind.ANY_OF),
    ONE_OF("oneOf", NodeKind.ONE_OF);

    private final String keyword;
    private final NodeKind kind;

    Combinator(String keyword, NodeKind kind) {
        this.keyword = keyword;
        this.kind = kind;
    }

    public String keyword() {
        return keyword;
    }

    public NodeKind kind() {
        return kind;
    }

    /** anyOf/oneOf need an explicit else on every branch so non-matching conditions fail. */
    public boolean isStrict() {
        return this != ALL_OF;
    }

    public static Optional<Combinator> fromKeyword(String keyword) {
        for (Combinator combinator : values()) {
            if (combinator.keyword.equals(keyword)) {
                return Optional.of(combinator);
            }
        }
        return Optional.empty();
    }
}
