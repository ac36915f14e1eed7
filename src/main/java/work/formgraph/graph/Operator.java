package work.formgraph.graph;

import java.util.Optional;

/**
 * Comparison operators available to a {@link Predicate}.
 */
public enum Operator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_EQUAL("greater_equal"),
    LESS_EQUAL("less_equal"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    EMPTY("empty"),
    NOT_EMPTY("not_empty");

    private final String wireName;

    Operator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isNumeric() {
        return this == GREATER_THAN || this == LESS_THAN || this == GREATER_EQUAL || this == LESS_EQUAL;
    }

    public boolean takesValue() {
        return this != EMPTY && this != NOT_EMPTY;
    }

    public static Optional<Operator> fromWireName(String name) {
        for (Operator operator : values()) {
            if (operator.wireName.equals(name)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
