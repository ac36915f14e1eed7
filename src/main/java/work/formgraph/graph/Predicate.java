package work.formgraph.graph;

import java.util.Objects;
import work.formgraph.shared.JsonValues;

/**
 * Single field test used in the {@code if} part of a condition.
 */
public record Predicate(String field, Operator operator, Object value) {
    public Predicate {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        if (field.isBlank()) {
            throw new IllegalArgumentException("Predicate field must not be blank");
        }
        value = JsonValues.freeze(value);
    }

    public static Predicate of(String field, Operator operator, Object value) {
        return new Predicate(field, operator, value);
    }
}
