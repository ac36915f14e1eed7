package work.formgraph.graph;

import java.util.Objects;

/**
 * One entry of a conditional group: a predicate plus optional then/else branch node ids.
 */
public record Condition(Predicate when, String thenId, String elseId) {
    public Condition {
        Objects.requireNonNull(when, "when");
    }

    public static Condition of(Predicate when) {
        return new Condition(when, null, null);
    }

    public Condition withThen(String nodeId) {
        return new Condition(when, nodeId, elseId);
    }

    public Condition withElse(String nodeId) {
        return new Condition(when, thenId, nodeId);
    }

    boolean references(String nodeId) {
        return nodeId.equals(thenId) || nodeId.equals(elseId);
    }
}
