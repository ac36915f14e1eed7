package work.formgraph.graph;

import java.util.Objects;

/**
 * Typed, ordered link between two nodes. {@code order} sequences siblings inside one (source, type) bucket.
 */
public record Edge(String id, String sourceId, String targetId, EdgeType type, int order) {
    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(type, "type");
    }

    public Edge withOrder(int newOrder) {
        return new Edge(id, sourceId, targetId, type, newOrder);
    }

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }
}
