package work.formgraph.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable working copy used inside one mutation. Discarded on failure, frozen into a new graph on success.
 */
final class GraphDraft {
    private final Map<String, SchemaNode> nodes;
    private final Map<String, Edge> edges;
    private final Map<String, String> definitions;
    private long sequence;

    GraphDraft(Map<String, SchemaNode> nodes, Map<String, Edge> edges, Map<String, String> definitions,
               long sequence) {
        this.nodes = new LinkedHashMap<>(nodes);
        this.edges = new LinkedHashMap<>(edges);
        this.definitions = new LinkedHashMap<>(definitions);
        this.sequence = sequence;
    }

    String nextNodeId() {
        String id;
        do {
            id = "node_" + (++sequence);
        } while (nodes.containsKey(id));
        return id;
    }

    private String nextEdgeId() {
        String id;
        do {
            id = "edge_" + (++sequence);
        } while (edges.containsKey(id));
        return id;
    }

    Map<String, SchemaNode> nodes() {
        return nodes;
    }

    Map<String, Edge> edges() {
        return edges;
    }

    Map<String, String> definitions() {
        return definitions;
    }

    void putNode(SchemaNode node) {
        nodes.put(node.id(), node);
    }

    /** Appends an edge at the end of its (source, type) bucket. */
    Edge appendEdge(String sourceId, String targetId, EdgeType type) {
        int max = 0;
        for (Edge edge : edges.values()) {
            if (edge.sourceId().equals(sourceId) && edge.type() == type) {
                max = Math.max(max, edge.order());
            }
        }
        var edge = new Edge(nextEdgeId(), sourceId, targetId, type, max + 1);
        edges.put(edge.id(), edge);
        return edge;
    }

    List<Edge> bucket(String sourceId, EdgeType type) {
        var out = new ArrayList<Edge>();
        for (Edge edge : edges.values()) {
            if (edge.sourceId().equals(sourceId) && edge.type() == type) {
                out.add(edge);
            }
        }
        out.sort(Comparator.comparingInt(Edge::order));
        return out;
    }

    /** Rewrites the orders of the given edges to 1..n in list order. */
    void renumber(List<Edge> ordered) {
        int order = 1;
        for (Edge edge : ordered) {
            edges.put(edge.id(), edge.withOrder(order++));
        }
    }

    SchemaGraph build() {
        return new SchemaGraph(nodes, edges, definitions, sequence);
    }
}
