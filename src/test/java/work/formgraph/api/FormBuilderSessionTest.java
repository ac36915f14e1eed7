package work.formgraph.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.formgraph.graph.GraphMutations;
import work.formgraph.graph.NodeNotFoundException;
import work.formgraph.graph.SchemaNode;
import work.formgraph.importer.ImportResult;
import work.formgraph.ui.UiSchemaGenerator;

class FormBuilderSessionTest {
    private final ManualClock clock = new ManualClock();

    @Test
    void startsWithAnEmptyGraphAndItsUiSchema() {
        var session = new FormBuilderSession(engine(RegenerationPolicy.DEBOUNCED), clock);
        assertEquals(1, session.regenerations());
        assertFalse(session.isStale());
        assertEquals(Map.of(), session.uiSchema());
    }

    @Test
    void burstOfMutationsRegeneratesOnceAfterTheDebounceWindow() {
        var session = new FormBuilderSession(engine(RegenerationPolicy.DEBOUNCED), clock);

        session.apply(graph -> GraphMutations.addNode(graph, SchemaNode.string("a", "A")).graph());
        clock.advance(Duration.ofMillis(100));
        session.apply(graph -> GraphMutations.addNode(graph, SchemaNode.string("b", "B")).graph());
        assertTrue(session.isStale());

        clock.advance(Duration.ofMillis(249));
        assertFalse(session.tick());
        assertEquals(1, session.regenerations());

        clock.advance(Duration.ofMillis(1));
        assertTrue(session.tick());
        assertFalse(session.tick());
        assertEquals(2, session.regenerations());
        assertEquals(List.of("a", "b"), UiSchemaGenerator.orderKeys(session.uiSchema()));
    }

    @Test
    void immediatePolicyRegeneratesOnEveryMutation() {
        var session = new FormBuilderSession(engine(RegenerationPolicy.IMMEDIATE), clock);

        session.apply(graph -> GraphMutations.addNode(graph, SchemaNode.string("a", "A")).graph());
        session.apply(graph -> GraphMutations.addNode(graph, SchemaNode.string("b", "B")).graph());

        assertEquals(3, session.regenerations());
        assertFalse(session.isStale());
        assertEquals(List.of("a", "b"), UiSchemaGenerator.orderKeys(session.uiSchema()));
    }

    @Test
    void unchangedGraphDoesNotMarkStale() {
        var session = new FormBuilderSession(engine(RegenerationPolicy.DEBOUNCED), clock);
        var before = session.graph();
        assertSame(before, session.apply(graph -> graph));
        assertFalse(session.isStale());
    }

    @Test
    void failedMutationKeepsTheCurrentGraph() {
        var session = new FormBuilderSession(engine(RegenerationPolicy.DEBOUNCED), clock);
        var before = session.graph();
        assertThrows(NodeNotFoundException.class, () -> session.apply(graph -> GraphMutations.removeNode(graph,
            "node_404")));
        assertSame(before, session.graph());
    }

    @Test
    void flushAndExportRegenerateStaleState() {
        var session = new FormBuilderSession(engine(RegenerationPolicy.DEBOUNCED), clock);
        session.apply(graph -> GraphMutations.addNode(graph, SchemaNode.string("a", "A")).graph());

        SchemaExport export = session.export();

        assertFalse(session.isStale());
        assertEquals(2, session.regenerations());
        assertEquals(List.of("a"), UiSchemaGenerator.orderKeys(export.uiSchema()));
        assertFalse(session.flush());
    }

    @Test
    void importRegeneratesSynchronously() {
        var session = new FormBuilderSession(engine(RegenerationPolicy.DEBOUNCED), clock);

        ImportResult result = session.replaceFromJsonSchema(Map.of(
            "type", "object",
            "properties", Map.of("email", Map.of("type", "string"))));

        assertFalse(result.hasWarnings());
        assertFalse(session.isStale());
        assertEquals(List.of("email"), UiSchemaGenerator.orderKeys(session.uiSchema()));
    }

    private static FormGraphEngine engine(RegenerationPolicy policy) {
        return new FormGraphEngine(EngineConfiguration.builder().regeneration(policy).build());
    }

    private static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
