package work.formgraph.api;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import work.formgraph.graph.SchemaGraph;
import work.formgraph.importer.ImportResult;

/**
 * Holds the graph a host editor is working on and decides when its UI schema is regenerated.
 *
 * <p>Mutations mark the UI schema stale. Under {@link RegenerationPolicy#DEBOUNCED} the host calls {@link #tick()}
 * from its event loop and regeneration happens once the debounce window has elapsed since the last mutation, so a
 * burst of edits costs one regeneration. Imports regenerate synchronously. No threads are started.
 */
public final class FormBuilderSession {
    private static final Logger LOG = Logger.getLogger(FormBuilderSession.class.getName());

    private final FormGraphEngine engine;
    private final Clock clock;
    private SchemaGraph graph;
    private Map<String, Object> uiSchema;
    private Instant lastMutation;
    private boolean stale;
    private int regenerations;

    public FormBuilderSession(FormGraphEngine engine) {
        this(engine, Clock.systemUTC());
    }

    public FormBuilderSession(FormGraphEngine engine, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.graph = engine.createGraph();
        regenerate();
    }

    public SchemaGraph graph() {
        return graph;
    }

    /** Last generated UI schema; may lag behind {@link #graph()} while {@link #isStale()}. */
    public Map<String, Object> uiSchema() {
        return uiSchema;
    }

    public boolean isStale() {
        return stale;
    }

    public int regenerations() {
        return regenerations;
    }

    /**
     * Replaces the graph with {@code mutation(graph)}. When the mutation throws, the session keeps its current graph.
     */
    public SchemaGraph apply(UnaryOperator<SchemaGraph> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        SchemaGraph next = Objects.requireNonNull(mutation.apply(graph), "mutation result");
        if (next == graph) {
            return graph;
        }
        graph = next;
        lastMutation = clock.instant();
        stale = true;
        if (engine.configuration().regeneration() == RegenerationPolicy.IMMEDIATE) {
            regenerate();
        }
        return graph;
    }

    /**
     * Regenerates when stale and the debounce window since the last mutation has passed.
     *
     * @return true when a regeneration happened
     */
    public boolean tick() {
        if (!stale) {
            return false;
        }
        Instant due = lastMutation.plus(engine.configuration().debounce());
        if (clock.instant().isBefore(due)) {
            return false;
        }
        regenerate();
        return true;
    }

    /** Regenerates now if stale. */
    public boolean flush() {
        if (!stale) {
            return false;
        }
        regenerate();
        return true;
    }

    /** Imports {@code schema} as the new graph and regenerates right away. */
    public ImportResult replaceFromJsonSchema(Object schema) {
        ImportResult result = engine.fromJsonSchema(schema);
        graph = result.graph();
        lastMutation = clock.instant();
        regenerate();
        return result;
    }

    public SchemaExport export() {
        flush();
        return engine.export(graph);
    }

    private void regenerate() {
        uiSchema = engine.generateUiSchema(graph);
        stale = false;
        regenerations++;
        LOG.fine(() -> "Regenerated UI schema (" + regenerations + ")");
    }
}
