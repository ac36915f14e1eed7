package work.formgraph.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import work.formgraph.compile.SchemaCompiler;
import work.formgraph.graph.EdgeType;
import work.formgraph.graph.GraphMutations;
import work.formgraph.graph.GraphValidation;
import work.formgraph.graph.GraphValidator;
import work.formgraph.graph.NodeAdded;
import work.formgraph.graph.NodePatch;
import work.formgraph.graph.SchemaGraph;
import work.formgraph.graph.SchemaNode;
import work.formgraph.importer.ImportMode;
import work.formgraph.importer.ImportResult;
import work.formgraph.importer.SchemaImporter;
import work.formgraph.ui.UiSchemaGenerator;

/**
 * Public entry point for embedding the engine in an editor.
 *
 * <p>Every operation takes the current graph value and returns a new one; the engine itself only holds the
 * configuration and the compile and UI schema caches.
 */
public final class FormGraphEngine {
    private static final Logger LOG = Logger.getLogger(FormGraphEngine.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private final EngineConfiguration configuration;
    private final SchemaCompiler compiler;
    private final UiSchemaGenerator uiGenerator;
    private final SchemaImporter importer;

    public FormGraphEngine() {
        this(EngineConfiguration.defaults());
    }

    public FormGraphEngine(EngineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.compiler = new SchemaCompiler();
        this.uiGenerator = new UiSchemaGenerator(configuration.widgets(), compiler);
        this.importer = new SchemaImporter(configuration.strictReferences());
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public SchemaGraph createGraph() {
        return SchemaGraph.empty();
    }

    public NodeAdded addNode(SchemaGraph graph, SchemaNode data) {
        return GraphMutations.addNode(graph, data);
    }

    public NodeAdded addNode(SchemaGraph graph, SchemaNode data, String parentId) {
        return GraphMutations.addNode(graph, data, parentId);
    }

    public NodeAdded addNode(SchemaGraph graph, SchemaNode data, String parentId, EdgeType edgeType) {
        return GraphMutations.addNode(graph, data, parentId, edgeType);
    }

    public SchemaGraph removeNode(SchemaGraph graph, String nodeId) {
        return GraphMutations.removeNode(graph, nodeId);
    }

    public SchemaGraph updateNode(SchemaGraph graph, String nodeId, NodePatch patch) {
        return GraphMutations.updateNode(graph, nodeId, patch);
    }

    public SchemaGraph moveNode(SchemaGraph graph, String nodeId, String newParentId) {
        return GraphMutations.moveNode(graph, nodeId, newParentId);
    }

    public SchemaGraph moveNode(SchemaGraph graph, String nodeId, String newParentId, EdgeType edgeType) {
        return GraphMutations.moveNode(graph, nodeId, newParentId, edgeType);
    }

    public SchemaGraph reorderNode(SchemaGraph graph, String nodeId, int newIndex) {
        return GraphMutations.reorderNode(graph, nodeId, newIndex);
    }

    public SchemaGraph saveAsDefinition(SchemaGraph graph, String name, String nodeId, boolean disconnect) {
        return GraphMutations.saveAsDefinition(graph, name, nodeId, disconnect);
    }

    public NodeAdded createRefToDefinition(SchemaGraph graph, String name, String parentId) {
        return GraphMutations.createRefToDefinition(graph, name, parentId);
    }

    public NodeAdded createRefToDefinition(SchemaGraph graph, String name, String parentId, String key) {
        return GraphMutations.createRefToDefinition(graph, name, parentId, key);
    }

    public GraphValidation validateGraph(SchemaGraph graph) {
        return GraphValidator.validate(graph);
    }

    public Map<String, Object> compileToJsonSchema(SchemaGraph graph) {
        return compiler.compile(graph);
    }

    /** Imports with the configured {@link ImportMode}. */
    public ImportResult fromJsonSchema(Object schema) {
        return fromJsonSchema(schema, configuration.importMode());
    }

    public ImportResult fromJsonSchema(Object schema, ImportMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (mode == ImportMode.MERGE) {
            LOG.info("Import mode 'merge' is not implemented; replacing the graph instead");
        }
        return importer.importSchema(schema);
    }

    public Map<String, Object> generateUiSchema(SchemaGraph graph) {
        return uiGenerator.generate(graph);
    }

    public SchemaExport export(SchemaGraph graph) {
        return new SchemaExport(compileToJsonSchema(graph), generateUiSchema(graph));
    }

    /** Serializes {@code {schema, uiSchema}}, pretty-printed unless the configuration says otherwise. */
    public String exportJson(SchemaGraph graph) {
        return toJson(export(graph).toSerializableMap());
    }

    String toJson(Object value) {
        try {
            return configuration.prettyPrint()
                ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                : JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Unable to serialize export: " + ex.getOriginalMessage(), ex);
        }
    }
}
