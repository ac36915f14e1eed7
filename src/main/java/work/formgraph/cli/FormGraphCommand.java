package work.formgraph.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Logger;
import picocli.CommandLine;
import work.formgraph.api.EngineConfiguration;
import work.formgraph.api.EngineConfigurationLoader;
import work.formgraph.api.FormGraphEngine;
import work.formgraph.api.LogLevel;
import work.formgraph.graph.GraphValidation;
import work.formgraph.importer.ImportResult;
import work.formgraph.importer.ImportValidation;
import work.formgraph.importer.ImportValidator;

@CommandLine.Command(
    name = "formgraph",
    description = "Import a JSON Schema into a form graph and print the compiled schema and UI schema.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class FormGraphCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--schema"},
        required = true,
        paramLabel = "PATH|-",
        description = "JSON or YAML JSON Schema file; use '-' to read from stdin."
    )
    private String schemaSource;

    @CommandLine.Option(
        names = "--config",
        description = "formgraph.toml configuration file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    @CommandLine.Option(
        names = "--only",
        description = "Print only one document (schema|ui).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String only;

    @CommandLine.Option(
        names = "--validate",
        description = "Include the import and graph validation report in the output."
    )
    private boolean validate;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private InputStream stdin = System.in;

    FormGraphCommand withStdin(InputStream in) {
        this.stdin = in;
        return this;
    }

    @Override
    public Integer call() throws Exception {
        configureLogging(resolveLogLevel());
        String selection = only == null ? "all" : only.trim().toLowerCase(Locale.ROOT);
        if (!selection.equals("all") && !selection.equals("schema") && !selection.equals("ui")) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--only must be 'schema' or 'ui'");
        }

        EngineConfiguration configuration = configPath == null
            ? EngineConfiguration.defaults()
            : EngineConfigurationLoader.load(configPath);
        var engine = new FormGraphEngine(configuration);

        Map<String, Object> document = readSchema();
        ImportValidation preflight = ImportValidator.validate(document);
        if (!preflight.valid()) {
            throw new CommandLine.ExecutionException(spec.commandLine(),
                "Invalid schema: " + String.join("; ", preflight.errors()));
        }
        ImportResult imported = engine.fromJsonSchema(document);
        GraphValidation validation = engine.validateGraph(imported.graph());

        Map<String, Object> output = new LinkedHashMap<>();
        if (!selection.equals("ui")) {
            output.put("schema", engine.compileToJsonSchema(imported.graph()));
        }
        if (!selection.equals("schema")) {
            output.put("uiSchema", engine.generateUiSchema(imported.graph()));
        }
        if (validate) {
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("valid", validation.valid());
            report.put("errors", validation.errors());
            report.put("warnings", validation.warnings());
            report.put("importWarnings", imported.warnings());
            report.put("preflightWarnings", preflight.warnings());
            output.put("validation", report);
        }
        Object printed = selection.equals("all") || validate ? output : output.values().iterator().next();
        spec.commandLine().getOut().println(configuration.prettyPrint()
            ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(printed)
            : JSON.writeValueAsString(printed));
        spec.commandLine().getOut().flush();
        return validation.valid() ? 0 : 1;
    }

    private Map<String, Object> readSchema() {
        try {
            if ("-".equals(schemaSource)) {
                String text = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
                ObjectMapper mapper = text.trim().startsWith("{") ? JSON : YAML;
                return mapper.readValue(text, MAP_TYPE);
            }
            Path path = Paths.get(schemaSource);
            if (!Files.isRegularFile(path)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Schema file not found: " + path);
            }
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
            return mapper.readValue(Files.readString(path, StandardCharsets.UTF_8), MAP_TYPE);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(),
                "Unable to read schema: " + ex.getMessage(), ex);
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("FORMGRAPH_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }

    private static void configureLogging(LogLevel level) {
        Logger root = Logger.getLogger("");
        root.setLevel(level.julLevel());
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level.julLevel());
        }
    }
}
