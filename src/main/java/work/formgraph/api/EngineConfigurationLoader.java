package work.formgraph.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.formgraph.graph.NodeKind;
import work.formgraph.importer.ImportMode;
import work.formgraph.shared.DurationParser;
import work.formgraph.ui.Widget;
import work.formgraph.ui.WidgetCategory;
import work.formgraph.ui.WidgetRegistry;

/**
 * Reads {@link EngineConfiguration} from a {@code formgraph.toml} file. Unknown keys are ignored.
 */
public final class EngineConfigurationLoader {
    private static final Logger LOG = Logger.getLogger(EngineConfigurationLoader.class.getName());

    public static final String FILE_NAME = "formgraph.toml";

    private EngineConfigurationLoader() {}

    /** Loads {@code path}, or returns the defaults when the file does not exist. */
    public static EngineConfiguration load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return EngineConfiguration.defaults();
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + path, ex);
        }
    }

    /**
     * @throws IllegalArgumentException on a TOML syntax error or an invalid value
     */
    public static EngineConfiguration parse(String toml) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration: " + result.errors().get(0).toString());
        }
        var builder = EngineConfiguration.builder();

        String regeneration = result.getString("ui.regeneration");
        if (regeneration != null) {
            builder.regeneration(RegenerationPolicy.from(regeneration));
        }
        String debounce = result.getString("ui.debounce");
        if (debounce != null) {
            DurationParser.parse(debounce).ifPresent(builder::debounce);
        }
        String mode = result.getString("import.mode");
        if (mode != null) {
            builder.importMode(ImportMode.from(mode));
        }
        Boolean strict = result.getBoolean("import.strict-references");
        if (strict != null) {
            builder.strictReferences(strict);
        }
        Boolean pretty = result.getBoolean("export.pretty");
        if (pretty != null) {
            builder.prettyPrint(pretty);
        }

        TomlTable widgets = result.getTable("widgets");
        if (widgets != null && !widgets.isEmpty()) {
            var registry = WidgetRegistry.standard();
            for (String id : widgets.keySet()) {
                if (!(widgets.get(List.of(id)) instanceof TomlTable table)) {
                    LOG.warning(() -> "Ignoring widgets." + id + ": expected a table");
                    continue;
                }
                registry.register(widget(id, table));
            }
            builder.widgets(registry);
        }
        return builder.build();
    }

    private static Widget widget(String id, TomlTable table) {
        var kinds = new LinkedHashSet<NodeKind>();
        TomlArray types = table.getArray("types");
        if (types != null) {
            for (int i = 0; i < types.size(); i++) {
                String tag = types.getString(i);
                kinds.add(NodeKind.fromTag(tag).orElseThrow(
                    () -> new IllegalArgumentException("Unknown node type '" + tag + "' for widget " + id)));
            }
        }
        TomlTable optionTable = table.getTable("options");
        Map<String, Object> options = optionTable == null ? Map.of() : convertTable(optionTable);
        return new Widget(
            id,
            table.getString("name", () -> id),
            table.getString("display-name", () -> id),
            table.getString("description"),
            kinds,
            options,
            WidgetCategory.from(table.getString("category")));
    }

    private static Map<String, Object> convertTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertValue(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
