package work.formgraph.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled JSON Schema and UI schema of one graph, as handed to a form renderer.
 */
public record SchemaExport(Map<String, Object> schema, Map<String, Object> uiSchema) {
    public SchemaExport {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(uiSchema, "uiSchema");
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("schema", schema);
        out.put("uiSchema", uiSchema);
        return out;
    }
}
