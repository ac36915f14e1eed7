package work.formgraph.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.formgraph.shared.JsonValues;

/**
 * Cheap shape checks run on a document before it is handed to {@link SchemaImporter}.
 */
public final class ImportValidator {
    private static final Set<String> KNOWN_TYPES =
        Set.of("string", "number", "integer", "boolean", "object", "array", "null");
    private static final List<String> ENTRY_KEYWORDS =
        List.of("type", "properties", "definitions", "allOf", "anyOf", "oneOf", "if");

    private ImportValidator() {}

    public static ImportValidation validate(Object document) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        checkSchema(document, errors, warnings);
        return ImportValidation.of(errors, warnings);
    }

    /**
     * Validates an exported bundle {@code {schema, uiSchema?, formData?}}. Malformed optional parts are warnings.
     */
    public static ImportValidation validateCombined(Object bundle) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        Map<String, Object> map = JsonValues.asObject(bundle);
        if (map == null) {
            errors.add("Import data must be an object");
            return ImportValidation.of(errors, warnings);
        }
        if (!map.containsKey("schema")) {
            errors.add("Missing required field: schema");
        } else {
            checkSchema(map.get("schema"), errors, warnings);
        }
        if (map.containsKey("uiSchema") && JsonValues.asObject(map.get("uiSchema")) == null) {
            warnings.add("uiSchema must be an object");
        }
        if (map.containsKey("formData") && JsonValues.asObject(map.get("formData")) == null) {
            warnings.add("formData must be an object");
        }
        return ImportValidation.of(errors, warnings);
    }

    public static SchemaSummary summarize(Object document) {
        Map<String, Object> schema = JsonValues.asObject(document);
        if (schema == null) {
            return SchemaSummary.EMPTY;
        }
        Map<String, Object> properties = JsonValues.objectAt(schema, "properties");
        Map<String, Object> definitions = JsonValues.objectAt(schema, "definitions");
        int conditionals = 0;
        for (String keyword : List.of("allOf", "anyOf", "oneOf")) {
            List<Object> entries = JsonValues.arrayAt(schema, keyword);
            if (entries != null) {
                conditionals += entries.size();
            }
        }
        if (JsonValues.asObject(schema.get("if")) != null) {
            conditionals++;
        }
        return new SchemaSummary(
            properties == null ? 0 : properties.size(),
            definitions == null ? 0 : definitions.size(),
            conditionals);
    }

    private static void checkSchema(Object document, List<String> errors, List<String> warnings) {
        Map<String, Object> schema = JsonValues.asObject(document);
        if (schema == null) {
            errors.add("Schema must be an object");
            return;
        }
        if (ENTRY_KEYWORDS.stream().noneMatch(schema::containsKey)) {
            errors.add("Schema must have at least one of: " + String.join(", ", ENTRY_KEYWORDS));
        }
        Object type = schema.get("type");
        if (type instanceof String name && !KNOWN_TYPES.contains(name)) {
            warnings.add("Unknown type: " + name);
        } else if (type instanceof List<?> names) {
            var unknown = new ArrayList<String>();
            for (Object name : names) {
                if (name instanceof String text && !KNOWN_TYPES.contains(text)) {
                    unknown.add(text);
                }
            }
            if (!unknown.isEmpty()) {
                warnings.add("Unknown types: " + String.join(", ", unknown));
            }
        }
        if (schema.containsKey("properties") && JsonValues.asObject(schema.get("properties")) == null) {
            errors.add("properties must be an object");
        }
        if (schema.containsKey("definitions") && JsonValues.asObject(schema.get("definitions")) == null) {
            errors.add("definitions must be an object");
        }
        for (String keyword : List.of("allOf", "anyOf", "oneOf")) {
            if (schema.containsKey(keyword)) {
                checkSchemaArray(keyword, schema.get(keyword), errors, warnings);
            }
        }
        if (schema.containsKey("if")) {
            for (String keyword : List.of("if", "then", "else")) {
                if (schema.containsKey(keyword) && JsonValues.asObject(schema.get(keyword)) == null) {
                    errors.add(keyword + " must be an object");
                }
            }
        }
    }

    private static void checkSchemaArray(String keyword, Object value, List<String> errors, List<String> warnings) {
        List<Object> entries = JsonValues.asArray(value);
        if (entries == null) {
            errors.add(keyword + " must be an array");
            return;
        }
        if (entries.isEmpty()) {
            warnings.add(keyword + " is empty");
        }
        for (int i = 0; i < entries.size(); i++) {
            if (JsonValues.asObject(entries.get(i)) == null) {
                errors.add(keyword + "[" + i + "] must be an object");
            }
        }
    }
}
