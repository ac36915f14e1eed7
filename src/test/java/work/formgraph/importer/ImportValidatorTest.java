package work.formgraph.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ImportValidatorTest {
    @Test
    void acceptsAPlainObjectSchema() {
        ImportValidation validation = ImportValidator.validate(Map.of("type", "object", "properties", Map.of()));
        assertTrue(validation.valid());
        assertTrue(validation.errors().isEmpty());
        assertTrue(validation.warnings().isEmpty());
    }

    @Test
    void rejectsNonObjectsAndShapelessSchemas() {
        assertEquals(List.of("Schema must be an object"), ImportValidator.validate("nope").errors());

        ImportValidation shapeless = ImportValidator.validate(Map.of("title", "Nothing"));
        assertFalse(shapeless.valid());
        assertTrue(shapeless.errors().get(0).startsWith("Schema must have at least one of: type"));
    }

    @Test
    void reportsMalformedStructure() {
        ImportValidation validation = ImportValidator.validate(Map.of(
            "properties", List.of(),
            "definitions", "x",
            "allOf", List.of(Map.of(), "bad"),
            "if", Map.of(),
            "then", 3));

        assertFalse(validation.valid());
        assertTrue(validation.errors().contains("properties must be an object"));
        assertTrue(validation.errors().contains("definitions must be an object"));
        assertTrue(validation.errors().contains("allOf[1] must be an object"));
        assertTrue(validation.errors().contains("then must be an object"));
    }

    @Test
    void unknownTypesAndEmptyCombinatorsOnlyWarn() {
        ImportValidation validation = ImportValidator.validate(Map.of("type", "money", "anyOf", List.of()));
        assertTrue(validation.valid());
        assertTrue(validation.warnings().contains("Unknown type: money"));
        assertTrue(validation.warnings().contains("anyOf is empty"));

        ImportValidation union = ImportValidator.validate(Map.of("type", List.of("string", "date", "time")));
        assertEquals(List.of("Unknown types: date, time"), union.warnings());
    }

    @Test
    void combinedBundleNeedsASchema() {
        assertEquals(List.of("Import data must be an object"), ImportValidator.validateCombined(List.of()).errors());
        assertEquals(List.of("Missing required field: schema"),
            ImportValidator.validateCombined(Map.of("uiSchema", Map.of())).errors());

        ImportValidation bundle = ImportValidator.validateCombined(Map.of(
            "schema", Map.of("type", "object"),
            "uiSchema", "x",
            "formData", 1));
        assertTrue(bundle.valid());
        assertTrue(bundle.warnings().contains("uiSchema must be an object"));
        assertTrue(bundle.warnings().contains("formData must be an object"));
    }

    @Test
    void summaryCountsTopLevelParts() {
        Map<String, Object> schema = Map.of(
            "properties", Map.of("a", Map.of(), "b", Map.of()),
            "definitions", Map.of("d", Map.of()),
            "allOf", List.of(Map.of(), Map.of()),
            "oneOf", List.of(Map.of()),
            "if", Map.of());
        assertEquals(new SchemaSummary(2, 1, 4), ImportValidator.summarize(schema));
        assertEquals(SchemaSummary.EMPTY, ImportValidator.summarize(null));
    }
}
