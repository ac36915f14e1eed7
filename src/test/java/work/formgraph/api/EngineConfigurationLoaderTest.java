package work.formgraph.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.formgraph.graph.NodeKind;
import work.formgraph.importer.ImportMode;
import work.formgraph.ui.Widget;
import work.formgraph.ui.WidgetCategory;

class EngineConfigurationLoaderTest {
    @Test
    void loadsEverySection() throws URISyntaxException {
        Path file = Path.of(EngineConfigurationLoaderTest.class.getResource("/" + EngineConfigurationLoader.FILE_NAME)
            .toURI());

        EngineConfiguration config = EngineConfigurationLoader.load(file);

        assertEquals(RegenerationPolicy.IMMEDIATE, config.regeneration());
        assertEquals(Duration.ofSeconds(2), config.debounce());
        assertEquals(ImportMode.MERGE, config.importMode());
        assertFalse(config.strictReferences());
        assertFalse(config.prettyPrint());

        Widget rating = config.widgets().widget("rating").orElseThrow();
        assertEquals("StarRating", rating.name());
        assertEquals("Star Rating", rating.displayName());
        assertEquals(WidgetCategory.CUSTOM, rating.category());
        assertEquals(Set.of(NodeKind.NUMBER), rating.compatibleKinds());
        assertEquals(5L, rating.defaultOptions().get("stars"));
        assertEquals(List.of("poor", "great"), rating.defaultOptions().get("labels"));
        assertTrue(config.widgets().widget("yesno").isPresent());
    }

    @Test
    void missingFileGivesDefaults(@TempDir Path dir) {
        EngineConfiguration config = EngineConfigurationLoader.load(dir.resolve(EngineConfigurationLoader.FILE_NAME));

        assertEquals(RegenerationPolicy.DEBOUNCED, config.regeneration());
        assertEquals(EngineConfiguration.DEFAULT_DEBOUNCE, config.debounce());
        assertEquals(ImportMode.REPLACE, config.importMode());
        assertTrue(config.strictReferences());
        assertTrue(config.prettyPrint());
        assertEquals(7, config.widgets().widgets().size());
    }

    @Test
    void emptyDocumentGivesDefaults() {
        EngineConfiguration config = EngineConfigurationLoader.parse("");
        assertEquals(EngineConfiguration.DEFAULT_DEBOUNCE, config.debounce());
        assertSame(RegenerationPolicy.DEBOUNCED, config.regeneration());
    }

    @Test
    void invalidValuesAreRejected() {
        var syntax = assertThrows(IllegalArgumentException.class,
            () -> EngineConfigurationLoader.parse("[ui\nregeneration = "));
        assertTrue(syntax.getMessage().startsWith("Invalid configuration: "));

        var policy = assertThrows(IllegalArgumentException.class,
            () -> EngineConfigurationLoader.parse("[ui]\nregeneration = \"sometimes\""));
        assertEquals("Unsupported regeneration policy: sometimes", policy.getMessage());

        assertThrows(IllegalArgumentException.class,
            () -> EngineConfigurationLoader.parse("[ui]\ndebounce = \"3 days\""));
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfigurationLoader.parse("[widgets.dial]\ntypes = [\"dial\"]"));
    }

    @Test
    void builderRejectsNegativeDebounce() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfiguration.builder().debounce(Duration.ofMillis(-1)).build());
    }

    @Test
    void widgetOptionsConvertNestedTables() {
        EngineConfiguration config = EngineConfigurationLoader.parse(
            "[widgets.map]\ntypes = [\"object\"]\n[widgets.map.options]\nzoom = 3\ncenter = { lat = 1.5, lng = 2.5 }\n");
        Widget map = config.widgets().widget("map").orElseThrow();
        assertEquals(Map.of("lat", 1.5, "lng", 2.5), map.defaultOptions().get("center"));
        assertEquals(WidgetCategory.CUSTOM, map.category());
        assertEquals("map", map.name());
    }
}
