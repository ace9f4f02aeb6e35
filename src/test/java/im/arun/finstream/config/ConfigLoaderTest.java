package im.arun.finstream.config;

import im.arun.finstream.layout.AnchorPolicy;
import im.arun.finstream.layout.ColumnMatchPolicy;
import im.arun.finstream.text.NumericMatchPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @Test
    void classpathDefaultsMatchBuiltInTuning() {
        StreamerConfig config = new ConfigLoader().load();

        assertEquals(20f, config.getHorizontalTolerance());
        assertEquals(3f, config.getVerticalTolerance());
        assertFalse(config.isMaskValues());
        assertEquals(NumericMatchPolicy.EMBEDDED, config.getNumericMatchPolicy());
        assertEquals(ColumnMatchPolicy.FIRST_MATCH, config.getColumnMatchPolicy());
        assertEquals(AnchorPolicy.FIRST_MEMBER, config.getAnchorPolicy());
    }

    @Test
    void readsYamlFile(@TempDir Path dir) throws Exception {
        Path yaml = dir.resolve("tuning.yaml");
        Files.writeString(yaml, "horizontalTolerance: 12.5\n"
            + "maskValues: true\n"
            + "maskChar: \"#\"\n"
            + "numericMatchPolicy: WHOLE_TOKEN\n"
            + "someFutureKey: 1\n");

        StreamerConfig config = new ConfigLoader(yaml.toString()).load();

        assertEquals(12.5f, config.getHorizontalTolerance());
        assertEquals(3f, config.getVerticalTolerance());
        assertTrue(config.isMaskValues());
        assertEquals('#', config.getMaskChar());
        assertEquals(NumericMatchPolicy.WHOLE_TOKEN, config.getNumericMatchPolicy());
    }

    @Test
    void brokenYamlFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path yaml = dir.resolve("broken.yaml");
        Files.writeString(yaml, "horizontalTolerance: [unterminated\n");

        StreamerConfig config = new ConfigLoader(yaml.toString()).load();

        assertEquals(20f, config.getHorizontalTolerance());
    }

    @Test
    void userOptionsOverrideLoadedValues() {
        Map<String, Object> options = new HashMap<>();
        options.put("x_tolerance", 5);
        options.put("verticalTolerance", 1.5);
        options.put("mask", "yes");
        options.put("mask_char", "*");
        options.put("column_match_policy", "nearest");
        options.put("anchorPolicy", "running-centroid");

        StreamerConfig config = new ConfigLoader().load(options);

        assertEquals(5f, config.getHorizontalTolerance());
        assertEquals(1.5f, config.getVerticalTolerance());
        assertTrue(config.isMaskValues());
        assertEquals('*', config.getMaskChar());
        assertEquals(ColumnMatchPolicy.NEAREST, config.getColumnMatchPolicy());
        assertEquals(AnchorPolicy.RUNNING_CENTROID, config.getAnchorPolicy());
    }

    @Test
    void ignoresNegativeTolerancesAndBadValues() {
        Map<String, Object> options = new HashMap<>();
        options.put("x_tolerance", -4);
        options.put("y_tolerance", "wide");
        options.put("numeric_match_policy", "fuzzy");
        options.put("unknown", true);

        StreamerConfig config = new ConfigLoader().load(options);

        assertEquals(20f, config.getHorizontalTolerance());
        assertEquals(3f, config.getVerticalTolerance());
        assertEquals(NumericMatchPolicy.EMBEDDED, config.getNumericMatchPolicy());
    }

    @Test
    void loadReturnsIndependentCopies() {
        ConfigLoader loader = new ConfigLoader();
        StreamerConfig first = loader.load();
        first.setHorizontalTolerance(99);

        assertEquals(20f, loader.load().getHorizontalTolerance());
    }
}
