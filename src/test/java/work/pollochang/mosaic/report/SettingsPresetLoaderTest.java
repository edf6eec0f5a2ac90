package work.pollochang.mosaic.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.mosaic.color.DistanceMetric;
import work.pollochang.mosaic.engine.ColorMatching;
import work.pollochang.mosaic.engine.MosaicSettings;
import work.pollochang.mosaic.engine.NeighborDiversity;
import work.pollochang.mosaic.engine.Quality;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SettingsPresetLoaderTest {

    @TempDir
    Path tempDir;

    /**
     * 列舉值不分大小寫，未知欄位忽略，未出現的欄位使用預設值
     */
    @Test
    void testParse_ShouldApplyDefaultsAndIgnoreUnknownFields() throws Exception {
        String json = "{\"gridSize\": 20, \"quality\": \"high\", \"neighborDiversity\": \"disabled\", "
                + "\"seed\": 7, \"comment\": \"週末用\"}";

        MosaicSettings settings = new SettingsPresetLoader().parse(json);

        assertEquals(20, settings.getGridSize());
        assertEquals(32, settings.getTileSize());
        assertEquals(Quality.HIGH, settings.getQuality());
        assertEquals(ColorMatching.LAB, settings.getColorMatching());
        assertEquals(NeighborDiversity.DISABLED, settings.getNeighborDiversity());
        assertEquals(7L, settings.getSeed());
        assertEquals(DistanceMetric.CIEDE2000, settings.getDistanceMetric());
        assertFalse(settings.isDiversityEnabled());
    }

    @Test
    void testParse_InvalidValue_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new SettingsPresetLoader().parse("{\"gridSize\": 0}"));
    }

    @Test
    void testLoad_ShouldReadFile() throws Exception {
        Path preset = tempDir.resolve("preset.json");
        Files.writeString(preset, "{\"tileSize\": 16, \"colorMatching\": \"RGB\"}");

        MosaicSettings settings = new SettingsPresetLoader().load(preset);

        assertEquals(16, settings.getTileSize());
        assertEquals(50, settings.getGridSize());
        assertEquals(DistanceMetric.WEIGHTED_RGB, settings.getDistanceMetric());
    }

    @Test
    void testLoad_MissingFile_ShouldThrowIOException() {
        assertThrows(IOException.class, () -> new SettingsPresetLoader().load(tempDir.resolve("missing.json")));
    }
}
