package work.pollochang.mosaic.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @TempDir
    Path tempDir;

    @Test
    void testFormatDuration() {
        assertEquals("0:00", FileTools.formatDuration(0));
        assertEquals("1:05", FileTools.formatDuration(65_000));
        assertEquals("1:02:03", FileTools.formatDuration(3_723_000));
        assertEquals("0:00", FileTools.formatDuration(-10));
    }

    @Test
    void testFormatFileSize() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("512 B", FileTools.formatFileSize(512));
    }

    @Test
    void testEnsureDirectoryExists_ShouldCreateNestedDirectories() {
        Path nested = tempDir.resolve("a/b/c");
        FileTools.ensureDirectoryExists(nested);
        assertTrue(Files.isDirectory(nested));
    }
}
