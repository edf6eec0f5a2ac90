package work.pollochang.mosaic.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.TileInput;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImageLoaderTest {

    @TempDir
    Path tempDir;

    /**
     * 建立測試圖片並寫成 PNG
     */
    private Path createTestImage(String name, int width, int height, Color color) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = image.createGraphics();
        g2d.setColor(color);
        g2d.fillRect(0, 0, width, height);
        g2d.dispose();
        Path path = tempDir.resolve(name);
        ImageIO.write(image, "png", path.toFile());
        return path;
    }

    @Test
    void testDecodeWithSubsampling_LargeImage_ShouldSubsample() throws Exception {
        Path path = createTestImage("large.png", 600, 300, Color.ORANGE);

        try (DecodedImage decoded = ImageLoader.decodeWithSubsampling(path, 256)) {
            assertEquals(300, decoded.image().getWidth());
            assertEquals(150, decoded.image().getHeight());
        }
    }

    @Test
    void testDecodeWithSubsampling_SmallImage_ShouldKeepSize() throws Exception {
        Path path = createTestImage("small.png", 100, 50, Color.ORANGE);

        try (DecodedImage decoded = ImageLoader.decodeWithSubsampling(path, 256)) {
            assertEquals(100, decoded.image().getWidth());
            assertEquals(50, decoded.image().getHeight());
        }
    }

    @Test
    void testListImageFiles_ShouldFilterAndSort() throws Exception {
        createTestImage("b.png", 4, 4, Color.RED);
        createTestImage("a.png", 4, 4, Color.BLUE);
        Files.writeString(tempDir.resolve("notes.txt"), "不是圖片");
        Files.writeString(tempDir.resolve("c.JPG"), "副檔名不分大小寫");
        Files.createDirectory(tempDir.resolve("nested.png"));

        List<Path> files = ImageLoader.listImageFiles(tempDir);

        assertEquals(List.of(tempDir.resolve("a.png"), tempDir.resolve("b.png"), tempDir.resolve("c.JPG")), files);
    }

    @Test
    void testListImageFiles_NotDirectory_ShouldThrow() throws Exception {
        Path file = createTestImage("single.png", 4, 4, Color.RED);
        assertThrows(IOException.class, () -> ImageLoader.listImageFiles(file));
    }

    @Test
    void testTileInput_ShouldDecodeLazily() throws Exception {
        Path path = createTestImage("tile.png", 20, 10, Color.GREEN);

        TileInput input = ImageLoader.tileInput(path);
        PixelBuffer pixels = input.source().resolve();

        assertEquals("tile.png", input.filename());
        assertEquals(path.toAbsolutePath().normalize().toString(), input.id());
        assertEquals(20, pixels.width());
        assertEquals(10, pixels.height());
        assertEquals(255, pixels.green(0));
    }

    /**
     * 無法解碼的檔案在解析時才以 IllegalArgumentException 回報
     */
    @Test
    void testTileInput_BrokenFile_ShouldFailOnResolve() throws Exception {
        Path broken = tempDir.resolve("broken.png");
        Files.writeString(broken, "not really a png");

        TileInput input = ImageLoader.tileInput(broken);

        assertThrows(IllegalArgumentException.class, () -> input.source().resolve());
    }

    @Test
    void testLoadSource_ShouldResolveToPixels() throws Exception {
        Path path = createTestImage("source.png", 40, 30, Color.BLUE);

        PixelBuffer pixels = ImageLoader.loadSource(path).resolve();

        assertEquals(40, pixels.width());
        assertEquals(255, pixels.blue(0));
    }
}
