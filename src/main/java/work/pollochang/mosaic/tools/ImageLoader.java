package work.pollochang.mosaic.tools;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.PixelSource;
import work.pollochang.mosaic.core.TileInput;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 檔案邊界的圖片解碼。引擎本身只接受像素，所有格式解碼都在這裡完成。
 */
@Slf4j
public class ImageLoader {

    /** 來源圖片初步讀取的長邊目標。 */
    public static final int SOURCE_MAX_DIMENSION = 4096;
    /** 磁磚最後只會保留 64x64，讀取時先取樣到這個尺寸附近即可。 */
    public static final int TILE_MAX_DIMENSION = 256;

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "bmp", "tif", "tiff");

    /**
     * 讀取圖片，長邊超過 {@code preferredMaxDimension} 時套用整數二次取樣以降低記憶體使用。
     *
     * @throws IOException 檔案無法讀取或沒有對應的讀取器
     */
    public static DecodedImage decodeWithSubsampling(Path inputPath, int preferredMaxDimension) throws IOException {
        try (InputStream stream = Files.newInputStream(inputPath);
             ImageInputStream in = ImageIO.createImageInputStream(stream)) {
            if (in == null) {
                throw new IOException("無法建立圖片輸入流: " + inputPath);
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IOException("找不到對應的圖片讀取器: " + inputPath);
            }

            ImageReader reader = readers.next();
            reader.setInput(in, true, true);

            try {
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = 1;
                int maxDim = Math.max(width, height);
                if (maxDim > preferredMaxDimension) {
                    subsampling = (int) Math.floor((double) maxDim / preferredMaxDimension);
                }

                if (subsampling > 1) {
                    // 確保取樣率是 2 的冪，對某些 JPG 解碼器更友好
                    subsampling = Integer.highestOneBit(subsampling);
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", inputPath.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                return new DecodedImage(reader.read(0, param), reader);
            } catch (IOException | RuntimeException e) {
                // 讀取尺寸或解碼失敗時釋放 reader
                reader.dispose();
                throw e;
            }
        }
    }

    /**
     * 立即解碼來源圖片。
     */
    public static PixelSource loadSource(Path path) throws IOException {
        try (DecodedImage decoded = decodeWithSubsampling(path, SOURCE_MAX_DIMENSION)) {
            PixelBuffer buffer = PixelBuffer.fromBufferedImage(decoded.image());
            log.info("{} - 來源圖片已讀取 ({}x{})", path, buffer.width(), buffer.height());
            return PixelSource.ofBuffer(buffer);
        }
    }

    /**
     * 建立延遲解碼的磁磚輸入，實際讀檔發生在擷取批次中，讀取失敗時視為該磁磚的解析錯誤。
     */
    public static TileInput tileInput(Path path) {
        String filename = path.getFileName().toString();
        return new TileInput(path.toAbsolutePath().normalize().toString(), filename, () -> {
            try (DecodedImage decoded = decodeWithSubsampling(path, TILE_MAX_DIMENSION)) {
                return PixelBuffer.fromBufferedImage(decoded.image());
            } catch (IOException e) {
                throw new IllegalArgumentException("無法讀取圖片 " + filename + ": " + e.getMessage(), e);
            }
        });
    }

    /**
     * 列出目錄 (不含子目錄) 中副檔名為常見圖片格式的檔案，依檔名排序。
     */
    public static List<Path> listImageFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("不是目錄: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(ImageLoader::isImageFile)
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        }
    }

    public static List<TileInput> tileInputs(List<Path> paths) {
        List<TileInput> inputs = new ArrayList<>(paths.size());
        for (Path path : paths) {
            inputs.add(tileInput(path));
        }
        return inputs;
    }

    static boolean isImageFile(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
