package work.pollochang.mosaic.extract;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.codec.CompressedPixels;
import work.pollochang.mosaic.codec.PixelCodec;
import work.pollochang.mosaic.color.LabConversion;
import work.pollochang.mosaic.core.DominantColor;
import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.Rgb;
import work.pollochang.mosaic.core.TileDecodeException;
import work.pollochang.mosaic.core.TileInput;
import work.pollochang.mosaic.core.TileRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 單張磁磚的中繼資料擷取。
 *
 * <p>流程：
 * <ol>
 *   <li>解析像素來源。</li>
 *   <li>縮成固定 64x64 縮圖。</li>
 *   <li>計算 alpha 加權平均色 (完全透明的像素不計)。</li>
 *   <li>以 32 為量化桶統計頻率，取最多 3 個主色。</li>
 *   <li>計算平均亮度與對比 (亮度標準差)。</li>
 *   <li>平均色轉 Lab，縮圖壓縮為 RGB565。</li>
 * </ol>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class TileAnalyzer {

    public static final int MAX_DOMINANT_COLORS = 3;
    public static final int QUANTIZE_BUCKET = 32;

    private TileAnalyzer() {}

    /**
     * 處理單張磁磚，所有錯誤都在此轉成 {@link TileReport}，不會往外拋。
     */
    public static TileReport processTile(TileInput input, LabConversion conversion) {
        try {
            return TileReport.success(analyze(input, conversion));
        } catch (TileDecodeException e) {
            log.warn("{} - 無法擷取磁磚中繼資料: {}", input.filename(), e.getMessage());
            return TileReport.failure(new TileFailure(input.id(), input.filename(), TileOutcome.FAILED_DECODE, e.getMessage()));
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理磁磚時發生記憶體溢位錯誤", input.filename(), e);
            return TileReport.failure(new TileFailure(input.id(), input.filename(), TileOutcome.FAILED_OUT_OF_MEMORY, String.valueOf(e.getMessage())));
        } catch (Exception e) {
            log.error("{} - 處理磁磚時發生未知錯誤", input.filename(), e);
            return TileReport.failure(new TileFailure(input.id(), input.filename(), TileOutcome.FAILED_UNKNOWN, String.valueOf(e.getMessage())));
        }
    }

    /**
     * 擷取中繼資料。
     *
     * @throws TileDecodeException 像素資料缺漏、格式不符或完全透明
     */
    public static TileRecord analyze(TileInput input, LabConversion conversion) {
        PixelBuffer original = resolve(input);
        PixelBuffer thumbnail = PixelCodec.thumbnail(original);

        Rgb average = averageColor(thumbnail);
        if (average == null) {
            throw new TileDecodeException(input.id(), "圖片沒有任何不透明像素");
        }
        List<DominantColor> dominant = dominantColors(thumbnail, MAX_DOMINANT_COLORS);
        double brightness = brightness(thumbnail);
        double contrast = contrast(thumbnail, brightness);
        CompressedPixels compressed = PixelCodec.compress(thumbnail);

        return new TileRecord(
                input.id(),
                input.filename(),
                original.width(),
                original.height(),
                average,
                conversion.convert(average),
                dominant,
                brightness,
                contrast,
                thumbnail,
                compressed
        );
    }

    /**
     * alpha 加權平均色，略過完全透明的像素。
     *
     * @return 平均色；沒有任何不透明像素時為 null
     */
    public static Rgb averageColor(PixelBuffer buffer) {
        long r = 0, g = 0, b = 0, weight = 0;
        for (int i = 0; i < buffer.pixelCount(); i++) {
            int alpha = buffer.alpha(i);
            if (alpha == 0) {
                continue;
            }
            r += (long) buffer.red(i) * alpha;
            g += (long) buffer.green(i) * alpha;
            b += (long) buffer.blue(i) * alpha;
            weight += alpha;
        }
        if (weight == 0) {
            return null;
        }
        return new Rgb(
                (int) Math.round((double) r / weight),
                (int) Math.round((double) g / weight),
                (int) Math.round((double) b / weight));
    }

    /**
     * 以粗量化 (每通道 32 為一桶) 統計頻率，取出現最多的前 {@code maxColors} 個顏色。
     * 同頻率時以量化值排序，確保結果穩定。
     */
    public static List<DominantColor> dominantColors(PixelBuffer buffer, int maxColors) {
        Map<Integer, Integer> counts = new HashMap<>();
        int counted = 0;
        for (int i = 0; i < buffer.pixelCount(); i++) {
            if (buffer.alpha(i) == 0) {
                continue;
            }
            int r = buffer.red(i) / QUANTIZE_BUCKET * QUANTIZE_BUCKET;
            int g = buffer.green(i) / QUANTIZE_BUCKET * QUANTIZE_BUCKET;
            int b = buffer.blue(i) / QUANTIZE_BUCKET * QUANTIZE_BUCKET;
            counts.merge((r << 16) | (g << 8) | b, 1, Integer::sum);
            counted++;
        }
        if (counted == 0) {
            return List.of();
        }

        List<Map.Entry<Integer, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<Integer, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));

        List<DominantColor> result = new ArrayList<>(Math.min(maxColors, ranked.size()));
        for (Map.Entry<Integer, Integer> entry : ranked.subList(0, Math.min(maxColors, ranked.size()))) {
            result.add(new DominantColor(Rgb.fromArgb(entry.getKey()), (double) entry.getValue() / counted));
        }
        return result;
    }

    /**
     * 不透明像素的平均亮度 (0.299R + 0.587G + 0.114B)，沒有不透明像素時為 0。
     */
    public static double brightness(PixelBuffer buffer) {
        double total = 0;
        int counted = 0;
        for (int i = 0; i < buffer.pixelCount(); i++) {
            if (buffer.alpha(i) == 0) {
                continue;
            }
            total += luma(buffer, i);
            counted++;
        }
        return counted == 0 ? 0 : total / counted;
    }

    /**
     * 亮度的母體標準差。
     */
    public static double contrast(PixelBuffer buffer, double brightness) {
        double variance = 0;
        int counted = 0;
        for (int i = 0; i < buffer.pixelCount(); i++) {
            if (buffer.alpha(i) == 0) {
                continue;
            }
            double diff = luma(buffer, i) - brightness;
            variance += diff * diff;
            counted++;
        }
        return counted == 0 ? 0 : Math.sqrt(variance / counted);
    }

    private static double luma(PixelBuffer buffer, int index) {
        return 0.299 * buffer.red(index) + 0.587 * buffer.green(index) + 0.114 * buffer.blue(index);
    }

    private static PixelBuffer resolve(TileInput input) {
        PixelBuffer buffer;
        try {
            buffer = input.source().resolve();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new TileDecodeException(input.id(), "像素資料不合法: " + e.getMessage(), e);
        }
        if (buffer == null) {
            throw new TileDecodeException(input.id(), "像素來源沒有資料");
        }
        return buffer;
    }
}
