package work.pollochang.mosaic.core;

import work.pollochang.mosaic.codec.CompressedPixels;

import java.util.List;

/**
 * 一張磁磚的中繼資料，存活於單次產生流程。縮圖與壓縮像素的陣列共用不複製。
 *
 * @param id               磁磚識別碼 (與 {@link TileInput#id()} 相同)
 * @param filename         原始檔名
 * @param width            原始寬度
 * @param height           原始高度
 * @param averageRgb       以 alpha 加權的平均色
 * @param averageLab       平均色的 Lab 值
 * @param dominantColors   最多 3 個主色，依比例由高到低
 * @param brightness       不透明像素的平均亮度 (0 ~ 255)
 * @param contrast         亮度的標準差
 * @param thumbnail        固定 64x64 的縮圖，保留給高解析度重建使用
 * @param compressedPixels 縮圖的 RGB565 壓縮資料，用於一般合成
 */
public record TileRecord(
        String id,
        String filename,
        int width,
        int height,
        Rgb averageRgb,
        Lab averageLab,
        List<DominantColor> dominantColors,
        double brightness,
        double contrast,
        PixelBuffer thumbnail,
        CompressedPixels compressedPixels
) implements ColorSignature {

    public TileRecord {
        dominantColors = List.copyOf(dominantColors);
    }

    @Override
    public Rgb rgb() {
        return averageRgb;
    }

    @Override
    public Lab lab() {
        return averageLab;
    }

    /**
     * 未壓縮的原始縮圖像素。
     */
    public PixelBuffer fullResPixels() {
        return thumbnail;
    }
}
