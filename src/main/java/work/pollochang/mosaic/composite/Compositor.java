package work.pollochang.mosaic.composite;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.assign.Assignment;
import work.pollochang.mosaic.assign.Placement;
import work.pollochang.mosaic.assign.TilePalette;
import work.pollochang.mosaic.cache.TileCache;
import work.pollochang.mosaic.cache.TileCacheKey;
import work.pollochang.mosaic.codec.PixelCodec;
import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.Rgb;
import work.pollochang.mosaic.core.SizeLimitExceededException;
import work.pollochang.mosaic.core.TileRecord;
import work.pollochang.mosaic.tools.ImageTools;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Objects;

import static work.pollochang.mosaic.tools.CacheTools.createKey;

/**
 * 將放置結果繪製成畫布。
 *
 * <p>一般合成時，磁磚畫面先查 {@link TileCache}，未命中才從 RGB565 壓縮資料解壓並縮放到磁磚尺寸，
 * 再存回快取。資料缺漏或無法解壓時以平均色填滿，連平均色都沒有時以紅色標記填滿，
 * 單一格子的問題不會中止整張畫布。
 *
 * <p>畫布邊長不得超過 {@link #getMaxRasterDimension()}，超過時自動縮小磁磚尺寸。
 */
@Slf4j
@Getter
public class Compositor {

    public static final int DEFAULT_MAX_RASTER_DIMENSION = 32767;
    public static final int DEFAULT_MIN_TILE_SIZE = 1;
    public static final int DEFAULT_HIGH_RES_TILE_SIZE = 256;
    public static final Color MARKER_COLOR = Color.RED;

    private final TileCache cache;
    private final int maxRasterDimension;
    private final int minTileSize;

    public Compositor(TileCache cache) {
        this(cache, DEFAULT_MAX_RASTER_DIMENSION, DEFAULT_MIN_TILE_SIZE);
    }

    public Compositor(TileCache cache, int maxRasterDimension, int minTileSize) {
        if (maxRasterDimension < 1 || minTileSize < 1) {
            throw new IllegalArgumentException("maxRasterDimension 與 minTileSize 必須 >= 1");
        }
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.maxRasterDimension = maxRasterDimension;
        this.minTileSize = minTileSize;
    }

    /**
     * 規劃畫布尺寸：{@code gridSize * requestedTileSize} 超過上限時，磁磚尺寸改為
     * {@code floor(maxRasterDimension / gridSize)}。
     *
     * @throws SizeLimitExceededException 縮小後仍低於最小磁磚尺寸
     */
    public RasterPlan planRaster(int gridSize, int requestedTileSize) {
        if (gridSize < 1 || requestedTileSize < 1) {
            throw new IllegalArgumentException("gridSize 與 tileSize 必須 >= 1: " + gridSize + ", " + requestedTileSize);
        }
        if ((long) gridSize * requestedTileSize <= maxRasterDimension) {
            return new RasterPlan(gridSize, requestedTileSize, requestedTileSize, false);
        }
        int adjusted = maxRasterDimension / gridSize;
        if (adjusted < minTileSize) {
            throw new SizeLimitExceededException(gridSize, requestedTileSize, maxRasterDimension);
        }
        log.info("畫布 {}x{} 超過上限 {}，磁磚尺寸由 {}px 調整為 {}px",
                (long) gridSize * requestedTileSize, (long) gridSize * requestedTileSize,
                maxRasterDimension, requestedTileSize, adjusted);
        return new RasterPlan(gridSize, requestedTileSize, adjusted, true);
    }

    public BufferedImage newCanvas(RasterPlan plan) {
        return new BufferedImage(plan.width(), plan.height(), BufferedImage.TYPE_INT_RGB);
    }

    /**
     * 把磁磚畫在格子 (cellX, cellY)。
     */
    public DrawOutcome drawTile(BufferedImage canvas, TileRecord tile, int cellX, int cellY, int tileSize) {
        int px = cellX * tileSize;
        int py = cellY * tileSize;
        if (tile == null) {
            ImageTools.fillRect(canvas, px, py, tileSize, MARKER_COLOR);
            return DrawOutcome.MARKER_FILL;
        }

        BufferedImage surface = null;
        try {
            surface = surfaceFor(tile, tileSize);
        } catch (IllegalArgumentException e) {
            log.warn("{} - 磁磚資料無法解壓，改用平均色: {}", tile.id(), e.getMessage());
        }
        if (surface != null) {
            Graphics2D g2d = canvas.createGraphics();
            try {
                g2d.drawImage(surface, px, py, null);
            } finally {
                g2d.dispose();
            }
            return DrawOutcome.TILE;
        }
        return fillFallback(canvas, tile.averageRgb(), px, py, tileSize, tile.id());
    }

    /**
     * 依放置結果繪製整張畫布。
     */
    public BufferedImage compose(Assignment assignment, TilePalette palette, RasterPlan plan) {
        BufferedImage canvas = newCanvas(plan);
        for (Placement placement : assignment.placements()) {
            drawTile(canvas, palette.get(placement.tileId()), placement.x(), placement.y(), plan.tileSize());
        }
        return canvas;
    }

    /**
     * 以每格保留的原始像素重新繪製較大的畫布，不經過快取。
     *
     * @param result            一般合成的結果
     * @param requestedTileSize 要求的磁磚邊長，通常為 {@link #DEFAULT_HIGH_RES_TILE_SIZE}
     * @return 新的結果，{@code gridInfo.tileSize} 為實際使用的尺寸
     * @throws SizeLimitExceededException 無法在上限內繪製
     */
    public MosaicResult reconstructHighResolution(MosaicResult result, int requestedTileSize) {
        Objects.requireNonNull(result, "result must not be null");
        RasterPlan plan = planRaster(result.gridInfo().gridSize(), requestedTileSize);
        log.info("開始重建高解析度畫布 {}x{} (磁磚 {}px)", plan.width(), plan.height(), plan.tileSize());

        BufferedImage canvas = newCanvas(plan);
        int fallbacks = 0;
        for (PlacedTile placed : result.placements()) {
            if (drawOriginal(canvas, placed, plan.tileSize()) != DrawOutcome.TILE) {
                fallbacks++;
            }
        }
        if (fallbacks > 0) {
            log.warn("高解析度重建時有 {} 格使用替代色填滿", fallbacks);
        }
        return result.withRaster(canvas, new GridInfo(plan.gridSize(), plan.tileSize()));
    }

    DrawOutcome drawOriginal(BufferedImage canvas, PlacedTile placed, int tileSize) {
        int px = placed.x() * tileSize;
        int py = placed.y() * tileSize;
        PixelBuffer pixels = placed.originalPixels();
        if (pixels != null) {
            BufferedImage source = pixels.toBufferedImage();
            BufferedImage scaled = ImageTools.resizeImage(source, tileSize, tileSize);
            Graphics2D g2d = canvas.createGraphics();
            try {
                g2d.drawImage(scaled, px, py, null);
            } finally {
                g2d.dispose();
                source.flush();
                scaled.flush();
            }
            return DrawOutcome.TILE;
        }
        return fillFallback(canvas, placed.averageColor(), px, py, tileSize, placed.tileId());
    }

    private BufferedImage surfaceFor(TileRecord tile, int tileSize) {
        TileCacheKey key = createKey(tile.id(), tileSize);
        BufferedImage cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        if (tile.compressedPixels() == null) {
            return null;
        }
        PixelBuffer decompressed = PixelCodec.decompress(tile.compressedPixels());
        BufferedImage source = decompressed.toBufferedImage();
        BufferedImage surface = ImageTools.resizeImage(source, tileSize, tileSize);
        source.flush();
        cache.put(key, surface);
        return surface;
    }

    private DrawOutcome fillFallback(BufferedImage canvas, Rgb average, int px, int py, int tileSize, String tileId) {
        if (average != null) {
            ImageTools.fillRect(canvas, px, py, tileSize, new Color(average.r(), average.g(), average.b()));
            return DrawOutcome.AVERAGE_FILL;
        }
        log.warn("{} - 沒有平均色資料，以標記色填滿", tileId);
        ImageTools.fillRect(canvas, px, py, tileSize, MARKER_COLOR);
        return DrawOutcome.MARKER_FILL;
    }
}
