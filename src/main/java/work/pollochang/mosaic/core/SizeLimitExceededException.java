package work.pollochang.mosaic.core;

import lombok.Getter;

/**
 * 輸出畫布即使縮到最小磁磚尺寸仍超過平台上限。
 */
@Getter
public class SizeLimitExceededException extends MosaicException {

    private final int gridSize;
    private final int maxRasterDimension;

    public SizeLimitExceededException(int gridSize, int tileSize, int maxRasterDimension) {
        super(String.format("畫布尺寸 %dx%d (網格 %d x 磁磚 %dpx) 超過上限 %dx%d",
                (long) gridSize * tileSize, (long) gridSize * tileSize, gridSize, tileSize,
                maxRasterDimension, maxRasterDimension));
        this.gridSize = gridSize;
        this.maxRasterDimension = maxRasterDimension;
    }
}
