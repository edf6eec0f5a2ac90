package work.pollochang.mosaic.composite;

import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.Rgb;

/**
 * 結果中的一格，保留磁磚原始像素以便之後重建高解析度畫布，不需重新讀檔。
 *
 * @param x              網格欄
 * @param y              網格列
 * @param tileId         磁磚識別碼
 * @param filename       磁磚檔名
 * @param averageColor   磁磚平均色
 * @param originalPixels 磁磚保留的未壓縮像素
 */
public record PlacedTile(int x, int y, String tileId, String filename, Rgb averageColor, PixelBuffer originalPixels) {}
