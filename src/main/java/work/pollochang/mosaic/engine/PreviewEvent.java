package work.pollochang.mosaic.engine;

import java.awt.image.BufferedImage;

/**
 * 產生過程中的預覽快照。
 *
 * @param preview     已縮小的畫布複本
 * @param placedCells 已放置的格子數
 * @param totalCells  總格子數
 * @param timestamp   產生時間 (epoch ms)
 */
public record PreviewEvent(BufferedImage preview, int placedCells, int totalCells, long timestamp) {}
