package work.pollochang.mosaic.core;

/**
 * 來源圖片的一個網格格子與其代表色。
 *
 * @param x   網格欄
 * @param y   網格列
 * @param rgb 格子平均色
 * @param lab 平均色的 Lab 值
 */
public record SourceCell(int x, int y, Rgb rgb, Lab lab) implements ColorSignature {
}
