package work.pollochang.mosaic.core;

/**
 * 可參與色差比對的物件：同時帶有 RGB 與 Lab 表示。
 */
public interface ColorSignature {

    Rgb rgb();

    Lab lab();
}
