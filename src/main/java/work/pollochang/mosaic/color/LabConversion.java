package work.pollochang.mosaic.color;

import work.pollochang.mosaic.core.Lab;
import work.pollochang.mosaic.core.Rgb;

/**
 * 一次流程中來源格子與磁磚共用的 Lab 轉換方式。
 */
public enum LabConversion {
    PRECISE {
        @Override
        public Lab convert(Rgb rgb) {
            return ColorMath.rgbToLab(rgb);
        }
    },
    FAST {
        @Override
        public Lab convert(Rgb rgb) {
            return ColorMath.rgbToLabFast(rgb);
        }
    };

    public abstract Lab convert(Rgb rgb);
}
