package work.pollochang.mosaic.tools;

import java.awt.*;
import java.awt.image.BufferedImage;

public class ImageTools {

    public static BufferedImage resizeImage(BufferedImage originalImage, double scale) {
        int newWidth = Math.max(1, (int) (originalImage.getWidth() * scale));
        int newHeight = Math.max(1, (int) (originalImage.getHeight() * scale));
        return resizeImage(originalImage, newWidth, newHeight);
    }

    public static BufferedImage resizeImage(BufferedImage originalImage, int newWidth, int newHeight) {
        // 保留 Alpha 通道
        int imageType = originalImage.getType();
        if (imageType == 0 || imageType == BufferedImage.TYPE_CUSTOM) {
            imageType = originalImage.getAlphaRaster() != null ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight, imageType);
        Graphics2D g2d = resizedImage.createGraphics();
        // 使用更高品質的縮放演算法
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.drawImage(originalImage, 0, 0, newWidth, newHeight, null);
        g2d.dispose();
        return resizedImage;
    }

    /**
     * 複製一份影像，作為預覽快照，避免呼叫端看到後續的繪製。
     */
    public static BufferedImage copyImage(BufferedImage image) {
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = copy.createGraphics();
        g2d.drawImage(image, 0, 0, null);
        g2d.dispose();
        return copy;
    }

    /**
     * 以單一顏色填滿指定區塊。
     */
    public static void fillRect(BufferedImage canvas, int x, int y, int size, Color color) {
        Graphics2D g2d = canvas.createGraphics();
        try {
            g2d.setPaint(color);
            g2d.fillRect(x, y, size, size);
        } finally {
            g2d.dispose();
        }
    }
}
