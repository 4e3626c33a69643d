package com.flowmable.mosaic;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Raster helpers shared by thumbnail preparation, compositing and statistics.
 * All methods return new images; inputs are never modified.
 */
public final class ImageOps {

    private ImageOps() {}

    /**
     * Crop to a square according to {@code hint} and rescale to {@code size}×{@code size}.
     */
    public static BufferedImage thumbnail(BufferedImage src, CropHint hint, int size) {
        Rectangle window = hint.cropWindow(src.getWidth(), src.getHeight());
        BufferedImage square = src.getSubimage(window.x, window.y, window.width, window.height);
        return scale(square, size, size);
    }

    /**
     * Bilinear rescale into a new opaque RGB image.
     */
    public static BufferedImage scale(BufferedImage src, int width, int height) {
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = dst.createGraphics();
        g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2.drawImage(src, 0, 0, width, height, null);
        g2.dispose();
        return dst;
    }

    /**
     * Opaque RGB copy of {@code src}; returns {@code src} itself when it already is one.
     */
    public static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) return src;
        BufferedImage converted = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = converted.createGraphics();
        g2.drawImage(src, 0, 0, null);
        g2.dispose();
        return converted;
    }

    /**
     * Greyscale copy that keeps the RGB layout (R = G = B = luma).
     */
    public static BufferedImage greyscale(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            src.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                int l = ColorSpaceUtils.luma((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
                row[x] = (l << 16) | (l << 8) | l;
            }
            dst.setRGB(0, y, w, 1, row, 0, w);
        }
        return dst;
    }
}
