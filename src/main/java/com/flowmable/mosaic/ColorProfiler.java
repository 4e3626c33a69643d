package com.flowmable.mosaic;

import java.awt.image.BufferedImage;

/**
 * Converts a square pixel region into a {@link ColorProfile}.
 * <p>
 * The region is split into S×S equal sub-cells. Every pixel of a sub-cell
 * is converted to HSV; hues are averaged with a circular mean, saturation
 * and value arithmetically. Stateless apart from the greyscale switch, so
 * one instance is shared by all workers.
 */
public class ColorProfiler {

    private final boolean greyscale;

    public ColorProfiler() {
        this(false);
    }

    /**
     * @param greyscale When true, pixels are reduced to luma before conversion.
     *                  Every sample then has saturation 0 and the achromatic
     *                  hue 1/6, so only value differs between profiles
     */
    public ColorProfiler(boolean greyscale) {
        this.greyscale = greyscale;
    }

    /**
     * Profile a whole square image.
     */
    public ColorProfile profile(BufferedImage region, int subSamples) {
        if (region.getWidth() != region.getHeight()) {
            throw new IllegalArgumentException("region must be square, got "
                    + region.getWidth() + "x" + region.getHeight());
        }
        return profile(region, 0, 0, region.getWidth(), subSamples);
    }

    /**
     * Profile the {@code size}×{@code size} window of {@code image} whose top-left
     * corner is at ({@code x0}, {@code y0}), without copying it.
     * <p>
     * {@code size} must be divisible by {@code subSamples}; callers guarantee this
     * through configuration validation.
     */
    public ColorProfile profile(BufferedImage image, int x0, int y0, int size, int subSamples) {
        if (subSamples < 1 || size < subSamples) {
            throw new IllegalArgumentException("cannot take " + subSamples
                    + " sub-samples from a region of size " + size);
        }
        if (x0 < 0 || y0 < 0 || x0 + size > image.getWidth() || y0 + size > image.getHeight()) {
            throw new IllegalArgumentException("window (" + x0 + ", " + y0 + ", " + size
                    + ") outside image " + image.getWidth() + "x" + image.getHeight());
        }

        int cell = size / subSamples;
        int pixelsPerCell = cell * cell;
        int[] row = new int[cell];
        HsvSample[][] samples = new HsvSample[subSamples][subSamples];

        for (int sx = 0; sx < subSamples; sx++) {
            for (int sy = 0; sy < subSamples; sy++) {
                double sinSum = 0;
                double cosSum = 0;
                double satSum = 0;
                double valSum = 0;

                int left = x0 + sx * cell;
                int top = y0 + sy * cell;
                for (int y = top; y < top + cell; y++) {
                    image.getRGB(left, y, cell, 1, row, 0, cell);
                    for (int argb : row) {
                        HsvSample hsv = toHsv(argb);
                        sinSum += ColorSpaceUtils.sinTurn(hsv.hue());
                        cosSum += ColorSpaceUtils.cosTurn(hsv.hue());
                        satSum += hsv.saturation();
                        valSum += hsv.value();
                    }
                }

                samples[sx][sy] = new HsvSample(
                        ColorSpaceUtils.circularMean(sinSum, cosSum),
                        satSum / pixelsPerCell,
                        valSum / pixelsPerCell
                );
            }
        }
        return new ColorProfile(samples);
    }

    private HsvSample toHsv(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        if (greyscale) {
            int y = ColorSpaceUtils.luma(r, g, b);
            return ColorSpaceUtils.rgbToHsv(y, y, y);
        }
        return ColorSpaceUtils.rgbToHsv(r, g, b);
    }
}
