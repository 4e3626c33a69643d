package com.flowmable.mosaic;

/**
 * Color space conversion utilities and circular hue arithmetic.
 * <p>
 * Hue is kept on the unit circle [0, 1) throughout: 0 and 1 are the same
 * angle, so means and distances must be taken on the circle rather than
 * on the number line.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    private static final double TWO_PI = 2.0 * Math.PI;

    /**
     * Convert normalized RGB (each channel in [0, 1]) to HSV.
     * <p>
     * Hue is rotated by one sextant ({@code (h + 1) / 6}) so that the red
     * sector, which spans negative raw values, lands in [0, 1/3]. Achromatic
     * pixels (greys, black, white) get raw hue 0 and so end up at 1/6.
     */
    public static HsvSample rgbToHsv(double r, double g, double b) {
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double chroma = max - min;

        double hue;
        if (chroma == 0) {
            hue = 0;
        } else if (max == r) {
            hue = (g - b) / chroma;
        } else if (max == g) {
            hue = (b - r) / chroma + 2.0;
        } else {
            hue = (r - g) / chroma + 4.0;
        }
        hue = wrapUnit((hue + 1.0) / 6.0);

        double saturation = max == 0 ? 0 : chroma / max;
        return new HsvSample(hue, saturation, max);
    }

    /**
     * Convert 8-bit sRGB (0–255 per channel) to HSV.
     */
    public static HsvSample rgbToHsv(int r, int g, int b) {
        return rgbToHsv(r / 255.0, g / 255.0, b / 255.0);
    }

    /**
     * Rec. 601 luma of an 8-bit RGB triple, rounded to 0–255.
     */
    public static int luma(int r, int g, int b) {
        int y = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        return Math.min(255, Math.max(0, y));
    }

    /**
     * Circular mean of hues given as accumulated unit-vector components.
     *
     * @param sinSum Σ sin(2πh)
     * @param cosSum Σ cos(2πh)
     * @return mean hue in [0, 1)
     */
    public static double circularMean(double sinSum, double cosSum) {
        return wrapUnit(Math.atan2(sinSum, cosSum) / TWO_PI);
    }

    /**
     * Circular mean of a set of hues in [0, 1).
     */
    public static double circularMean(double... hues) {
        double sinSum = 0;
        double cosSum = 0;
        for (double h : hues) {
            sinSum += Math.sin(TWO_PI * h);
            cosSum += Math.cos(TWO_PI * h);
        }
        return circularMean(sinSum, cosSum);
    }

    /**
     * Shortest distance between two hues on the unit circle.
     *
     * @return distance in [0, 0.5]
     */
    public static double hueDistance(double h1, double h2) {
        double d = wrapUnit(h1 - h2);
        return d > 0.5 ? 1.0 - d : d;
    }

    /**
     * Map any real value onto [0, 1).
     */
    static double wrapUnit(double v) {
        double w = v - Math.floor(v);
        // v slightly below an integer can round up to exactly 1.0
        return w >= 1.0 ? 0.0 : w;
    }

    static double sinTurn(double hue) {
        return Math.sin(TWO_PI * hue);
    }

    static double cosTurn(double hue) {
        return Math.cos(TWO_PI * hue);
    }
}
