package com.flowmable.mosaic;

import java.util.Arrays;

/**
 * Perceptual color signature of a square region: an S×S grid of averaged
 * HSV samples, indexed {@code [x][y]}.
 * <p>
 * Every profile produced during one run shares the same {@code S}, taken
 * from the single {@code subSamples} setting, so any two profiles can be
 * compared cell by cell.
 */
public final class ColorProfile {

    private final HsvSample[][] samples;

    ColorProfile(HsvSample[][] samples) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("profile must have at least one sample");
        }
        for (HsvSample[] column : samples) {
            if (column.length != samples.length) {
                throw new IllegalArgumentException("profile grid must be square, got "
                        + samples.length + "x" + column.length);
            }
        }
        this.samples = samples;
    }

    /**
     * Build a profile from a square grid of samples. The grid is copied.
     */
    public static ColorProfile of(HsvSample[][] samples) {
        HsvSample[][] copy = new HsvSample[samples.length][];
        for (int x = 0; x < samples.length; x++) {
            copy[x] = samples[x].clone();
        }
        return new ColorProfile(copy);
    }

    /**
     * A 1×1 profile holding a single sample.
     */
    public static ColorProfile uniform(HsvSample sample) {
        return uniform(sample, 1);
    }

    /**
     * An S×S profile with every cell set to the same sample.
     */
    public static ColorProfile uniform(HsvSample sample, int subSamples) {
        HsvSample[][] grid = new HsvSample[subSamples][subSamples];
        for (HsvSample[] column : grid) {
            Arrays.fill(column, sample);
        }
        return new ColorProfile(grid);
    }

    /** Sub-sample count S along each axis. */
    public int subSamples() {
        return samples.length;
    }

    public HsvSample sample(int x, int y) {
        return samples[x][y];
    }

    /**
     * Copy of this profile with one cell replaced.
     */
    public ColorProfile with(int x, int y, HsvSample sample) {
        ColorProfile copy = of(samples);
        copy.samples[x][y] = sample;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColorProfile other)) return false;
        return Arrays.deepEquals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(samples);
    }

    @Override
    public String toString() {
        return "ColorProfile[" + samples.length + "x" + samples.length + "]";
    }
}
