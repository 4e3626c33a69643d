package com.flowmable.mosaic;

import java.awt.Rectangle;
import java.util.Locale;

/**
 * Which part of a landscape photo to keep when cropping it to a square.
 * Portrait photos are always centered vertically regardless of the hint.
 */
public enum CropHint {
    /** Keep the left edge. */
    LEFT,
    /** Keep the middle. */
    CENTER,
    /** Keep the right edge. */
    RIGHT;

    /**
     * Square crop window for an image of the given size.
     */
    public Rectangle cropWindow(int width, int height) {
        if (height > width) {
            return new Rectangle(0, (height - width) / 2, width, width);
        }
        int x = switch (this) {
            case LEFT -> 0;
            case CENTER -> (width - height) / 2;
            case RIGHT -> width - height;
        };
        return new Rectangle(x, 0, height, height);
    }

    /**
     * Parse a hint name case-insensitively ({@code left}, {@code center}, {@code right}).
     *
     * @throws ConfigurationException for any other name
     */
    public static CropHint parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown crop hint '" + name + "' (expected left, center or right)", e);
        }
    }
}
