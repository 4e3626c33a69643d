package com.flowmable.mosaic;

/**
 * Color profiles of every tile position of the target image.
 * <p>
 * Cell ({@code x}, {@code y}) covers the target pixels starting at
 * ({@code xOffset + x * tileSize}, {@code yOffset + y * tileSize}). The
 * offsets are the leading border strips that do not fit a whole tile.
 */
public final class TargetGrid {

    private final ColorProfile[][] cells;
    private final int tileSize;
    private final int xOffset;
    private final int yOffset;

    TargetGrid(ColorProfile[][] cells, int tileSize, int xOffset, int yOffset) {
        this.cells = cells;
        this.tileSize = tileSize;
        this.xOffset = xOffset;
        this.yOffset = yOffset;
    }

    /**
     * Build a grid directly from profiles, indexed {@code [x][y]}.
     */
    public static TargetGrid of(ColorProfile[][] cells, int tileSize) {
        ColorProfile[][] copy = new ColorProfile[cells.length][];
        for (int x = 0; x < cells.length; x++) {
            copy[x] = cells[x].clone();
        }
        return new TargetGrid(copy, tileSize, 0, 0);
    }

    public int xTiles() {
        return cells.length;
    }

    public int yTiles() {
        return cells.length == 0 ? 0 : cells[0].length;
    }

    public int tileCount() {
        return xTiles() * yTiles();
    }

    public int tileSize() {
        return tileSize;
    }

    public int xOffset() {
        return xOffset;
    }

    public int yOffset() {
        return yOffset;
    }

    public ColorProfile cell(int x, int y) {
        return cells[x][y];
    }
}
