package com.flowmable.mosaic;

import java.util.Arrays;

/**
 * The chosen candidate index for every grid cell, indexed {@code [x][y]}.
 * Immutable once created.
 */
public final class Selection {

    private final int[][] chosen;

    private Selection(int[][] chosen) {
        this.chosen = chosen;
    }

    /**
     * Copy {@code chosen} into a new selection.
     *
     * @throws IllegalArgumentException if a cell is unassigned (negative)
     */
    public static Selection of(int[][] chosen) {
        int[][] copy = new int[chosen.length][];
        for (int x = 0; x < chosen.length; x++) {
            copy[x] = chosen[x].clone();
            for (int y = 0; y < copy[x].length; y++) {
                if (copy[x][y] < 0) {
                    throw new IllegalArgumentException("cell (" + x + ", " + y + ") has no candidate");
                }
            }
        }
        return new Selection(copy);
    }

    public int xTiles() {
        return chosen.length;
    }

    public int yTiles() {
        return chosen.length == 0 ? 0 : chosen[0].length;
    }

    public int candidateAt(int x, int y) {
        return chosen[x][y];
    }

    /** Number of cells showing candidate {@code k}. */
    public int count(int k) {
        int n = 0;
        for (int[] column : chosen) {
            for (int c : column) {
                if (c == k) n++;
            }
        }
        return n;
    }

    @Override
    public String toString() {
        return "Selection" + Arrays.deepToString(chosen);
    }
}
