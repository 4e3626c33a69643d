package com.flowmable.mosaic;

import java.util.Arrays;
import java.util.List;

/**
 * Every candidate's cost at every grid cell.
 * <p>
 * Each cell holds a row of {@link ScoreEntry} sorted ascending, best match
 * first. The rows are only mutated by {@link #penalizeFront}; the raw cost
 * matrix stays as scored.
 */
public final class ScoreGrid {

    private final ScoreEntry[][][] rows;
    private final double[][][] costs;
    private final int xTiles;
    private final int yTiles;

    private ScoreGrid(ScoreEntry[][][] rows, double[][][] costs, int xTiles, int yTiles) {
        this.rows = rows;
        this.costs = costs;
        this.xTiles = xTiles;
        this.yTiles = yTiles;
    }

    /**
     * Sort every candidate's costs into per-cell rows.
     *
     * @param costsByCandidate {@code [candidate][x][y]} costs, as produced by {@link TileScorer#score}
     */
    public static ScoreGrid build(double[][][] costsByCandidate) {
        if (costsByCandidate.length == 0) {
            throw new IllegalArgumentException("at least one candidate is required");
        }
        int candidates = costsByCandidate.length;
        int xTiles = costsByCandidate[0].length;
        int yTiles = xTiles == 0 ? 0 : costsByCandidate[0][0].length;

        ScoreEntry[][][] rows = new ScoreEntry[xTiles][yTiles][];
        for (int x = 0; x < xTiles; x++) {
            for (int y = 0; y < yTiles; y++) {
                ScoreEntry[] row = new ScoreEntry[candidates];
                for (int k = 0; k < candidates; k++) {
                    row[k] = new ScoreEntry(k, costsByCandidate[k][x][y]);
                }
                Arrays.sort(row);
                rows[x][y] = row;
            }
        }
        return new ScoreGrid(rows, costsByCandidate, xTiles, yTiles);
    }

    public int xTiles() {
        return xTiles;
    }

    public int yTiles() {
        return yTiles;
    }

    public int tileCount() {
        return xTiles * yTiles;
    }

    public int candidateCount() {
        return costs.length;
    }

    /** Current best entry at a cell. */
    public ScoreEntry front(int x, int y) {
        return rows[x][y][0];
    }

    /** Snapshot of a cell's row, in its current order. */
    public List<ScoreEntry> row(int x, int y) {
        return List.of(rows[x][y]);
    }

    /** Cost of candidate {@code k} at a cell, as originally scored. */
    public double cost(int k, int x, int y) {
        return costs[k][x][y];
    }

    /**
     * Add {@code penalty} to the front entry of a cell, then move that entry
     * back past every entry that is now strictly cheaper. Ties keep the
     * penalized entry in front.
     */
    void penalizeFront(int x, int y, double penalty) {
        ScoreEntry[] row = rows[x][y];
        row[0] = row[0].withPenalty(penalty);
        for (int i = 0; i + 1 < row.length && row[i + 1].score() < row[i].score(); i++) {
            ScoreEntry tmp = row[i];
            row[i] = row[i + 1];
            row[i + 1] = tmp;
        }
    }
}
