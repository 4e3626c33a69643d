package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Chooses one candidate per grid cell from a {@link ScoreGrid}.
 * <p>
 * With repeats allowed, every cell takes its best-scoring candidate after an
 * optional repulsion pass that penalizes candidates chosen in many nearby
 * cells. Identical tiles push each other away like same-sign charges: the
 * penalty at a cell grows with the inverse squared distance to every other
 * cell showing the same candidate.
 * <p>
 * With repeats disallowed, a greedy assignment uses every candidate at most
 * once: a cell picks its best unused candidate, which is then placed wherever
 * in the grid it fits best.
 * <p>
 * Neither mode looks for a global optimum.
 */
public class TileSelector {

    private static final Logger logger = LoggerFactory.getLogger(TileSelector.class);

    private static final int UNASSIGNED = -1;

    private final RepulsionSettings repulsion;
    private final boolean allowMultipleOccurrences;
    private final Random random;

    public TileSelector(RepulsionSettings repulsion) {
        this(repulsion, true, new Random());
    }

    /**
     * @param random Tie-breaker for the no-repeats placement
     */
    public TileSelector(RepulsionSettings repulsion, boolean allowMultipleOccurrences, Random random) {
        this.repulsion = repulsion;
        this.allowMultipleOccurrences = allowMultipleOccurrences;
        this.random = random;
    }

    /**
     * Select a candidate for every cell. May mutate {@code grid} (repulsion pass).
     *
     * @throws ConfigurationException if repeats are disallowed and there are fewer candidates than cells
     */
    public Selection select(ScoreGrid grid) {
        if (!allowMultipleOccurrences) {
            return selectUnique(grid);
        }
        if (repulsion.enabled()) {
            applyRepulsion(grid);
        }
        int[][] chosen = new int[grid.xTiles()][grid.yTiles()];
        for (int x = 0; x < grid.xTiles(); x++) {
            for (int y = 0; y < grid.yTiles(); y++) {
                chosen[x][y] = grid.front(x, y).candidateIndex();
            }
        }
        return Selection.of(chosen);
    }

    /**
     * Penalize every candidate that is currently the best match in at least
     * {@code minimumClusterSize} cells. All clusters are measured before any
     * penalty is applied.
     *
     * @return number of cells that were penalized
     */
    int applyRepulsion(ScoreGrid grid) {
        int xTiles = grid.xTiles();
        int yTiles = grid.yTiles();
        // Squared grid diagonal keeps the penalty independent of grid size
        double norm = (double) xTiles * xTiles + (double) yTiles * yTiles;

        // 1. Group cells by their current front candidate
        Map<Integer, List<int[]>> clusters = new LinkedHashMap<>();
        for (int x = 0; x < xTiles; x++) {
            for (int y = 0; y < yTiles; y++) {
                clusters.computeIfAbsent(grid.front(x, y).candidateIndex(), k -> new ArrayList<>())
                        .add(new int[]{x, y});
            }
        }

        // 2. Inverse-square repulsion within each cluster
        double[][] penalty = new double[xTiles][yTiles];
        int penalized = 0;
        for (List<int[]> cells : clusters.values()) {
            if (cells.size() < repulsion.minimumClusterSize()) continue;
            for (int[] c : cells) {
                double sum = 0;
                for (int[] other : cells) {
                    if (other == c) continue;
                    int dx = other[0] - c[0];
                    int dy = other[1] - c[1];
                    double normalizedSq = (dx * dx + dy * dy) / norm;
                    sum += 1.0 / normalizedSq;
                }
                penalty[c[0]][c[1]] = repulsion.scale() * sum;
                penalized++;
            }
        }

        // 3. Apply
        int changed = 0;
        for (int x = 0; x < xTiles; x++) {
            for (int y = 0; y < yTiles; y++) {
                if (penalty[x][y] == 0) continue;
                int before = grid.front(x, y).candidateIndex();
                grid.penalizeFront(x, y, penalty[x][y]);
                if (grid.front(x, y).candidateIndex() != before) changed++;
            }
        }
        logger.debug("Repulsion penalized {} cell(s), {} changed candidate", penalized, changed);
        return penalized;
    }

    /**
     * Assign distinct candidates to every cell.
     */
    Selection selectUnique(ScoreGrid grid) {
        int xTiles = grid.xTiles();
        int yTiles = grid.yTiles();
        if (grid.candidateCount() < grid.tileCount()) {
            throw new ConfigurationException("Not enough candidates to avoid repeats: "
                    + grid.candidateCount() + " candidate(s) for " + grid.tileCount() + " tile(s)");
        }

        int[][] chosen = new int[xTiles][yTiles];
        for (int[] column : chosen) {
            Arrays.fill(column, UNASSIGNED);
        }
        boolean[] used = new boolean[grid.candidateCount()];

        for (int x = 0; x < xTiles; x++) {
            for (int y = 0; y < yTiles; y++) {
                // Each pass fills one empty cell, possibly elsewhere; repeat until this one is filled
                while (chosen[x][y] == UNASSIGNED) {
                    int k = bestUnused(grid, x, y, used);
                    used[k] = true;
                    int[] cell = bestEmptyCell(grid, k, chosen);
                    chosen[cell[0]][cell[1]] = k;
                }
            }
        }
        return Selection.of(chosen);
    }

    private static int bestUnused(ScoreGrid grid, int x, int y, boolean[] used) {
        for (ScoreEntry entry : grid.row(x, y)) {
            if (!used[entry.candidateIndex()]) {
                return entry.candidateIndex();
            }
        }
        throw new IllegalStateException("all candidates used before grid was filled");
    }

    /**
     * Cheapest empty cell for candidate {@code k}; ties are broken at random.
     */
    private int[] bestEmptyCell(ScoreGrid grid, int k, int[][] chosen) {
        double best = Double.POSITIVE_INFINITY;
        List<int[]> ties = new ArrayList<>();
        for (int x = 0; x < grid.xTiles(); x++) {
            for (int y = 0; y < grid.yTiles(); y++) {
                if (chosen[x][y] != UNASSIGNED) continue;
                double cost = grid.cost(k, x, y);
                if (cost < best) {
                    best = cost;
                    ties.clear();
                }
                if (cost == best) {
                    ties.add(new int[]{x, y});
                }
            }
        }
        return ties.get(random.nextInt(ties.size()));
    }
}
