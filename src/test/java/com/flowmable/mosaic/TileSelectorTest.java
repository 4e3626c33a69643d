package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TileSelectorTest {

    /**
     * 4x4 grid, two candidates: candidate 0 is a perfect match everywhere,
     * candidate 1 costs 1.0 everywhere.
     */
    private static ScoreGrid perfectAndRunnerUp() {
        double[][][] costs = new double[2][4][4];
        for (int x = 0; x < 4; x++)
            for (int y = 0; y < 4; y++)
                costs[1][x][y] = 1.0;
        return ScoreGrid.build(costs);
    }

    @Test
    void withoutRepulsion_bestMatchEverywhere() {
        Selection s = new TileSelector(RepulsionSettings.DISABLED).select(perfectAndRunnerUp());

        assertEquals(16, s.count(0));
    }

    @Test
    void repulsion_reducesClustering() {
        Selection s = new TileSelector(new RepulsionSettings(0.01, 2)).select(perfectAndRunnerUp());

        assertTrue(s.count(0) < 16, "expected some cells to move off the perfect match: " + s);
    }

    @Test
    void repulsion_isStrongestInTheMiddleOfACluster() {
        // corners see penalty ~0.67, interior cells ~1.19, edges ~0.90
        Selection s = new TileSelector(new RepulsionSettings(0.005, 2)).select(perfectAndRunnerUp());

        assertEquals(0, s.candidateAt(0, 0));
        assertEquals(0, s.candidateAt(3, 0));
        assertEquals(0, s.candidateAt(0, 3));
        assertEquals(0, s.candidateAt(3, 3));
        assertEquals(0, s.candidateAt(0, 1));
        assertEquals(1, s.candidateAt(1, 1));
        assertEquals(1, s.candidateAt(2, 1));
        assertEquals(1, s.candidateAt(1, 2));
        assertEquals(1, s.candidateAt(2, 2));
        assertEquals(12, s.count(0));
    }

    @Test
    void repulsion_ignoresClustersBelowThreshold() {
        ScoreGrid grid = perfectAndRunnerUp();
        TileSelector selector = new TileSelector(new RepulsionSettings(1.0, 17));

        assertEquals(0, selector.applyRepulsion(grid));
        assertEquals(16, selector.select(grid).count(0));
    }

    @Test
    void repulsion_measuresBeforeApplying() {
        ScoreGrid grid = perfectAndRunnerUp();
        int penalized = new TileSelector(new RepulsionSettings(0.01, 2)).applyRepulsion(grid);

        assertEquals(16, penalized);
    }

    @Test
    void noRepeats_placesCandidateWhereItFitsBest() {
        // two cells in a row; candidate 0 fits cell (1,0) best, candidate 1 is left for (0,0)
        double[][][] costs = {
                {{0.1}, {0.0}},
                {{0.2}, {0.9}}
        };
        Selection s = new TileSelector(RepulsionSettings.DISABLED, false, new Random(1))
                .select(ScoreGrid.build(costs));

        assertEquals(1, s.candidateAt(0, 0));
        assertEquals(0, s.candidateAt(1, 0));
    }

    @Test
    void noRepeats_everyCellDistinct() {
        Random costsRandom = new Random(42);
        double[][][] costs = new double[12][3][3];
        for (double[][] plane : costs)
            for (double[] column : plane)
                for (int y = 0; y < column.length; y++)
                    column[y] = costsRandom.nextDouble();

        Selection s = new TileSelector(RepulsionSettings.DISABLED, false, new Random(7))
                .select(ScoreGrid.build(costs));

        Set<Integer> seen = new HashSet<>();
        for (int x = 0; x < 3; x++)
            for (int y = 0; y < 3; y++)
                assertTrue(seen.add(s.candidateAt(x, y)), "repeated candidate " + s.candidateAt(x, y));
        assertEquals(9, seen.size());
    }

    @Test
    void noRepeats_sameSeedSameResult() {
        // all costs equal: placement is decided by the tie-breaker alone
        double[][][] costs = new double[6][2][2];
        Selection a = new TileSelector(RepulsionSettings.DISABLED, false, new Random(99)).select(ScoreGrid.build(costs));
        Selection b = new TileSelector(RepulsionSettings.DISABLED, false, new Random(99)).select(ScoreGrid.build(costs));

        assertEquals(a.toString(), b.toString());
    }

    @Test
    void noRepeats_tooFewCandidates() {
        assertThrows(ConfigurationException.class,
                () -> new TileSelector(RepulsionSettings.DISABLED, false, new Random())
                        .select(ScoreGrid.build(new double[3][2][2])));
    }
}
