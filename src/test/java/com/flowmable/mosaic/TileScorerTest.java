package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TileScorerTest {

    private static final HsvSample TEAL = new HsvSample(0.45, 0.6, 0.7);

    @Test
    void identicalProfiles_costNothing() {
        ColorProfile p = ColorProfile.uniform(TEAL, 3);
        assertEquals(0.0, new TileScorer().cost(p, p), 0.0);
    }

    @Test
    void perturbation_addsItsWeightedTerm() {
        TileScorer scorer = new TileScorer(new ScoreWeights(1.0, 2.0, 3.0));
        ColorProfile target = ColorProfile.uniform(TEAL, 2);

        ColorProfile satOff = target.with(1, 0, new HsvSample(0.45, 0.35, 0.7));
        assertEquals(0.25 * 2.0, scorer.cost(target, satOff), 1e-12);

        ColorProfile valOff = target.with(0, 1, new HsvSample(0.45, 0.6, 0.6));
        assertEquals(0.1 * 3.0, scorer.cost(target, valOff), 1e-12);
    }

    @Test
    void hueTerm_wrapsAroundTheCircle() {
        TileScorer scorer = new TileScorer(new ScoreWeights(1.0, 0.0, 0.0));
        ColorProfile a = ColorProfile.uniform(new HsvSample(0.95, 0.5, 0.5));
        ColorProfile b = ColorProfile.uniform(new HsvSample(0.05, 0.5, 0.5));

        assertEquals(0.1, scorer.cost(a, b), 1e-12);
    }

    @Test
    void zeroWeight_ignoresComponent() {
        TileScorer scorer = new TileScorer(new ScoreWeights(0.0, 1.0, 1.0));
        ColorProfile a = ColorProfile.uniform(new HsvSample(0.1, 0.5, 0.5));
        ColorProfile b = ColorProfile.uniform(new HsvSample(0.6, 0.5, 0.5));

        assertEquals(0.0, scorer.cost(a, b), 0.0);
    }

    @Test
    void score_coversEveryCell() {
        ColorProfile red = ColorProfile.uniform(new HsvSample(1.0 / 6, 1, 1));
        ColorProfile blue = ColorProfile.uniform(new HsvSample(5.0 / 6, 1, 1));
        TargetGrid grid = TargetGrid.of(new ColorProfile[][]{{red, blue}, {blue, red}, {red, red}}, 10);

        double[][] costs = new TileScorer().score(grid, red);

        assertEquals(3, costs.length);
        assertEquals(2, costs[0].length);
        assertEquals(0.0, costs[0][0], 0.0);
        assertEquals(1.0 / 3, costs[0][1], 1e-12);
        assertEquals(0.0, costs[2][1], 0.0);
    }

    @Test
    void mismatchedSampleCounts_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TileScorer().cost(ColorProfile.uniform(TEAL, 1), ColorProfile.uniform(TEAL, 2)));
    }
}
