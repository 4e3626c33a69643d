package com.flowmable.mosaic;

/**
 * Cost of placing a candidate in a grid cell. Lower is a better visual match;
 * a candidate whose profile equals the cell's profile costs exactly 0.
 * <p>
 * The cost sums, over every sub-sample of the S×S profiles:
 * <pre>
 *   hueDistance(tH, cH) * hueWeight
 * + |tS - cS|           * saturationWeight
 * + |tV - cV|           * valueWeight
 * </pre>
 * where {@code hueDistance} is the shortest way round the hue circle.
 */
public class TileScorer {

    private final ScoreWeights weights;

    public TileScorer() {
        this(ScoreWeights.DEFAULT);
    }

    public TileScorer(ScoreWeights weights) {
        this.weights = weights;
    }

    /**
     * Cost of {@code candidate} for every cell of {@code target}.
     *
     * @return costs indexed {@code [x][y]}
     */
    public double[][] score(TargetGrid target, ColorProfile candidate) {
        double[][] costs = new double[target.xTiles()][target.yTiles()];
        for (int x = 0; x < target.xTiles(); x++) {
            for (int y = 0; y < target.yTiles(); y++) {
                costs[x][y] = cost(target.cell(x, y), candidate);
            }
        }
        return costs;
    }

    /**
     * Cost of one (cell, candidate) pair.
     */
    public double cost(ColorProfile target, ColorProfile candidate) {
        int s = target.subSamples();
        if (candidate.subSamples() != s) {
            throw new IllegalArgumentException("profile sizes differ: " + s + " vs " + candidate.subSamples());
        }

        double total = 0;
        for (int i = 0; i < s; i++) {
            for (int j = 0; j < s; j++) {
                HsvSample t = target.sample(i, j);
                HsvSample c = candidate.sample(i, j);
                total += ColorSpaceUtils.hueDistance(t.hue(), c.hue()) * weights.hue()
                        + Math.abs(t.saturation() - c.saturation()) * weights.saturation()
                        + Math.abs(t.value() - c.value()) * weights.value();
            }
        }
        return total;
    }
}
