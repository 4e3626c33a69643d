package com.flowmable.mosaic;

/**
 * Relative importance of each HSV component when scoring a tile.
 *
 * @param hue        Weight of the circular hue distance
 * @param saturation Weight of the absolute saturation difference
 * @param value      Weight of the absolute value (brightness) difference
 */
public record ScoreWeights(double hue, double saturation, double value) {

    public static final ScoreWeights DEFAULT = new ScoreWeights(1.0, 1.0, 1.0);
}
