package com.flowmable.mosaic;

/**
 * One averaged color sample in HSV space.
 *
 * @param hue        Hue on the unit circle [0, 1); 0 and 1 are adjacent
 * @param saturation Saturation [0, 1]
 * @param value      Value (brightness) [0, 1]
 */
public record HsvSample(double hue, double saturation, double value) {}
