package com.flowmable.mosaic;

/**
 * Tuning of the spatial repulsion penalty between identical tile choices.
 *
 * @param scale              Penalty multiplier; 0 disables repulsion
 * @param minimumClusterSize Candidates chosen in fewer cells than this are not penalized
 */
public record RepulsionSettings(double scale, int minimumClusterSize) {

    public static final RepulsionSettings DISABLED = new RepulsionSettings(0.0, 2);

    public boolean enabled() {
        return scale > 0;
    }
}
