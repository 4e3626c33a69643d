package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Output of one pipeline run.
 *
 * @param image      The composed mosaic
 * @param target     The decoded target image
 * @param grid       Profiles of the target tiles
 * @param candidates The prepared candidate pool, indexed as in {@code selection}
 * @param selection  Chosen candidate per tile
 */
public record MosaicResult(
        BufferedImage image,
        BufferedImage target,
        TargetGrid grid,
        List<Candidate> candidates,
        Selection selection
) {}
