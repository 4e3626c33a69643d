package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Partitions the target image into a grid of tiles and profiles each tile.
 * <p>
 * When the image size is not a multiple of the tile size, the grid is
 * anchored to the bottom-right: the leftover strip on the left and top
 * edges is skipped rather than stretching any tile.
 */
public class TargetAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TargetAnalyzer.class);

    private final JobScheduler scheduler;
    private final ColorProfiler profiler;

    public TargetAnalyzer(JobScheduler scheduler, ColorProfiler profiler) {
        this.scheduler = scheduler;
        this.profiler = profiler;
    }

    /**
     * Profile every tile of {@code target}, one unit of work per tile.
     *
     * @throws ConfigurationException if the target is smaller than one tile
     * @throws MosaicException        if any tile failed to profile
     */
    public TargetGrid analyze(BufferedImage target, int tileSize, int subSamples) {
        int width = target.getWidth();
        int height = target.getHeight();
        int xTiles = width / tileSize;
        int yTiles = height / tileSize;
        if (xTiles == 0 || yTiles == 0) {
            throw new ConfigurationException("Target image " + width + "x" + height
                    + " is smaller than one " + tileSize + " pixel tile");
        }

        int xOffset = width - xTiles * tileSize;
        int yOffset = height - yTiles * tileSize;
        logger.info("Target {}x{} -> {}x{} tiles ({} total), border offset ({}, {})",
                width, height, xTiles, yTiles, xTiles * yTiles, xOffset, yOffset);

        ColorProfile[][] cells = new ColorProfile[xTiles][yTiles];
        JobScheduler.Batch batch = scheduler.newBatch();
        for (int x = 0; x < xTiles; x++) {
            for (int y = 0; y < yTiles; y++) {
                final int cx = x;
                final int cy = y;
                batch.submit(() -> cells[cx][cy] = profiler.profile(target,
                        xOffset + cx * tileSize, yOffset + cy * tileSize, tileSize, subSamples));
            }
        }

        int failures = batch.awaitAll();
        if (failures > 0) {
            throw new MosaicException(failures + " target tile(s) could not be profiled");
        }
        return new TargetGrid(cells, tileSize, xOffset, yOffset);
    }
}
