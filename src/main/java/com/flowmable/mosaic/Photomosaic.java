package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Top-level entry point for the mosaic pipeline.
 * <p>
 * PIPELINE:
 * 1. Validate configuration and load the target (fatal on failure).
 * 2. Analyze the target grid and prepare candidates concurrently.
 * 3. Score every candidate against every tile, in parallel across candidates.
 * 4. Select one candidate per tile (repulsion or no-repeats assignment).
 * 5. Compose the output raster.
 * <p>
 * All parallel work runs on the caller's {@link JobScheduler}; the pipeline
 * never closes it.
 */
public class Photomosaic {

    private static final Logger logger = LoggerFactory.getLogger(Photomosaic.class);

    private final MosaicConfig config;
    private final RasterStore store;
    private final JobScheduler scheduler;

    public Photomosaic(MosaicConfig config, RasterStore store, JobScheduler scheduler) {
        this.config = config;
        this.store = store;
        this.scheduler = scheduler;
    }

    /**
     * Run the whole pipeline.
     *
     * @throws ConfigurationException if the configuration or candidate pool cannot produce a mosaic
     * @throws ImageDecodeException   if the target image cannot be read
     */
    public MosaicResult build() throws ImageDecodeException {
        long t0 = System.nanoTime();

        // 1. Validate + load target
        config.validate();
        checkFileSystem();
        BufferedImage target = store.load(config.targetImage());
        if (target.getWidth() < config.tileSize() || target.getHeight() < config.tileSize()) {
            throw new ConfigurationException("Target image " + target.getWidth() + "x" + target.getHeight()
                    + " is smaller than one " + config.tileSize() + " pixel tile");
        }
        int tileCount = (target.getWidth() / config.tileSize()) * (target.getHeight() / config.tileSize());
        logger.info("Mosaic will require {} tiles", tileCount);

        // 2. Discover candidate files; reject impossible no-repeat runs before decoding anything
        List<CandidatePreparer.SourceFile> files = CandidatePreparer.discover(config.sources(), config.recursive());
        logger.info("Found {} candidate file(s)", files.size());
        if (files.isEmpty()) {
            throw new ConfigurationException("No files found in the source directories");
        }
        checkRepeatsFeasible(files.size(), tileCount, "candidate file(s)");

        // 3. Target analysis and candidate preparation, side by side
        ColorProfiler profiler = new ColorProfiler(config.greyscaleScoring());
        ThumbnailCache cache = config.thumbnailDirectory() == null
                ? null
                : new ThumbnailCache(config.thumbnailDirectory(), store);
        CandidatePreparer preparer = new CandidatePreparer(scheduler, store, profiler, cache);
        TargetAnalyzer analyzer = new TargetAnalyzer(scheduler, profiler);

        TargetGrid grid;
        List<Candidate> candidates;
        ExecutorService coordinator = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mosaic-candidates");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<List<Candidate>> pending = coordinator.submit(
                    () -> preparer.prepare(files, config.thumbnailSize(), config.subSamples()));
            try {
                grid = analyzer.analyze(target, config.tileSize(), config.subSamples());
            } catch (RuntimeException e) {
                // Let the candidate stage drain before reporting
                drain(pending, e);
                throw e;
            }
            candidates = join(pending);
        } finally {
            coordinator.shutdown();
        }
        checkRepeatsFeasible(candidates.size(), grid.tileCount(), "usable candidate(s)");

        // 4. Score
        ScoreGrid scores = ScoreGrid.build(scoreAll(grid, candidates));

        // 5. Select
        Random random = config.seed().isPresent() ? new Random(config.seed().getAsLong()) : new Random();
        TileSelector selector = new TileSelector(config.repulsion(), config.allowMultipleOccurrences(), random);
        Selection selection = selector.select(scores);

        // 6. Compose
        BufferedImage image = new Compositor(config.greyscaleOutput())
                .compose(selection, candidates, config.thumbnailSize());

        logger.info("Built {}x{} mosaic from {} candidate(s) in {} ms",
                image.getWidth(), image.getHeight(), candidates.size(), (System.nanoTime() - t0) / 1_000_000);
        return new MosaicResult(image, target, grid, candidates, selection);
    }

    /**
     * One unit per candidate; each writes its own {@code [candidate]} slot.
     */
    private double[][][] scoreAll(TargetGrid grid, List<Candidate> candidates) {
        long t0 = System.nanoTime();
        TileScorer scorer = new TileScorer(config.weights());
        double[][][] costs = new double[candidates.size()][][];

        JobScheduler.Batch batch = scheduler.newBatch();
        for (int k = 0; k < candidates.size(); k++) {
            final int slot = k;
            final ColorProfile profile = candidates.get(k).profile();
            batch.submit(() -> costs[slot] = scorer.score(grid, profile));
        }
        int failures = batch.awaitAll();
        if (failures > 0) {
            throw new MosaicException(failures + " candidate(s) could not be scored");
        }
        logger.info("Scored {} candidate(s) against {} tile(s) in {} ms",
                candidates.size(), grid.tileCount(), (System.nanoTime() - t0) / 1_000_000);
        return costs;
    }

    private void checkFileSystem() {
        List<String> problems = new ArrayList<>();
        for (SourceDirectory source : config.sources()) {
            if (!Files.isDirectory(source.directory())) {
                problems.add("Source directory " + source.directory() + " does not exist");
            }
        }
        if (config.thumbnailDirectory() != null && !Files.isDirectory(config.thumbnailDirectory())) {
            problems.add("Thumbnail directory " + config.thumbnailDirectory() + " does not exist");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private void checkRepeatsFeasible(int available, int tileCount, String what) {
        if (!config.allowMultipleOccurrences() && available < tileCount) {
            throw new ConfigurationException("Not enough images to avoid repeats: "
                    + available + " " + what + " for " + tileCount + " tile(s)");
        }
    }

    /**
     * Wait for {@code future} after {@code failure} has already ended the run;
     * its own outcome is attached to {@code failure} as suppressed.
     */
    private static void drain(Future<?> future, RuntimeException failure) {
        try {
            join(future);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private static <T> T join(Future<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new MosaicException("Candidate preparation failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MosaicException("Interrupted while preparing candidates", e);
        }
    }
}
