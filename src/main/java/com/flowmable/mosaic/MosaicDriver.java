package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * CLI driver: reads a JSON configuration, builds the mosaic and writes it.
 * <p>
 * Usage: {@code MosaicDriver <config.json>}. Exits with status 0 on success
 * and 1 on any usage, configuration, decode or encode error.
 */
public class MosaicDriver {

    private static final Logger logger = LoggerFactory.getLogger(MosaicDriver.class);

    public static void main(String[] args) {
        System.exit(run(args, new ImageIoRasterStore()));
    }

    static int run(String[] args, RasterStore store) {
        if (args.length != 1) {
            logger.error("Usage: MosaicDriver <config file>");
            return 1;
        }

        try {
            MosaicConfig config = MosaicConfigFile.read(Path.of(args[0]));
            config.validate();
            reportConfiguration(config);

            int workers = config.workerThreads() > 0 ? config.workerThreads() : JobScheduler.defaultWorkerCount();
            MosaicResult result;
            try (JobScheduler scheduler = new JobScheduler(workers)) {
                result = new Photomosaic(config, store, scheduler).build();
            }

            logger.info("Saving mosaic to '{}'", config.outputFile());
            store.save(result.image(), config.outputFile());
            reportStatistics(result);
            return 0;
        } catch (ConfigurationException e) {
            for (String problem : e.problems()) {
                logger.error("Configuration error: {}", problem);
            }
            return 1;
        } catch (IOException e) {
            logger.error(e.getMessage(), e);
            return 1;
        } catch (MosaicException e) {
            logger.error("Mosaic failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private static void reportConfiguration(MosaicConfig config) {
        logger.info("=== Photomosaic ===");
        for (SourceDirectory source : config.sources()) {
            logger.info("Using photos from {} (crop {}){}", source.directory(),
                    source.cropHint().name().toLowerCase(java.util.Locale.ROOT), config.recursive() ? " and sub-directories" : "");
        }
        logger.info("Target image is {}", config.targetImage());
        logger.info("Sub-photos will be rescaled to {} pixels square and replace {} pixel square blocks of the target",
                config.thumbnailSize(), config.tileSize());
        logger.info("Images will be color sampled {} times", config.subSamples() * config.subSamples());
        logger.info("Weights: hue={} saturation={} value={}",
                config.weights().hue(), config.weights().saturation(), config.weights().value());
        if (config.repulsion().enabled()) {
            logger.info("Repulsion scale {} for clusters of at least {} tiles",
                    config.repulsion().scale(), config.repulsion().minimumClusterSize());
        }
        if (!config.allowMultipleOccurrences()) {
            logger.info("Repeats are NOT allowed");
        }
        if (config.greyscaleScoring()) {
            logger.info("Tiles will be matched on brightness only");
        }
        if (config.greyscaleOutput()) {
            logger.info("Output image will be greyscale");
        }
        if (config.thumbnailDirectory() != null) {
            logger.info("Thumbnail directory is '{}'", config.thumbnailDirectory());
        }
    }

    private static void reportStatistics(MosaicResult result) {
        MosaicStatistics.ChannelError error = MosaicStatistics.relativeError(result.target(), result.image());
        MosaicStatistics.Usage usage = MosaicStatistics.usage(result.selection());
        logger.info("Relative error: red={} green={} blue={}", error.red(), error.green(), error.blue());
        logger.info("Used {} distinct candidate(s) of {}; most repeated tile appears {} time(s)",
                usage.distinctCandidates(), result.candidates().size(), usage.maxOccurrences());
    }
}
