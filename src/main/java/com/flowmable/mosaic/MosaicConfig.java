package com.flowmable.mosaic;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Every setting of one mosaic run.
 *
 * @param sources                  Candidate photo directories with their crop hints
 * @param recursive                Also scan sub-directories of each source
 * @param targetImage              The image to reconstruct
 * @param outputFile               Where the mosaic is written
 * @param thumbnailDirectory       Thumbnail cache directory, or null for none
 * @param tileSize                 Target pixels per tile side
 * @param thumbnailSize            Output pixels per tile side
 * @param subSamples               Color samples per tile side (S); must divide both sizes
 * @param weights                  HSV component weights for scoring
 * @param repulsion                Clustering penalty settings
 * @param allowMultipleOccurrences Whether a candidate may fill more than one cell
 * @param greyscaleOutput          Convert the finished mosaic to greyscale
 * @param greyscaleScoring         Match on brightness only
 * @param seed                     Seed for tie-breaking randomness, if reproducibility is wanted
 * @param workerThreads            Worker pool size; 0 picks a default from the processor count
 */
public record MosaicConfig(
        List<SourceDirectory> sources,
        boolean recursive,
        Path targetImage,
        Path outputFile,
        Path thumbnailDirectory,
        int tileSize,
        int thumbnailSize,
        int subSamples,
        ScoreWeights weights,
        RepulsionSettings repulsion,
        boolean allowMultipleOccurrences,
        boolean greyscaleOutput,
        boolean greyscaleScoring,
        OptionalLong seed,
        int workerThreads
) {
    public MosaicConfig {
        sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
        weights = Objects.requireNonNullElse(weights, ScoreWeights.DEFAULT);
        repulsion = Objects.requireNonNullElse(repulsion, RepulsionSettings.DISABLED);
        seed = Objects.requireNonNullElse(seed, OptionalLong.empty());
    }

    /**
     * Minimal configuration with defaults for every optional setting.
     */
    public static MosaicConfig of(List<SourceDirectory> sources, Path targetImage, Path outputFile,
                                  int tileSize, int thumbnailSize, int subSamples) {
        return new MosaicConfig(sources, false, targetImage, outputFile, null,
                tileSize, thumbnailSize, subSamples,
                ScoreWeights.DEFAULT, RepulsionSettings.DISABLED,
                true, false, false, OptionalLong.empty(), 0);
    }

    public MosaicConfig withRepulsion(RepulsionSettings settings) {
        return new MosaicConfig(sources, recursive, targetImage, outputFile, thumbnailDirectory,
                tileSize, thumbnailSize, subSamples, weights, settings,
                allowMultipleOccurrences, greyscaleOutput, greyscaleScoring, seed, workerThreads);
    }

    public MosaicConfig withAllowMultipleOccurrences(boolean allow) {
        return new MosaicConfig(sources, recursive, targetImage, outputFile, thumbnailDirectory,
                tileSize, thumbnailSize, subSamples, weights, repulsion,
                allow, greyscaleOutput, greyscaleScoring, seed, workerThreads);
    }

    public MosaicConfig withThumbnailDirectory(Path directory) {
        return new MosaicConfig(sources, recursive, targetImage, outputFile, directory,
                tileSize, thumbnailSize, subSamples, weights, repulsion,
                allowMultipleOccurrences, greyscaleOutput, greyscaleScoring, seed, workerThreads);
    }

    /**
     * Check every value-level rule and report all violations at once.
     * File-system checks happen when the pipeline starts.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (sources.isEmpty()) {
            problems.add("At least one source directory must be specified");
        }
        if (targetImage == null) {
            problems.add("targetImage must be specified");
        }
        if (outputFile == null) {
            problems.add("outputFile must be specified");
        }
        if (tileSize <= 0) {
            problems.add("tileSize must be strictly positive, got " + tileSize);
        }
        if (thumbnailSize <= 0) {
            problems.add("thumbnailSize must be strictly positive, got " + thumbnailSize);
        }
        if (subSamples < 1) {
            problems.add("subSamples must be at least 1, got " + subSamples);
        } else {
            if (tileSize > 0 && tileSize % subSamples != 0) {
                problems.add("subSamples (" + subSamples + ") must divide tileSize (" + tileSize + ")");
            }
            if (thumbnailSize > 0 && thumbnailSize % subSamples != 0) {
                problems.add("subSamples (" + subSamples + ") must divide thumbnailSize (" + thumbnailSize + ")");
            }
        }
        if (weights.hue() < 0 || weights.saturation() < 0 || weights.value() < 0) {
            problems.add("Score weights must be positive, got " + weights);
        }
        if (repulsion.scale() < 0) {
            problems.add("repulsionScale must be positive, got " + repulsion.scale());
        }
        if (repulsion.minimumClusterSize() < 0) {
            problems.add("minimumClusterSize must be positive, got " + repulsion.minimumClusterSize());
        }
        if (workerThreads < 0) {
            problems.add("workerThreads must be positive, got " + workerThreads);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }
}
