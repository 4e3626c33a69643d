package com.flowmable.mosaic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reads a {@link MosaicConfig} from a JSON file.
 * <p>
 * Expected shape (optional keys shown with their defaults):
 * <pre>
 * {
 *   "sources": [
 *     { "directory": "photos/wide", "cropHint": "left" },
 *     { "directory": "photos/misc" }
 *   ],
 *   "recursive": false,
 *   "targetImage": "target.jpg",
 *   "outputFile": "mosaic.jpg",
 *   "thumbnailDirectory": null,
 *   "tileSize": 20,
 *   "thumbnailSize": 60,
 *   "subSamples": 1,
 *   "hueWeight": 1.0,
 *   "saturationWeight": 1.0,
 *   "valueWeight": 1.0,
 *   "repulsionScale": 0.0,
 *   "minimumClusterSize": 2,
 *   "allowMultipleOccurrences": true,
 *   "greyscaleOutput": false,
 *   "greyscaleScoring": false,
 *   "seed": null,
 *   "workerThreads": 0
 * }
 * </pre>
 * Relative paths are resolved against the directory containing the file.
 * A value of the wrong JSON type is rejected here, naming its key; range
 * rules are left to {@link MosaicConfig#validate()}.
 */
public final class MosaicConfigFile {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MosaicConfigFile() {}

    /**
     * @throws ConfigurationException if the file is missing, unreadable or malformed
     */
    public static MosaicConfig read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file " + file + " does not exist");
        }
        Path base = file.toAbsolutePath().getParent();
        try (InputStream in = Files.newInputStream(file)) {
            return parse(MAPPER.readTree(in), base);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse configuration JSON text, resolving relative paths against {@code base}.
     */
    public static MosaicConfig parse(String json, Path base) {
        try {
            return parse(MAPPER.readTree(json), base);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
    }

    static MosaicConfig parse(JsonNode root, Path base) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }

        List<SourceDirectory> sources = new ArrayList<>();
        for (JsonNode source : root.path("sources")) {
            String directory = source.isTextual() ? source.asText() : source.path("directory").asText(null);
            if (directory == null || directory.isBlank()) {
                throw new ConfigurationException("Every source needs a 'directory'");
            }
            CropHint hint = source.hasNonNull("cropHint")
                    ? CropHint.parse(source.get("cropHint").asText())
                    : CropHint.CENTER;
            sources.add(new SourceDirectory(resolve(base, directory), hint));
        }

        ScoreWeights weights = new ScoreWeights(
                doubleValue(root, "hueWeight", ScoreWeights.DEFAULT.hue()),
                doubleValue(root, "saturationWeight", ScoreWeights.DEFAULT.saturation()),
                doubleValue(root, "valueWeight", ScoreWeights.DEFAULT.value()));
        RepulsionSettings repulsion = new RepulsionSettings(
                doubleValue(root, "repulsionScale", RepulsionSettings.DISABLED.scale()),
                intValue(root, "minimumClusterSize", RepulsionSettings.DISABLED.minimumClusterSize()));
        OptionalLong seed = root.hasNonNull("seed")
                ? OptionalLong.of(integral(root, "seed").asLong())
                : OptionalLong.empty();

        return new MosaicConfig(
                sources,
                booleanValue(root, "recursive", false),
                path(root, "targetImage", base),
                path(root, "outputFile", base),
                path(root, "thumbnailDirectory", base),
                intValue(root, "tileSize", 0),
                intValue(root, "thumbnailSize", 0),
                intValue(root, "subSamples", 1),
                weights,
                repulsion,
                booleanValue(root, "allowMultipleOccurrences", true),
                booleanValue(root, "greyscaleOutput", false),
                booleanValue(root, "greyscaleScoring", false),
                seed,
                intValue(root, "workerThreads", 0)
        );
    }

    private static int intValue(JsonNode root, String key, int defaultValue) {
        if (!root.hasNonNull(key)) {
            return defaultValue;
        }
        JsonNode node = integral(root, key);
        if (!node.canConvertToInt()) {
            throw new ConfigurationException("'" + key + "' is out of range: " + node);
        }
        return node.intValue();
    }

    private static double doubleValue(JsonNode root, String key, double defaultValue) {
        if (!root.hasNonNull(key)) {
            return defaultValue;
        }
        JsonNode node = root.get(key);
        if (!node.isNumber()) {
            throw new ConfigurationException("'" + key + "' must be a number, got " + node);
        }
        return node.doubleValue();
    }

    private static boolean booleanValue(JsonNode root, String key, boolean defaultValue) {
        if (!root.hasNonNull(key)) {
            return defaultValue;
        }
        JsonNode node = root.get(key);
        if (!node.isBoolean()) {
            throw new ConfigurationException("'" + key + "' must be true or false, got " + node);
        }
        return node.booleanValue();
    }

    private static JsonNode integral(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isIntegralNumber()) {
            throw new ConfigurationException("'" + key + "' must be a whole number, got " + node);
        }
        return node;
    }

    private static Path path(JsonNode root, String key, Path base) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return resolve(base, node.asText());
    }

    private static Path resolve(Path base, String value) {
        Path p = Path.of(value);
        return base == null || p.isAbsolute() ? p : base.resolve(p).normalize();
    }
}
