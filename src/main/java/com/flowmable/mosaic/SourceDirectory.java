package com.flowmable.mosaic;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A directory of candidate photos and the crop hint applied to all of them.
 */
public record SourceDirectory(Path directory, CropHint cropHint) {

    public SourceDirectory {
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(cropHint, "cropHint must not be null");
    }

    public static SourceDirectory centered(Path directory) {
        return new SourceDirectory(directory, CropHint.CENTER);
    }
}
