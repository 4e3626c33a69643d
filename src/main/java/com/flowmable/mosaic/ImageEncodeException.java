package com.flowmable.mosaic;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An image could not be encoded or written.
 */
public class ImageEncodeException extends IOException {

    private final Path path;

    public ImageEncodeException(Path path, String reason) {
        super("Failed to write image " + path + ": " + reason);
        this.path = path;
    }

    public ImageEncodeException(Path path, Throwable cause) {
        super("Failed to write image " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
