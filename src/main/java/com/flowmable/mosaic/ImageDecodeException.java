package com.flowmable.mosaic;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An image file could not be read or decoded.
 */
public class ImageDecodeException extends IOException {

    private final Path path;

    public ImageDecodeException(Path path, String reason) {
        super("Failed to decode image " + path + ": " + reason);
        this.path = path;
    }

    public ImageDecodeException(Path path, Throwable cause) {
        super("Failed to decode image " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
