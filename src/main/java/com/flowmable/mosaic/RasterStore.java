package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Reads and writes image files.
 */
public interface RasterStore {

    /**
     * Decode the image at {@code path}.
     *
     * @throws ImageDecodeException if the file is missing, unreadable or not an image
     */
    BufferedImage load(Path path) throws ImageDecodeException;

    /**
     * Encode {@code image} to {@code path}; the format follows the file extension.
     *
     * @throws ImageEncodeException if the image could not be written
     */
    void save(BufferedImage image, Path path) throws ImageEncodeException;
}
