package com.flowmable.mosaic;

/**
 * Unrecoverable failure inside the mosaic pipeline.
 */
public class MosaicException extends RuntimeException {

    public MosaicException(String message) {
        super(message);
    }

    public MosaicException(String message, Throwable cause) {
        super(message, cause);
    }
}
