package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Directory of previously computed thumbnails, keyed by source file name.
 * <p>
 * A cached thumbnail is only used when its dimensions match the requested
 * thumbnail size exactly; anything else is treated as a miss and will be
 * overwritten by the freshly computed thumbnail.
 */
public class ThumbnailCache {

    private static final Logger logger = LoggerFactory.getLogger(ThumbnailCache.class);

    private final Path directory;
    private final RasterStore store;

    public ThumbnailCache(Path directory, RasterStore store) {
        this.directory = directory;
        this.store = store;
    }

    /**
     * Cached thumbnail for {@code fileName}, if present and exactly {@code size}×{@code size}.
     */
    public Optional<BufferedImage> lookup(String fileName, int size) {
        Path path = directory.resolve(fileName);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            BufferedImage cached = store.load(path);
            if (cached.getWidth() != size || cached.getHeight() != size) {
                logger.debug("Ignoring cached thumbnail {} ({}x{}, wanted {})",
                        path, cached.getWidth(), cached.getHeight(), size);
                return Optional.empty();
            }
            return Optional.of(ImageOps.toRgb(cached));
        } catch (ImageDecodeException e) {
            logger.warn("Ignoring unreadable cached thumbnail: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Write {@code thumbnail} for later runs. Failures are logged, not thrown.
     */
    public void store(String fileName, BufferedImage thumbnail) {
        Path path = directory.resolve(fileName);
        try {
            store.save(thumbnail, path);
        } catch (ImageEncodeException e) {
            logger.warn("Failed to write thumbnail: {}", e.getMessage());
        }
    }
}
