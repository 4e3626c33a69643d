package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * A prepared tile: the square thumbnail of one source photo and its color profile.
 * <p>
 * Created once during preparation and never modified afterwards; later stages
 * refer to it by its index in the candidate list.
 *
 * @param source    The photo the thumbnail was made from
 * @param thumbnail Square thumbnail, {@code thumbnailSize} pixels on each side
 * @param profile   Color profile of the thumbnail
 */
public record Candidate(Path source, BufferedImage thumbnail, ColorProfile profile) {

    public int size() {
        return thumbnail.getWidth();
    }
}
