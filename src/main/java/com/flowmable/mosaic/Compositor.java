package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Stitches the chosen thumbnails into the output raster.
 * <p>
 * Output pixel ({@code px}, {@code py}) belongs to cell
 * ({@code px / T}, {@code py / T}) and is copied from pixel
 * ({@code px % T}, {@code py % T}) of that cell's thumbnail.
 */
public class Compositor {

    private final boolean greyscale;

    public Compositor() {
        this(false);
    }

    /**
     * @param greyscale Convert the finished mosaic to greyscale
     */
    public Compositor(boolean greyscale) {
        this.greyscale = greyscale;
    }

    public BufferedImage compose(Selection selection, List<Candidate> candidates, int thumbnailSize) {
        int width = selection.xTiles() * thumbnailSize;
        int height = selection.yTiles() * thumbnailSize;
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);

        int[] row = new int[thumbnailSize];
        for (int x = 0; x < selection.xTiles(); x++) {
            for (int y = 0; y < selection.yTiles(); y++) {
                Candidate candidate = candidates.get(selection.candidateAt(x, y));
                BufferedImage tile = candidate.thumbnail();
                if (tile.getWidth() != thumbnailSize || tile.getHeight() != thumbnailSize) {
                    throw new MosaicException("Thumbnail of " + candidate.source() + " is "
                            + tile.getWidth() + "x" + tile.getHeight() + ", expected " + thumbnailSize);
                }
                int left = x * thumbnailSize;
                int top = y * thumbnailSize;
                for (int ty = 0; ty < thumbnailSize; ty++) {
                    tile.getRGB(0, ty, thumbnailSize, 1, row, 0, thumbnailSize);
                    out.setRGB(left, top + ty, thumbnailSize, 1, row, 0, thumbnailSize);
                }
            }
        }
        return greyscale ? ImageOps.greyscale(out) : out;
    }
}
