package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.util.HashMap;
import java.util.Map;

/**
 * Post-run measurements of a finished mosaic.
 */
public final class MosaicStatistics {

    private MosaicStatistics() {}

    /**
     * Signed sum of per-pixel channel differences, target minus mosaic.
     * Positive values mean the mosaic is darker than the target in that channel.
     */
    public record ChannelError(long red, long green, long blue) {}

    /**
     * How the candidate pool was used.
     *
     * @param distinctCandidates Number of different candidates in the mosaic
     * @param maxOccurrences     Highest number of cells sharing one candidate
     */
    public record Usage(int distinctCandidates, int maxOccurrences) {}

    /**
     * Compare the mosaic, rescaled to the target's size, against the target.
     */
    public static ChannelError relativeError(BufferedImage target, BufferedImage mosaic) {
        int w = target.getWidth();
        int h = target.getHeight();
        BufferedImage rescaled = ImageOps.scale(mosaic, w, h);

        long red = 0, green = 0, blue = 0;
        int[] tRow = new int[w];
        int[] mRow = new int[w];
        for (int y = 0; y < h; y++) {
            target.getRGB(0, y, w, 1, tRow, 0, w);
            rescaled.getRGB(0, y, w, 1, mRow, 0, w);
            for (int x = 0; x < w; x++) {
                red += ((tRow[x] >> 16) & 0xFF) - ((mRow[x] >> 16) & 0xFF);
                green += ((tRow[x] >> 8) & 0xFF) - ((mRow[x] >> 8) & 0xFF);
                blue += (tRow[x] & 0xFF) - (mRow[x] & 0xFF);
            }
        }
        return new ChannelError(red, green, blue);
    }

    public static Usage usage(Selection selection) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int x = 0; x < selection.xTiles(); x++) {
            for (int y = 0; y < selection.yTiles(); y++) {
                counts.merge(selection.candidateAt(x, y), 1, Integer::sum);
            }
        }
        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return new Usage(counts.size(), max);
    }
}
