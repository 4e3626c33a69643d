package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static com.flowmable.mosaic.TestImages.*;
import static org.junit.jupiter.api.Assertions.*;

class CompositorTest {

    private static Candidate candidate(String name, int size, int rgb) {
        return new Candidate(Path.of(name), solid(size, size, rgb), ColorProfile.uniform(new HsvSample(0, 0, 0)));
    }

    private static final List<Candidate> CANDIDATES = List.of(
            candidate("red.png", 4, RED),
            candidate("green.png", 4, GREEN),
            candidate("blue.png", 4, BLUE));

    @Test
    void pixelsComeFromTheChosenThumbnail() {
        Selection selection = Selection.of(new int[][]{{0, 2}, {1, 0}, {2, 2}});

        BufferedImage out = new Compositor().compose(selection, CANDIDATES, 4);

        assertEquals(12, out.getWidth());
        assertEquals(8, out.getHeight());
        assertEquals(RED, rgb(out, 0, 0));
        assertEquals(BLUE, rgb(out, 3, 7));
        assertEquals(GREEN, rgb(out, 5, 1));
        assertEquals(RED, rgb(out, 7, 4));
        assertEquals(BLUE, rgb(out, 11, 7));
    }

    @Test
    void greyscaleOutput() {
        BufferedImage out = new Compositor(true).compose(Selection.of(new int[][]{{1}}), CANDIDATES, 4);

        int p = rgb(out, 2, 2);
        assertEquals(150, (p >> 16) & 0xFF);
        assertEquals((p >> 16) & 0xFF, (p >> 8) & 0xFF);
        assertEquals((p >> 8) & 0xFF, p & 0xFF);
    }

    @Test
    void wrongThumbnailSize_rejected() {
        assertThrows(MosaicException.class,
                () -> new Compositor().compose(Selection.of(new int[][]{{0}}), CANDIDATES, 5));
    }

    @Test
    void selectionRejectsUnassignedCells() {
        assertThrows(IllegalArgumentException.class, () -> Selection.of(new int[][]{{0, -1}}));
    }
}
