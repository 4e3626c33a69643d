package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static com.flowmable.mosaic.TestImages.*;
import static org.junit.jupiter.api.Assertions.*;

class ColorProfilerTest {

    private final ColorProfiler profiler = new ColorProfiler();

    @Test
    void solidColor_everySampleMatches() {
        ColorProfile profile = profiler.profile(solid(8, 8, BLUE), 2);

        assertEquals(2, profile.subSamples());
        for (int x = 0; x < 2; x++) {
            for (int y = 0; y < 2; y++) {
                HsvSample s = profile.sample(x, y);
                assertEquals(5.0 / 6, s.hue(), 1e-9);
                assertEquals(1.0, s.saturation(), 1e-9);
                assertEquals(1.0, s.value(), 1e-9);
            }
        }
    }

    @Test
    void subCells_followImageLayout() {
        ColorProfile profile = profiler.profile(splitVertical(4, 4, RED, BLUE), 2);

        assertEquals(1.0 / 6, profile.sample(0, 0).hue(), 1e-9);
        assertEquals(1.0 / 6, profile.sample(0, 1).hue(), 1e-9);
        assertEquals(5.0 / 6, profile.sample(1, 0).hue(), 1e-9);
        assertEquals(5.0 / 6, profile.sample(1, 1).hue(), 1e-9);
    }

    @Test
    void singleSample_averagesSaturationAndValue() {
        // half white (s=0, v=1), half black (s=0, v=0)
        ColorProfile profile = profiler.profile(splitVertical(4, 4, 0xFFFFFF, 0x000000), 1);

        assertEquals(0.0, profile.sample(0, 0).saturation(), 1e-9);
        assertEquals(0.5, profile.sample(0, 0).value(), 1e-9);
    }

    @Test
    void window_readsOnlyTheRequestedRegion() {
        BufferedImage img = solid(10, 10, RED);
        for (int y = 5; y < 10; y++)
            for (int x = 5; x < 10; x++)
                img.setRGB(x, y, GREEN);

        ColorProfile profile = profiler.profile(img, 5, 5, 5, 1);
        assertEquals(0.5, profile.sample(0, 0).hue(), 1e-9);
    }

    @Test
    void greyscale_dropsChroma() {
        ColorProfile profile = new ColorProfiler(true).profile(solid(4, 4, RED), 1);

        assertEquals(1.0 / 6, profile.sample(0, 0).hue(), 1e-9);
        assertEquals(0.0, profile.sample(0, 0).saturation(), 1e-9);
        assertEquals(76 / 255.0, profile.sample(0, 0).value(), 1e-9);
    }

    @Test
    void greyscale_differentHuesShareOneHue() {
        ColorProfiler grey = new ColorProfiler(true);
        ColorProfile red = grey.profile(solid(4, 4, RED), 1);
        ColorProfile blue = grey.profile(solid(4, 4, BLUE), 1);

        assertEquals(red.sample(0, 0).hue(), blue.sample(0, 0).hue(), 0.0);
        assertEquals(0.0, new TileScorer(new ScoreWeights(1.0, 1.0, 0.0)).cost(red, blue), 0.0);
    }

    @Test
    void rejectsNonSquareRegion() {
        assertThrows(IllegalArgumentException.class, () -> profiler.profile(solid(4, 6, RED), 1));
    }

    @Test
    void rejectsWindowOutsideImage() {
        assertThrows(IllegalArgumentException.class, () -> profiler.profile(solid(4, 4, RED), 2, 2, 4, 1));
    }
}
