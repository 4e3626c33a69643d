package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static com.flowmable.mosaic.TestImages.*;
import static org.junit.jupiter.api.Assertions.*;

class ImageOpsTest {

    /** 300x100: red, green, blue thirds. */
    private static BufferedImage thirds() {
        BufferedImage img = new BufferedImage(300, 100, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 100; y++)
            for (int x = 0; x < 300; x++)
                img.setRGB(x, y, x < 100 ? RED : x < 200 ? GREEN : BLUE);
        return img;
    }

    @Test
    void thumbnail_cropsThenScales() {
        BufferedImage left = ImageOps.thumbnail(thirds(), CropHint.LEFT, 10);
        BufferedImage center = ImageOps.thumbnail(thirds(), CropHint.CENTER, 10);
        BufferedImage right = ImageOps.thumbnail(thirds(), CropHint.RIGHT, 10);

        assertEquals(10, left.getWidth());
        assertEquals(10, left.getHeight());
        assertEquals(RED, rgb(left, 5, 5));
        assertEquals(GREEN, rgb(center, 5, 5));
        assertEquals(BLUE, rgb(right, 5, 5));
    }

    @Test
    void scale_producesOpaqueRgb() {
        BufferedImage argb = new BufferedImage(8, 8, BufferedImage.TYPE_INT_ARGB);
        BufferedImage scaled = ImageOps.scale(argb, 4, 2);

        assertEquals(BufferedImage.TYPE_INT_RGB, scaled.getType());
        assertEquals(4, scaled.getWidth());
        assertEquals(2, scaled.getHeight());
    }

    @Test
    void greyscale_equalChannels() {
        BufferedImage grey = ImageOps.greyscale(solid(3, 3, RED));
        int p = rgb(grey, 1, 1);
        assertEquals(76, (p >> 16) & 0xFF);
        assertEquals(76, (p >> 8) & 0xFF);
        assertEquals(76, p & 0xFF);
    }

    @Test
    void toRgb_returnsSameInstanceForRgb() {
        BufferedImage rgbImage = solid(2, 2, BLUE);
        assertSame(rgbImage, ImageOps.toRgb(rgbImage));
    }
}
