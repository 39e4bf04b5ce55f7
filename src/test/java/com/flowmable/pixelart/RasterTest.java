package com.flowmable.pixelart;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class RasterTest {

    @Test
    void fromImage_straightRgba() {
        BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0x80FF4020);
        img.setRGB(1, 0, 0xFF000000);

        Raster raster = Raster.fromImage(img);
        assertEquals(2, raster.width());
        assertEquals(1, raster.height());
        assertEquals(0xFF, raster.red(0, 0));
        assertEquals(0x40, raster.green(0, 0));
        assertEquals(0x20, raster.blue(0, 0));
        assertEquals(0x80, raster.alpha(0, 0));
        assertEquals(0xFF, raster.alpha(1, 0));
    }

    @Test
    void fromImage_noAlphaChannelIsOpaque() {
        BufferedImage img = new BufferedImage(3, 3, BufferedImage.TYPE_INT_RGB);
        Raster raster = Raster.fromImage(img);
        assertEquals(255, raster.alpha(1, 1));
    }

    @Test
    void toImage_preservesPixels() {
        Raster raster = Raster.filled(3, 2, 10, 20, 30, 255);
        BufferedImage img = raster.toImage();
        assertEquals(3, img.getWidth());
        assertEquals(2, img.getHeight());
        assertEquals(0xFF0A141E, img.getRGB(2, 1));
        assertEquals(raster, Raster.fromImage(img));
    }

    @Test
    void constructor_rejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> new Raster(0, 1, new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new Raster(2, 2, new byte[15]));
        assertThrows(IllegalArgumentException.class, () -> new Raster(1, 1, null));
    }

    @Test
    void constructor_copiesBuffer() {
        byte[] data = {1, 2, 3, 4};
        Raster raster = new Raster(1, 1, data);
        data[0] = 99;
        assertEquals(1, raster.red(0, 0));
    }

    @Test
    void byteSize_computedWithoutOverflow() {
        assertEquals(4L * 1000 * 1000, Raster.byteSize(1000, 1000));
        // 23200^2 * 4 wraps negative in int arithmetic
        assertThrows(IllegalArgumentException.class, () -> Raster.byteSize(23_200, 23_200));
        assertThrows(IllegalArgumentException.class, () -> Raster.byteSize(0, 5));
    }

    @Test
    void fromImage_hugeImageRejectedBeforeAllocation() {
        // 1 bit per pixel keeps the source small
        BufferedImage huge = new BufferedImage(23_200, 23_200, BufferedImage.TYPE_BYTE_BINARY);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Raster.fromImage(huge));
        assertTrue(e.getMessage().contains("too large"), e.getMessage());
    }
}
