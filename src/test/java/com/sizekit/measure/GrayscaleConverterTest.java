package com.sizekit.measure;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class GrayscaleConverterTest {

    @Test
    void luminance_primaries() {
        assertEquals(255, GrayscaleConverter.luminance(255, 255, 255));
        assertEquals(0, GrayscaleConverter.luminance(0, 0, 0));
        assertEquals(76, GrayscaleConverter.luminance(255, 0, 0));
        assertEquals(150, GrayscaleConverter.luminance(0, 255, 0));
        assertEquals(29, GrayscaleConverter.luminance(0, 0, 255));
    }

    @Test
    void neutralGray_keepsItsValue() {
        for (int v = 0; v <= 255; v += 17) {
            assertEquals(v, GrayscaleConverter.luminance(v, v, v), "gray " + v);
        }
    }

    @Test
    void toGray_fromBufferedImage() {
        BufferedImage img = new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB);
        img.setRGB(2, 1, 0xFF0000);
        img.setRGB(3, 2, 0xFFFFFF);

        GrayImage gray = GrayscaleConverter.toGray(PixelBuffer.fromImage(img));

        assertEquals(4, gray.width());
        assertEquals(3, gray.height());
        assertEquals(76, gray.get(2, 1));
        assertEquals(255, gray.get(3, 2));
        assertEquals(0, gray.get(0, 0));
    }

    @Test
    void toGray_ignoresAlpha() {
        PixelBuffer buffer = PixelBuffer.of(2, 1, new int[]{0x00808080, 0xFF808080});
        GrayImage gray = GrayscaleConverter.toGray(buffer);
        assertEquals(gray.get(0, 0), gray.get(1, 0));
    }

    @Test
    void pixelBuffer_rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.of(3, 3, new int[8]));
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.of(0, 3, new int[0]));
        assertThrows(NullPointerException.class, () -> PixelBuffer.of(1, 1, null));
    }

    @Test
    void pixelBuffer_sizeOverflow_rejected() {
        // 65536 * 65536 wraps to 0 in int arithmetic
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PixelBuffer.of(65536, 65536, new int[0]));
        assertInstanceOf(ArithmeticException.class, e.getCause());
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.of(100_000, 100_000, new int[1]));
    }

    @Test
    void grayImage_validatesSize() {
        assertThrows(IllegalArgumentException.class, () -> new GrayImage(3, 3, new int[8]));
        assertThrows(IllegalArgumentException.class, () -> new GrayImage(65536, 65536, new int[0]));
        assertThrows(IllegalArgumentException.class, () -> new GrayImage(-2, -2, new int[4]));
    }

    @Test
    void grayImage_boundsAndAccess() {
        GrayImage gray = new GrayImage(3, 2, new int[]{1, 2, 3, 4, 5, 6});
        assertEquals(6, gray.get(2, 1));
        assertTrue(gray.inBounds(2, 1));
        assertFalse(gray.inBounds(3, 0));
        assertFalse(gray.inBounds(0, -1));
    }

    @Test
    void pixelBuffer_channels() {
        PixelBuffer buffer = PixelBuffer.of(1, 1, new int[]{0xFF123456});
        assertEquals(0x12, buffer.red(0, 0));
        assertEquals(0x34, buffer.green(0, 0));
        assertEquals(0x56, buffer.blue(0, 0));
    }
}
