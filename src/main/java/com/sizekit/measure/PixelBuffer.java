package com.sizekit.measure;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Caller-owned RGB pixel samples of one still image.
 * <p>
 * Pixels are packed as {@code 0xAARRGGBB} (alpha ignored), row-major. The buffer is never
 * modified by the detection pipeline.
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final int[] argb;

    private PixelBuffer(int width, int height, int[] argb) {
        this.width = width;
        this.height = height;
        this.argb = argb;
    }

    /**
     * Wrap packed ARGB samples. The array is used as-is, not copied.
     */
    public static PixelBuffer of(int width, int height, int[] argb) {
        Objects.requireNonNull(argb, "argb");
        int count = pixelCount(width, height);
        if (argb.length != count) {
            throw new IllegalArgumentException(
                    "Expected " + count + " pixels for " + width + "x" + height + ", got " + argb.length);
        }
        return new PixelBuffer(width, height, argb);
    }

    /**
     * {@code width * height} for a positive image size.
     *
     * @throws IllegalArgumentException for a non-positive size or one too large for an array
     */
    static int pixelCount(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must have positive size, got " + width + "x" + height);
        }
        try {
            return Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Image too large: " + width + "x" + height, e);
        }
    }

    public static PixelBuffer fromImage(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        return new PixelBuffer(w, h, argb);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int rgb(int x, int y) {
        return argb[y * width + x];
    }

    public int red(int x, int y) {
        return (rgb(x, y) >> 16) & 0xFF;
    }

    public int green(int x, int y) {
        return (rgb(x, y) >> 8) & 0xFF;
    }

    public int blue(int x, int y) {
        return rgb(x, y) & 0xFF;
    }
}
