package com.sizekit.measure;

import java.util.Objects;

/**
 * Single-channel luminance image, one value in [0, 255] per pixel, row-major.
 * <p>
 * Takes ownership of the value array passed in; callers must not modify it afterwards.
 */
public final class GrayImage {

    private final int width;
    private final int height;
    private final int[] values;

    public GrayImage(int width, int height, int[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length != PixelBuffer.pixelCount(width, height)) {
            throw new IllegalArgumentException(
                    "Expected " + ((long) width * height) + " values for " + width + "x" + height + ", got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int get(int x, int y) {
        return values[y * width + x];
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /** Backing array, shared for the Sobel loop. Read-only by convention. */
    int[] values() {
        return values;
    }
}
