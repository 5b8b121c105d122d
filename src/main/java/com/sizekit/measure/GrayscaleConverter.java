package com.sizekit.measure;

/**
 * RGB to luminance reduction (ITU-R BT.601 weights).
 */
public final class GrayscaleConverter {

    private GrayscaleConverter() {}

    public static GrayImage toGray(PixelBuffer buffer) {
        int w = buffer.width();
        int h = buffer.height();
        int[] gray = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = buffer.rgb(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                gray[y * w + x] = luminance(r, g, b);
            }
        }
        return new GrayImage(w, h, gray);
    }

    /**
     * Luminance of one sRGB sample (0–255 per channel), rounded to [0, 255].
     */
    public static int luminance(int r, int g, int b) {
        long lum = Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        return (int) Math.max(0, Math.min(255, lum));
    }
}
