package com.sizekit.measure;

/**
 * Axis-aligned pixel rectangle. {@code x}/{@code y} are inclusive, {@code right()}/{@code bottom()} exclusive.
 * <p>
 * Used for the caller's guide region and for the region of interest of a locked detection.
 */
public record Region(int x, int y, int width, int height) {

    public Region {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region must have positive size, got " + width + "x" + height);
        }
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public boolean contains(double px, double py) {
        return px >= x && px < right() && py >= y && py < bottom();
    }

    /**
     * Grow the region by {@code padding} pixels on every side.
     */
    public Region padded(int padding) {
        return new Region(x - padding, y - padding, width + 2 * padding, height + 2 * padding);
    }

    /**
     * Clip to a {@code frameWidth x frameHeight} frame.
     *
     * @return the clipped region, or null when nothing of it lies inside the frame
     */
    public Region clip(int frameWidth, int frameHeight) {
        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int x1 = Math.min(frameWidth, right());
        int y1 = Math.min(frameHeight, bottom());
        if (x1 <= x0 || y1 <= y0) {
            return null;
        }
        return new Region(x0, y0, x1 - x0, y1 - y0);
    }
}
