package com.sizekit.measure;

import java.util.Objects;

/**
 * Binary edge mask with the exact dimensions of the image it was computed from.
 * <p>
 * Takes ownership of the mask array passed in.
 */
public final class EdgeMap {

    private final int width;
    private final int height;
    private final boolean[] edges;

    public EdgeMap(int width, int height, boolean[] edges) {
        Objects.requireNonNull(edges, "edges");
        if (edges.length != PixelBuffer.pixelCount(width, height)) {
            throw new IllegalArgumentException(
                    "Edge mask has " + edges.length + " cells, image is " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.edges = edges;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isEdge(int x, int y) {
        return edges[y * width + x];
    }

    public int edgeCount() {
        int count = 0;
        for (boolean edge : edges) {
            if (edge) count++;
        }
        return count;
    }
}
