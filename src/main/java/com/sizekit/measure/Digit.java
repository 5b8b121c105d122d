package com.sizekit.measure;

/**
 * The five digits of a hand, with their positions in the 21-point hand landmark layout
 * (0 = wrist, then four points per digit from base to tip).
 */
public enum Digit {
    THUMB("Thumb", 4, 0, 2),
    INDEX("Index", 8, 3, 5),
    MIDDLE("Middle", 12, 4, 6),
    RING("Ring", 16, 6, 8),
    PINKY("Pinky", 20, 8, 11);

    /** Points in a complete hand landmark array. */
    public static final int LANDMARK_COUNT = 21;

    private final String displayName;
    private final int tipIndex;
    private final int typicalMinSize;
    private final int typicalMaxSize;

    Digit(String displayName, int tipIndex, int typicalMinSize, int typicalMaxSize) {
        this.displayName = displayName;
        this.tipIndex = tipIndex;
        this.typicalMinSize = typicalMinSize;
        this.typicalMaxSize = typicalMaxSize;
    }

    public String displayName() {
        return displayName;
    }

    public int tipIndex() {
        return tipIndex;
    }

    /** Landmark of the digit's first joint: CMC for the thumb, MCP for the fingers. */
    public int baseIndex() {
        return tipIndex - 3;
    }

    public int typicalMinSize() {
        return typicalMinSize;
    }

    public int typicalMaxSize() {
        return typicalMaxSize;
    }
}
