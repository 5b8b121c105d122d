package com.sizekit.measure;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tip and base-joint points of all five digits, in {@link Digit} order.
 */
public final class FingertipSet {

    public record Fingertip(Digit digit, Point tip, Point base) {
        public Fingertip {
            Objects.requireNonNull(digit, "digit");
            Objects.requireNonNull(tip, "tip");
            Objects.requireNonNull(base, "base");
        }
    }

    private final List<Fingertip> fingertips;

    private FingertipSet(List<Fingertip> fingertips) {
        this.fingertips = List.copyOf(fingertips);
    }

    /**
     * @param landmarks Hand landmarks in pixel coordinates, at least {@link Digit#LANDMARK_COUNT} points
     * @throws IllegalArgumentException when fewer landmarks are given or one is null
     */
    public static FingertipSet fromLandmarks(List<Point> landmarks) {
        Objects.requireNonNull(landmarks, "landmarks");
        if (landmarks.size() < Digit.LANDMARK_COUNT) {
            throw new IllegalArgumentException("Expected at least " + Digit.LANDMARK_COUNT
                    + " hand landmarks, got " + landmarks.size());
        }
        List<Fingertip> tips = new ArrayList<>(Digit.values().length);
        for (Digit digit : Digit.values()) {
            Point tip = landmarks.get(digit.tipIndex());
            Point base = landmarks.get(digit.baseIndex());
            if (tip == null || base == null) {
                throw new IllegalArgumentException("Missing landmark for " + digit.displayName());
            }
            tips.add(new Fingertip(digit, tip, base));
        }
        return new FingertipSet(tips);
    }

    public Fingertip get(Digit digit) {
        return fingertips.get(digit.ordinal());
    }

    public List<Fingertip> all() {
        return fingertips;
    }
}
