package com.sizekit.measure;

import java.util.List;
import java.util.Objects;

/**
 * One nail measurement per digit, in {@link Digit} order, plus the calibration they share.
 */
public record HandMeasurement(List<NailMeasurement> nails, Calibration calibration) {

    public HandMeasurement {
        Objects.requireNonNull(calibration, "calibration");
        nails = List.copyOf(nails);
    }

    /**
     * @throws IllegalArgumentException when the digit was not measured
     */
    public NailMeasurement get(Digit digit) {
        for (NailMeasurement n : nails) {
            if (n.digit() == digit) return n;
        }
        throw new IllegalArgumentException("No measurement for " + digit);
    }

    public double meanMm() {
        return nails.stream().mapToDouble(NailMeasurement::curvedMm).average().orElse(0.0);
    }

    public double minMm() {
        return nails.stream().mapToDouble(NailMeasurement::curvedMm).min().orElse(0.0);
    }

    public double maxMm() {
        return nails.stream().mapToDouble(NailMeasurement::curvedMm).max().orElse(0.0);
    }

    public double meanSize() {
        return nails.stream().mapToInt(NailMeasurement::size).average().orElse(0.0);
    }

    /** Largest minus smallest size number. */
    public int sizeRange() {
        int min = nails.stream().mapToInt(NailMeasurement::size).min().orElse(0);
        int max = nails.stream().mapToInt(NailMeasurement::size).max().orElse(0);
        return max - min;
    }
}
