package com.sizekit.measure;

import java.util.Objects;

/**
 * Pixel width to millimeters to ordinal nail size.
 */
public class UnitConverter {

    private final SizeTable sizeTable;
    private final double curvatureMultiplier;

    public UnitConverter() {
        this(SizeTable.DEFAULT, MeasurementSettings.DEFAULT);
    }

    public UnitConverter(SizeTable sizeTable, MeasurementSettings settings) {
        this.sizeTable = Objects.requireNonNull(sizeTable, "sizeTable");
        this.curvatureMultiplier = settings.curvatureMultiplier();
    }

    public double chordMm(double widthPixels, Calibration calibration) {
        return calibration.toMillimeters(widthPixels);
    }

    /** Straight width scaled up to approximate the width along the nail's curved surface. */
    public double curvedMm(double chordMm) {
        return chordMm * curvatureMultiplier;
    }

    public int mmToSize(double mm) {
        return sizeTable.mmToSize(mm);
    }

    public SizeTable.Entry sizeToMm(int size) {
        return sizeTable.sizeToMm(size);
    }

    /**
     * @param handConfidence Landmark detector confidence, clamped to [0, 1]
     */
    public NailMeasurement convert(Digit digit, NailBoundary boundary, Calibration calibration,
                                   double handConfidence) {
        double chord = chordMm(boundary.widthPixels(), calibration);
        double curved = curvedMm(chord);
        double confidence = clamp01(handConfidence) * boundary.rowAgreement();
        return new NailMeasurement(digit, boundary.widthPixels(), chord, curved, mmToSize(curved), confidence);
    }

    public double curvatureMultiplier() {
        return curvatureMultiplier;
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
