package com.sizekit.measure;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitConverterTest {

    private final UnitConverter converter = new UnitConverter();
    private final Calibration fivePxPerMm = new Calibration(5.0, 85.6, 428.0);

    static NailBoundary boundary(int widthPixels, double rowAgreement) {
        return new NailBoundary(new Point(100, 100), 100, 100 - widthPixels / 2,
                100 - widthPixels / 2 + widthPixels - 1, widthPixels, 150, 220, 157.5, rowAgreement);
    }

    @Test
    void thumbAt75Pixels_isSizeOne() {
        NailMeasurement m = converter.convert(Digit.THUMB, boundary(75, 1.0), fivePxPerMm, 1.0);

        assertEquals(15.0, m.chordMm(), 1e-9);
        assertEquals(15.9, m.curvedMm(), 1e-9);
        assertEquals(1, m.size());
        assertEquals(15.9, m.roundedMm(), 1e-9);
        assertEquals(Digit.THUMB, m.digit());
    }

    @Test
    void curvatureMultiplier_isConfigurable() {
        UnitConverter flat = new UnitConverter(SizeTable.DEFAULT,
                MeasurementSettings.DEFAULT.withCurvatureMultiplier(1.0));
        NailMeasurement m = flat.convert(Digit.THUMB, boundary(75, 1.0), fivePxPerMm, 1.0);

        assertEquals(15.0, m.curvedMm(), 1e-9);
        assertEquals(1, m.size());
        assertEquals(1.0, flat.curvatureMultiplier());
    }

    @Test
    void confidence_isHandConfidenceTimesAgreement() {
        NailMeasurement m = converter.convert(Digit.INDEX, boundary(65, 0.5), fivePxPerMm, 0.9);
        assertEquals(0.45, m.confidence(), 1e-9);
    }

    @Test
    void handConfidence_clamped() {
        assertEquals(1.0, converter.convert(Digit.INDEX, boundary(65, 1.0), fivePxPerMm, 3.0).confidence(), 1e-9);
        assertEquals(0.0, converter.convert(Digit.INDEX, boundary(65, 1.0), fivePxPerMm, -1.0).confidence(), 1e-9);
    }

    @Test
    void sizeToMm_delegatesToTable() {
        SizeTable.Entry e = converter.sizeToMm(4);
        assertEquals(12.0, e.minMm(), 1e-9);
        assertEquals(13.0, e.maxMm(), 1e-9);
        assertEquals(4, converter.mmToSize(12.72));
    }
}
