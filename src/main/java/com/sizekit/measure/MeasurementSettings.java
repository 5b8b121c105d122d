package com.sizekit.measure;

/**
 * Scale plausibility and physical conversion settings.
 *
 * @param curvatureMultiplier Chord-to-arc correction applied to the straight nail width.
 *                            1.06 is an empirical value, swap it with {@link #withCurvatureMultiplier(double)}.
 * @param minPixelsPerMm      Smallest plausible scale
 * @param maxPixelsPerMm      Largest plausible scale
 * @param minPlausibleMm      Smallest realistic nail width (advisory validation only)
 * @param maxPlausibleMm      Largest realistic nail width (advisory validation only)
 */
public record MeasurementSettings(
        double curvatureMultiplier,
        double minPixelsPerMm,
        double maxPixelsPerMm,
        double minPlausibleMm,
        double maxPlausibleMm
) {

    public static final MeasurementSettings DEFAULT = new MeasurementSettings(1.06, 2.0, 50.0, 5.0, 20.0);

    public MeasurementSettings {
        if (!(curvatureMultiplier > 0)) {
            throw new IllegalArgumentException("curvatureMultiplier must be > 0, got " + curvatureMultiplier);
        }
        if (!(minPixelsPerMm > 0) || minPixelsPerMm > maxPixelsPerMm) {
            throw new IllegalArgumentException("Scale range must satisfy 0 < min <= max");
        }
        if (minPlausibleMm > maxPlausibleMm) {
            throw new IllegalArgumentException("Plausible range must satisfy min <= max");
        }
    }

    public MeasurementSettings withCurvatureMultiplier(double multiplier) {
        return new MeasurementSettings(multiplier, minPixelsPerMm, maxPixelsPerMm, minPlausibleMm, maxPlausibleMm);
    }

    public MeasurementSettings withScaleRange(double min, double max) {
        return new MeasurementSettings(curvatureMultiplier, min, max, minPlausibleMm, maxPlausibleMm);
    }
}
