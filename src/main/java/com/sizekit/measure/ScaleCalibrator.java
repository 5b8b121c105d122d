package com.sizekit.measure;

import java.util.Locale;
import java.util.Objects;

/**
 * Converts the reference object's measured pixel width into a pixels-per-millimeter scale.
 */
public class ScaleCalibrator {

    private final ReferenceObject reference;
    private final MeasurementSettings settings;

    public ScaleCalibrator() {
        this(ReferenceObject.CREDIT_CARD, MeasurementSettings.DEFAULT);
    }

    public ScaleCalibrator(ReferenceObject reference, MeasurementSettings settings) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public DetectionResult<Calibration> calibrate(CardDetection detection) {
        return calibrate(detection.widthPixels());
    }

    public DetectionResult<Calibration> calibrate(double widthPixels) {
        if (!Double.isFinite(widthPixels) || widthPixels <= 0) {
            return DetectionResult.failure(DetectionFailure.INVALID_SCALE,
                    "Reference width must be a positive number of pixels, got " + widthPixels);
        }
        double pixelsPerMm = widthPixels / reference.widthMm();
        if (pixelsPerMm < settings.minPixelsPerMm() || pixelsPerMm > settings.maxPixelsPerMm()) {
            return DetectionResult.failure(DetectionFailure.INVALID_SCALE, String.format(Locale.ROOT,
                    "%.2f px/mm outside plausible range [%.1f, %.1f]",
                    pixelsPerMm, settings.minPixelsPerMm(), settings.maxPixelsPerMm()));
        }
        return DetectionResult.success(new Calibration(pixelsPerMm, reference.widthMm(), widthPixels));
    }
}
