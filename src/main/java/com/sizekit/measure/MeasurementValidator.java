package com.sizekit.measure;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Advisory plausibility checks on a finished hand measurement. Issues are reported to the
 * user as hints; they never turn a measurement into a failure.
 */
public class MeasurementValidator {

    /** How far outside a digit's typical size range a size may fall before it is flagged. */
    private static final int TYPICAL_RANGE_SLACK = 2;

    private final MeasurementSettings settings;

    public MeasurementValidator() {
        this(MeasurementSettings.DEFAULT);
    }

    public MeasurementValidator(MeasurementSettings settings) {
        this.settings = settings;
    }

    /**
     * @return human-readable issues, empty when everything looks plausible
     */
    public List<String> validate(HandMeasurement hand) {
        List<String> issues = new ArrayList<>();
        if (hand.nails().size() != Digit.values().length) {
            issues.add("Expected " + Digit.values().length + " nail measurements, got " + hand.nails().size());
            return issues;
        }

        for (NailMeasurement m : hand.nails()) {
            String name = m.digit().displayName();
            if (m.curvedMm() < settings.minPlausibleMm() || m.curvedMm() > settings.maxPlausibleMm()) {
                issues.add(String.format(Locale.ROOT, "%s: %.1fmm is outside valid range (%.0f-%.0fmm)",
                        name, m.curvedMm(), settings.minPlausibleMm(), settings.maxPlausibleMm()));
            }
            int min = m.digit().typicalMinSize();
            int max = m.digit().typicalMaxSize();
            if (m.size() < min - TYPICAL_RANGE_SLACK || m.size() > max + TYPICAL_RANGE_SLACK) {
                issues.add(String.format(Locale.ROOT, "%s: Size %d seems unusual for this finger (typical: %d-%d)",
                        name, m.size(), min, max));
            }
        }
        return issues;
    }

    public boolean isValid(HandMeasurement hand) {
        return validate(hand).isEmpty();
    }
}
