package com.sizekit.measure;

/**
 * Physical specification of a rectangular reference object.
 *
 * @param name            Display name
 * @param widthMm         Long side, mm
 * @param heightMm        Short side, mm
 * @param aspectRatio     Target width / height
 * @param aspectTolerance Maximum relative aspect-ratio error accepted during detection
 */
public record ReferenceObject(
        String name,
        double widthMm,
        double heightMm,
        double aspectRatio,
        double aspectTolerance
) {

    /** ISO/IEC 7810 ID-1 (credit card). */
    public static final ReferenceObject CREDIT_CARD =
            new ReferenceObject("Credit Card", 85.6, 53.98, 85.6 / 53.98, 0.15);

    public ReferenceObject {
        if (!(widthMm > 0) || !(heightMm > 0)) {
            throw new IllegalArgumentException("Reference dimensions must be > 0");
        }
        if (!(aspectRatio > 0)) {
            throw new IllegalArgumentException("aspectRatio must be > 0, got " + aspectRatio);
        }
        if (!(aspectTolerance >= 0)) {
            throw new IllegalArgumentException("aspectTolerance must be >= 0, got " + aspectTolerance);
        }
    }

    public ReferenceObject withAspectTolerance(double tolerance) {
        return new ReferenceObject(name, widthMm, heightMm, aspectRatio, tolerance);
    }
}
