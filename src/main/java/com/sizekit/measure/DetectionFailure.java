package com.sizekit.measure;

/**
 * Reasons a detection or measurement produced no value.
 */
public enum DetectionFailure {
    /** No polygon passed the reference-object filters. */
    REFERENCE_NOT_FOUND,
    /** The derived pixels-per-millimeter scale is outside the plausible range. */
    INVALID_SCALE,
    /** No edge contour long enough to be a card outline was found. */
    INSUFFICIENT_CONTOUR_DATA,
    /** The nail scan found no usable edge pair, or only an implausibly narrow one. */
    BOUNDARY_DETECTION_FAILED
}
