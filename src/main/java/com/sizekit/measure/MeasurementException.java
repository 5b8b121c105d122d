package com.sizekit.measure;

/**
 * Checked form of a failed {@link DetectionResult}.
 */
public class MeasurementException extends Exception {

    private final DetectionFailure failure;

    public MeasurementException(DetectionFailure failure, String message) {
        super(failure + ": " + message);
        this.failure = failure;
    }

    public DetectionFailure getFailure() {
        return failure;
    }
}
