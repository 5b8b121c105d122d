package com.sizekit.measure;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a detected value or a {@link DetectionFailure} with a message. Never both, never neither.
 */
public final class DetectionResult<T> {

    private final T value;
    private final DetectionFailure failure;
    private final String message;

    private DetectionResult(T value, DetectionFailure failure, String message) {
        this.value = value;
        this.failure = failure;
        this.message = message;
    }

    public static <T> DetectionResult<T> success(T value) {
        return new DetectionResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> DetectionResult<T> failure(DetectionFailure failure, String message) {
        return new DetectionResult<>(null, Objects.requireNonNull(failure, "failure"),
                message == null ? "" : message);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * @throws IllegalStateException when this is a failure
     */
    public T value() {
        if (failure != null) {
            throw new IllegalStateException("No value: " + failure + " (" + message + ")");
        }
        return value;
    }

    /**
     * @throws IllegalStateException when this is a success
     */
    public DetectionFailure failure() {
        if (failure == null) {
            throw new IllegalStateException("Result is a success");
        }
        return failure;
    }

    public String message() {
        return failure == null ? "" : message;
    }

    public <R> DetectionResult<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return new DetectionResult<>(null, failure, message);
        }
        return success(mapper.apply(value));
    }

    public <R> DetectionResult<R> flatMap(Function<? super T, DetectionResult<R>> mapper) {
        if (failure != null) {
            return new DetectionResult<>(null, failure, message);
        }
        return Objects.requireNonNull(mapper.apply(value), "mapper result");
    }

    public T orElseThrow() throws MeasurementException {
        if (failure != null) {
            throw new MeasurementException(failure, message);
        }
        return value;
    }

    @Override
    public String toString() {
        return failure == null
                ? "DetectionResult[success=" + value + "]"
                : "DetectionResult[failure=" + failure + ", message=" + message + "]";
    }
}
