package fr.lapetina.dopc.domain.model;

import java.util.Objects;

/**
 * Result of a pipeline step: either a value or a typed error.
 * Expected rejections travel as values of this type instead of exceptions.
 */
public record Outcome<T>(T value, ErrorType errorType, String errorMessage) {

    public Outcome {
        if (errorType == null) {
            Objects.requireNonNull(value, "Value is required for a successful outcome");
        }
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null, null);
    }

    public static <T> Outcome<T> failure(ErrorType errorType, String errorMessage) {
        Objects.requireNonNull(errorType, "Error type is required");
        return new Outcome<>(null, errorType, errorMessage);
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isFailure() {
        return errorType != null;
    }

    /**
     * Re-types a failed outcome so it can be returned from a step producing another type.
     */
    public <U> Outcome<U> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful outcome");
        }
        return new Outcome<>(null, errorType, errorMessage);
    }
}
