package com.warden.security;

import java.util.function.Function;

/**
 * Outcome of a validation step: either a value or a {@link ServiceError}.
 * <p>
 * Every validation entry point returns one of these. Callers that prefer exceptions use
 * {@link #orElseThrow()}.
 *
 * @param value the validated value (null when failed, and for steps with no value)
 * @param error the failure (null when valid)
 */
public record ValidationResult<T>(T value, ServiceError error) {

    /** Creates a passing result. */
    public static <T> ValidationResult<T> ok(T value) {
        return new ValidationResult<>(value, null);
    }

    /** Creates a passing result with no value. */
    public static ValidationResult<Void> ok() {
        return new ValidationResult<>(null, null);
    }

    /** Creates a failing result. */
    public static <T> ValidationResult<T> fail(ServiceError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new ValidationResult<>(null, error);
    }

    public boolean valid() {
        return error == null;
    }

    /** Continues with another validation step if this one passed. */
    public <R> ValidationResult<R> flatMap(Function<? super T, ValidationResult<R>> next) {
        return valid() ? next.apply(value) : fail(error);
    }

    /**
     * Returns the value, or throws the failure.
     *
     * @throws ServiceResultException if the result is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw new ServiceResultException(error);
        }
        return value;
    }
}
