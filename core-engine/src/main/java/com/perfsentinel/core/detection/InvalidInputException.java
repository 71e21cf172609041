package com.perfsentinel.core.detection;

/**
 * Raised when a detector is called with input it cannot analyse: an empty
 * series, a series holding {@code NaN} or infinite values, or an out-of-range
 * parameter.
 *
 * <p>
 * Thrown before any work starts, so a caller never sees a partial result.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
