package com.sensorsentinel.core;

/**
 * Raised when input data or operator-supplied configuration is rejected.
 *
 * <p>
 * Examples: a series whose timestamps go backwards, a non-finite reading,
 * a custom threshold that is not a positive number, or an unknown threshold
 * mode name.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
