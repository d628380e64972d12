/* (C)2026 */
package com.ammann.weighing.exception;

/**
 * Rejection of a caller-supplied value or of an operation the current state does not allow.
 *
 * <p>Thrown synchronously by the add-operations (tare readings, manual measurements) and by
 * configuration updates. Mapped to HTTP 400 by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_PARAMETER = "INVALID_PARAMETER";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String SESSION_NOT_ACTIVE = "SESSION_NOT_ACTIVE";

    private final String errorCode;

    public ValidationException(String message) {
        this(VALIDATION_ERROR, message, null);
    }

    public ValidationException(String message, Throwable cause) {
        this(VALIDATION_ERROR, message, cause);
    }

    private ValidationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** Machine-readable code returned in the error body. */
    public String errorCode() {
        return errorCode;
    }

    /**
     * Creates validation exception for an invalid numeric or textual parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                INVALID_PARAMETER,
                String.format("Invalid parameter '%s': got '%s', expected %s", paramName, value, expected),
                null);
    }

    /**
     * Creates validation exception for an operation on a session that has not been started.
     */
    public static ValidationException sessionNotActive(String sessionName) {
        return new ValidationException(
                SESSION_NOT_ACTIVE,
                String.format("Session %s not active, start the session first", sessionName),
                null);
    }

    /**
     * Creates validation exception for a configuration snapshot that fails its range checks.
     */
    public static ValidationException invalidConfiguration(IllegalArgumentException cause) {
        return new ValidationException(INVALID_CONFIGURATION, cause.getMessage(), cause);
    }
}
