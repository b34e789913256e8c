package com.whereq.tally.exception;

/**
 * Exception thrown when job or credential input is malformed. Raised before any side effect.
 */
public class ValidationException extends TallyException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
