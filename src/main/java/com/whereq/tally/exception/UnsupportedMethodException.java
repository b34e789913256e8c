package com.whereq.tally.exception;

/**
 * Exception thrown when no extractor is registered for a job's extraction method
 */
public class UnsupportedMethodException extends TallyException {

    public static final String CODE = "UNSUPPORTED_METHOD";

    public UnsupportedMethodException(String message) {
        super(message);
    }

    public UnsupportedMethodException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
