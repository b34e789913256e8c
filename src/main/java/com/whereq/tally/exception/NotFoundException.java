package com.whereq.tally.exception;

/**
 * Exception thrown for an unknown job, task, queue or credential id
 */
public class NotFoundException extends TallyException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
