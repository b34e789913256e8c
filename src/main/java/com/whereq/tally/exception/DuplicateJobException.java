package com.whereq.tally.exception;

/**
 * Exception thrown when a job id already has a live schedule
 */
public class DuplicateJobException extends TallyException {

    public static final String CODE = "DUPLICATE_JOB";

    public DuplicateJobException(String message) {
        super(message);
    }

    public DuplicateJobException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
