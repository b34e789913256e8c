package com.whereq.tally.exception;

/**
 * Base class for errors surfaced to callers of the scheduling and credential API.
 * Every subclass carries a stable {@link #getCode() code} that callers can switch on.
 */
public abstract class TallyException extends RuntimeException {

    protected TallyException(String message) {
        super(message);
    }

    protected TallyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable error code
     */
    public abstract String getCode();
}
