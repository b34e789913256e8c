package com.whereq.tally.exception;

/**
 * Internal signal raised when a leased task exceeded its stall allowance
 */
public class QueueStalledException extends TallyException {

    public static final String CODE = "QUEUE_STALLED";

    public QueueStalledException(String message) {
        super(message);
    }

    public QueueStalledException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
