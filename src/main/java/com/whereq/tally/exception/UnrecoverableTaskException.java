package com.whereq.tally.exception;

/**
 * Thrown by a queue handler to fail a task without further attempts,
 * regardless of how many attempts remain
 */
public class UnrecoverableTaskException extends RuntimeException {

    public UnrecoverableTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
