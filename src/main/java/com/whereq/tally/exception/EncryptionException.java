package com.whereq.tally.exception;

/**
 * Exception thrown when encryption or key handling fails
 */
public class EncryptionException extends TallyException {

    public static final String CODE = "ENCRYPTION_ERROR";

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
