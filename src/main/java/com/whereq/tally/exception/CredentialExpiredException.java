package com.whereq.tally.exception;

/**
 * Exception thrown when a credential is read after its expiry
 */
public class CredentialExpiredException extends TallyException {

    public static final String CODE = "CREDENTIAL_EXPIRED";

    public CredentialExpiredException(String message) {
        super(message);
    }

    public CredentialExpiredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
