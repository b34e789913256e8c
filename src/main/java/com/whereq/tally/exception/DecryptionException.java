package com.whereq.tally.exception;

/**
 * Exception thrown when a blob cannot be decrypted: bad tag, wrong key, wrong AAD or a corrupt envelope. Never retried.
 */
public class DecryptionException extends TallyException {

    public static final String CODE = "DECRYPTION_ERROR";

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
