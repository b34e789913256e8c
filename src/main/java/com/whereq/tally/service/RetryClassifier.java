package com.whereq.tally.service;

import com.whereq.tally.exception.CredentialExpiredException;
import com.whereq.tally.exception.DecryptionException;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.exception.UnsupportedMethodException;
import com.whereq.tally.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a failed extraction may be attempted again
 */
@Component
public class RetryClassifier {

    /**
     * A failure is retryable when its message, or a cause's, contains one of the
     * patterns. Configuration and credential failures never are.
     */
    public boolean isRetryable(Throwable error, List<String> retryableErrors) {
        if (isPermanent(error) || retryableErrors == null || retryableErrors.isEmpty()) {
            return false;
        }
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            String message = t.getMessage();
            if (message != null && retryableErrors.stream().anyMatch(p -> p != null && !p.isEmpty() && message.contains(p))) {
                return true;
            }
        }
        return false;
    }

    public boolean isPermanent(Throwable error) {
        return error instanceof DecryptionException
            || error instanceof UnsupportedMethodException
            || error instanceof CredentialExpiredException
            || error instanceof ValidationException
            || error instanceof NotFoundException;
    }
}
