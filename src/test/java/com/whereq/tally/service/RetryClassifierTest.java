package com.whereq.tally.service;

import com.whereq.tally.exception.CredentialExpiredException;
import com.whereq.tally.exception.DecryptionException;
import com.whereq.tally.exception.ExtractionException;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.exception.UnsupportedMethodException;
import com.whereq.tally.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryClassifierTest {

    private static final List<String> PATTERNS = List.of("NETWORK_ERROR", "TIMEOUT");

    private final RetryClassifier classifier = new RetryClassifier();

    @Test
    void matchingMessageShouldBeRetryable() {
        assertThat(classifier.isRetryable(new ExtractionException("NETWORK_ERROR: HTTP 503 from bank"), PATTERNS)).isTrue();
        assertThat(classifier.isRetryable(new ExtractionException("TIMEOUT: no response"), PATTERNS)).isTrue();
    }

    @Test
    void shouldMatchAnywhereInCauseChain() {
        RuntimeException wrapped = new RuntimeException("extraction failed",
            new ExtractionException("NETWORK_ERROR: connection reset"));

        assertThat(classifier.isRetryable(wrapped, PATTERNS)).isTrue();
    }

    @Test
    void nonMatchingMessageShouldNotBeRetryable() {
        assertThat(classifier.isRetryable(new ExtractionException("HTTP_ERROR: HTTP 404 from bank"), PATTERNS)).isFalse();
        assertThat(classifier.isRetryable(new IllegalStateException(), PATTERNS)).isFalse();
    }

    @Test
    void emptyPatternsShouldNeverRetry() {
        ExtractionException error = new ExtractionException("NETWORK_ERROR: reset");

        assertThat(classifier.isRetryable(error, List.of())).isFalse();
        assertThat(classifier.isRetryable(error, null)).isFalse();
    }

    @Test
    void permanentFailuresShouldNeverRetry() {
        List<String> everything = List.of("NETWORK_ERROR", "TIMEOUT", "e");

        assertThat(classifier.isRetryable(new DecryptionException("TIMEOUT in tag"), everything)).isFalse();
        assertThat(classifier.isRetryable(new UnsupportedMethodException("browser"), everything)).isFalse();
        assertThat(classifier.isRetryable(new CredentialExpiredException("expired"), everything)).isFalse();
        assertThat(classifier.isRetryable(new ValidationException("bad cron"), everything)).isFalse();
        assertThat(classifier.isRetryable(new NotFoundException("vault entry"), everything)).isFalse();
    }
}
