package com.whereq.tally.executor;

import com.whereq.tally.model.CredentialData;
import com.whereq.tally.model.Job;
import lombok.Builder;
import lombok.Getter;

import java.util.function.IntConsumer;

/**
 * Inputs of one extraction attempt
 */
@Getter
@Builder
public class ExtractionParams {

    private final Job job;

    /**
     * Decrypted credentials, for this attempt only
     */
    private final CredentialData credentials;

    private final int attempt;

    private final IntConsumer progressListener;

    private final Runnable heartbeatListener;

    /**
     * Report progress in percent (0-100)
     */
    public void progress(int percentage) {
        if (progressListener != null) {
            progressListener.accept(Math.max(0, Math.min(100, percentage)));
        }
    }

    /**
     * Signal that a long extraction is still alive so its lease is renewed
     */
    public void heartbeat() {
        if (heartbeatListener != null) {
            heartbeatListener.run();
        }
    }
}
