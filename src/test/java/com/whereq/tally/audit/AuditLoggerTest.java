package com.whereq.tally.audit;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class AuditLoggerTest {

    @Test
    void shouldHandEntryToSink() {
        List<AuditEntry> received = new ArrayList<>();
        AuditLogger logger = new AuditLogger(entry -> Mono.fromRunnable(() -> received.add(entry)));

        logger.record(AuditEntry.success("credential.stored", "credential", "acme"));

        assertThat(received).singleElement()
            .satisfies(e -> {
                assertThat(e.getAction()).isEqualTo("credential.stored");
                assertThat(e.getResult()).isEqualTo(AuditResult.SUCCESS);
                assertThat(e.getUserId()).isEqualTo("system");
            });
    }

    @Test
    void failingSinkShouldNotReachCaller() {
        AuditLogger erroring = new AuditLogger(entry -> Mono.error(new IllegalStateException("disk full")));
        AuditLogger throwing = new AuditLogger(entry -> {
            throw new IllegalStateException("sink closed");
        });

        assertThatCode(() -> erroring.record(AuditEntry.success("job.paused", "job", "j1")))
            .doesNotThrowAnyException();
        assertThatCode(() -> throwing.record(AuditEntry.success("job.paused", "job", "j1")))
            .doesNotThrowAnyException();
    }

    @Test
    void failureEntryShouldCarryErrorMessage() {
        AuditEntry entry = AuditEntry.failure("job.schedule.failed", "job", "j1", new IllegalArgumentException("bad cron"));

        assertThat(entry.getResult()).isEqualTo(AuditResult.FAILURE);
        assertThat(entry.getErrorMessage()).isEqualTo("bad cron");
    }
}
