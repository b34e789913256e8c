package com.whereq.tally.service;

import com.whereq.tally.exception.DuplicateJobException;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.model.ExtractionMetadata;
import com.whereq.tally.model.Job;
import com.whereq.tally.model.JobStatus;
import com.whereq.tally.support.MutableClock;
import com.whereq.tally.support.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTrackerTest {

    private JobStatusTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new JobStatusTracker(new MutableClock(Instant.parse("2024-03-01T00:00:00Z")));
    }

    private void register(String id, JobStatus status) {
        Job job = TestJobs.job(id, "api");
        job.setStatus(status);
        tracker.register(job);
    }

    @Test
    void shouldWalkThroughRunLifecycle() {
        register("daily", JobStatus.SCHEDULED);

        assertThat(tracker.markRunning("daily", 1)).isTrue();
        assertThat(tracker.markRetryPending("daily", "NETWORK_ERROR")).isTrue();
        assertThat(tracker.markRunning("daily", 2)).isTrue();
        assertThat(tracker.markCompleted("daily", ExtractionMetadata.builder().recordCount(3).build())).isTrue();

        JobStatusTracker.JobRecord record = tracker.find("daily").orElseThrow();
        assertThat(record.getJob().getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(record.getAttempt()).isEqualTo(2);
        assertThat(record.getRetryCount()).isEqualTo(1);
        assertThat(record.getProgress()).isEqualTo(100);
        assertThat(record.getErrorMessage()).isNull();
        assertThat(record.getLastResult().getRecordCount()).isEqualTo(3);
    }

    @Test
    void pausedJobShouldRefuseToStartAnAttempt() {
        register("daily", JobStatus.PAUSED);

        assertThat(tracker.markRunning("daily", 2)).isFalse();

        JobStatusTracker.JobRecord record = tracker.find("daily").orElseThrow();
        assertThat(record.getJob().getStatus()).isEqualTo(JobStatus.PAUSED);
        assertThat(record.getAttempt()).isZero();
        assertThat(record.getJob().getLastRunAt()).isNull();
    }

    @Test
    void pauseDuringRunShouldSurviveItsCompletion() {
        register("daily", JobStatus.SCHEDULED);
        tracker.markRunning("daily", 1);
        tracker.updateStatus("daily", JobStatus.PAUSED);

        assertThat(tracker.markCompleted("daily", null)).isTrue();

        StepVerifier.create(tracker.getStatus("daily"))
            .expectNext(JobStatus.PAUSED)
            .verifyComplete();
    }

    @Test
    void cancelledJobShouldIgnoreRunTransitions() {
        register("daily", JobStatus.SCHEDULED);
        tracker.markRunning("daily", 1);

        assertThat(tracker.cancel("daily")).isEqualTo(JobStatus.RUNNING);
        assertThat(tracker.markCompleted("daily", null)).isFalse();
        assertThat(tracker.markFailed("daily", "boom")).isFalse();
        assertThat(tracker.isCancelled("daily")).isTrue();
        assertThatThrownBy(() -> tracker.cancel("daily")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void liveDuplicateShouldBeRejectedButCancelledReplaced() {
        register("daily", JobStatus.SCHEDULED);
        assertThatThrownBy(() -> register("daily", JobStatus.SCHEDULED)).isInstanceOf(DuplicateJobException.class);

        tracker.cancel("daily");
        register("daily", JobStatus.SCHEDULED);

        assertThat(tracker.find("daily").orElseThrow().getJob().getStatus()).isEqualTo(JobStatus.SCHEDULED);
    }

    @Test
    void returnedRecordShouldBeACopy() {
        register("daily", JobStatus.SCHEDULED);

        tracker.find("daily").orElseThrow().getJob().setStatus(JobStatus.FAILED);

        assertThat(tracker.find("daily").orElseThrow().getJob().getStatus()).isEqualTo(JobStatus.SCHEDULED);
    }

    @Test
    void registeredJobShouldNotShareStateWithCaller() {
        Job job = TestJobs.job("daily", "api");
        job.setStatus(JobStatus.SCHEDULED);
        tracker.register(job);

        job.getRetryConfig().setMaxAttempts(1);
        job.getRetryConfig().setRetryableErrors(new ArrayList<>(List.of("ANYTHING")));
        job.getSchedule().setExpression("* * * * *");
        job.getCredentialRef().setVaultId("elsewhere");
        job.getSource().getHeaders().put("X-Injected", "1");

        Job stored = tracker.find("daily").orElseThrow().getJob();
        assertThat(stored.getRetryConfig().getMaxAttempts()).isEqualTo(3);
        assertThat(stored.getRetryConfig().getRetryableErrors()).containsExactly("NETWORK_ERROR", "TIMEOUT");
        assertThat(stored.getSchedule().getExpression()).isEqualTo("0 2 * * *");
        assertThat(stored.getCredentialRef().getVaultId()).isEqualTo("vault-daily");
        assertThat(stored.getSource().getHeaders()).isEmpty();
    }

    @Test
    void unknownJobShouldBeReported() {
        StepVerifier.create(tracker.getStatus("ghost"))
            .expectError(NotFoundException.class)
            .verify();
        assertThatThrownBy(() -> tracker.cancel("ghost")).isInstanceOf(NotFoundException.class);
        assertThat(tracker.markRunning("ghost", 1)).isFalse();
    }
}
