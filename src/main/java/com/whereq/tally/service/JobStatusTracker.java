package com.whereq.tally.service;

import com.whereq.tally.exception.DuplicateJobException;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.model.ExtractionMetadata;
import com.whereq.tally.model.Job;
import com.whereq.tally.model.JobStatus;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Track job status and run metadata in memory
 */
@Slf4j
@Service
public class JobStatusTracker {

    private final Map<String, JobRecord> records = new ConcurrentHashMap<>();

    private final Clock clock;

    @Autowired
    public JobStatusTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register a job. A cancelled job with the same id is replaced.
     *
     * @throws DuplicateJobException if a live job with the id exists
     */
    public void register(Job job) {
        JobRecord record = new JobRecord();
        record.setJob(job.copy());
        record.setScheduledAt(clock.instant());

        records.compute(job.getId(), (id, existing) -> {
            if (existing != null && !existing.getJob().getStatus().isTerminal()) {
                throw new DuplicateJobException("Job " + id + " already exists");
            }
            return record;
        });
        log.info("Job {} registered with status {}", job.getId(), job.getStatus());
    }

    public void remove(String jobId) {
        records.remove(jobId);
    }

    /**
     * Update job status
     *
     * @param jobId job identifier
     * @param status new status
     * @return previous status
     */
    public JobStatus updateStatus(String jobId, JobStatus status) {
        JobStatus[] previous = new JobStatus[1];
        update(jobId, record -> {
            previous[0] = record.getJob().getStatus();
            record.getJob().setStatus(status);
        });
        log.info("Job {} status updated: {} → {}", jobId, previous[0], status);
        return previous[0];
    }

    /**
     * Start an attempt
     *
     * @return false if the job is cancelled, paused or unknown
     */
    public boolean markRunning(String jobId, int attempt) {
        Instant now = clock.instant();
        boolean applied = updateIf(jobId, status -> status != JobStatus.PAUSED, record -> {
            transition(record, JobStatus.RUNNING);
            record.getJob().setLastRunAt(now);
            record.setAttempt(attempt);
            record.setProgress(0);
            record.setErrorMessage(null);
        });
        if (applied) {
            log.info("Job {} status updated: RUNNING (attempt {})", jobId, attempt);
        }
        return applied;
    }

    public boolean markCompleted(String jobId, ExtractionMetadata result) {
        boolean applied = updateUnlessCancelled(jobId, record -> {
            transition(record, JobStatus.COMPLETED);
            record.setCompletedAt(clock.instant());
            record.setProgress(100);
            record.setLastResult(result);
        });
        if (applied) {
            log.info("Job {} status updated: COMPLETED", jobId);
        }
        return applied;
    }

    /**
     * Attempt failed and another is queued
     */
    public boolean markRetryPending(String jobId, String errorMessage) {
        boolean applied = updateUnlessCancelled(jobId, record -> {
            transition(record, JobStatus.SCHEDULED);
            record.setRetryCount(record.getRetryCount() + 1);
            record.setErrorMessage(errorMessage);
            record.setProgress(null);
        });
        if (applied) {
            log.info("Job {} status updated: SCHEDULED (retry pending)", jobId);
        }
        return applied;
    }

    public boolean markFailed(String jobId, String errorMessage) {
        boolean applied = updateUnlessCancelled(jobId, record -> {
            transition(record, JobStatus.FAILED);
            record.setCompletedAt(clock.instant());
            record.setErrorMessage(errorMessage);
            record.setProgress(null);
        });
        if (applied) {
            log.info("Job {} status updated: FAILED", jobId);
        }
        return applied;
    }

    /**
     * Mark a job cancelled
     *
     * @return previous status
     * @throws NotFoundException if the job is unknown
     * @throws IllegalStateException if the job is already cancelled
     */
    public JobStatus cancel(String jobId) {
        JobStatus[] previous = new JobStatus[1];
        update(jobId, record -> {
            JobStatus current = record.getJob().getStatus();
            if (current.isTerminal()) {
                throw new IllegalStateException("Cannot cancel job in terminal status: " + current);
            }
            previous[0] = current;
            record.getJob().setStatus(JobStatus.CANCELLED);
            record.setCompletedAt(clock.instant());
            record.setProgress(null);
        });
        log.info("Job {} status updated: {} → CANCELLED", jobId, previous[0]);
        return previous[0];
    }

    public void updateProgress(String jobId, int percentage) {
        updateUnlessCancelled(jobId, record -> record.setProgress(percentage));
    }

    public void setCurrentTask(String jobId, String taskId) {
        updateUnlessCancelled(jobId, record -> record.setCurrentTaskId(taskId));
    }

    /**
     * Current record, copied
     */
    public Optional<JobRecord> find(String jobId) {
        JobRecord record = records.get(jobId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            return Optional.of(record.copy());
        }
    }

    /**
     * Get current job status
     *
     * @param jobId job identifier
     * @return Mono with current status
     */
    public Mono<JobStatus> getStatus(String jobId) {
        return Mono.justOrEmpty(find(jobId))
            .map(record -> record.getJob().getStatus())
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Job not found: " + jobId)));
    }

    public boolean isCancelled(String jobId) {
        return find(jobId).map(r -> r.getJob().getStatus() == JobStatus.CANCELLED).orElse(true);
    }

    /**
     * Jobs, optionally filtered by status
     */
    public Flux<Job> findAll(JobStatus status) {
        return Flux.defer(() -> {
            List<Job> jobs = new ArrayList<>();
            for (String id : records.keySet()) {
                find(id).map(JobRecord::getJob)
                    .filter(job -> status == null || job.getStatus() == status)
                    .ifPresent(jobs::add);
            }
            return Flux.fromIterable(jobs);
        });
    }

    public void clear() {
        records.clear();
    }

    /**
     * Apply a run transition unless the job was cancelled meanwhile
     *
     * @return false if the job is cancelled or unknown
     */
    private boolean updateUnlessCancelled(String jobId, Consumer<JobRecord> change) {
        return updateIf(jobId, status -> true, change);
    }

    private boolean updateIf(String jobId, Predicate<JobStatus> allowed, Consumer<JobRecord> change) {
        JobRecord record = records.get(jobId);
        if (record == null) {
            return false;
        }
        synchronized (record) {
            JobStatus status = record.getJob().getStatus();
            if (status == JobStatus.CANCELLED || !allowed.test(status)) {
                return false;
            }
            change.accept(record);
            record.getJob().setUpdatedAt(clock.instant());
            return true;
        }
    }

    /**
     * Run transitions leave a paused job paused
     */
    private void transition(JobRecord record, JobStatus status) {
        if (record.getJob().getStatus() != JobStatus.PAUSED) {
            record.getJob().setStatus(status);
        }
    }

    private void update(String jobId, Consumer<JobRecord> change) {
        JobRecord record = records.get(jobId);
        if (record == null) {
            throw new NotFoundException("Job not found: " + jobId);
        }
        synchronized (record) {
            change.accept(record);
            record.getJob().setUpdatedAt(clock.instant());
        }
    }

    @Data
    public static class JobRecord {
        private Job job;
        private Instant scheduledAt;
        private Instant completedAt;
        private int attempt;
        private int retryCount;
        private Integer progress;
        private String errorMessage;
        private ExtractionMetadata lastResult;
        private String currentTaskId;

        JobRecord copy() {
            JobRecord copy = new JobRecord();
            copy.setJob(job.copy());
            copy.setScheduledAt(scheduledAt);
            copy.setCompletedAt(completedAt);
            copy.setAttempt(attempt);
            copy.setRetryCount(retryCount);
            copy.setProgress(progress);
            copy.setErrorMessage(errorMessage);
            copy.setLastResult(lastResult);
            copy.setCurrentTaskId(currentTaskId);
            return copy;
        }
    }
}
