package com.whereq.tally.service;

import com.whereq.tally.audit.AuditEntry;
import com.whereq.tally.audit.AuditLogger;
import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.dto.JobCancellationResponse;
import com.whereq.tally.dto.JobStatusResponse;
import com.whereq.tally.exception.QueueStalledException;
import com.whereq.tally.exception.UnrecoverableTaskException;
import com.whereq.tally.exception.ValidationException;
import com.whereq.tally.executor.ExtractionParams;
import com.whereq.tally.executor.ExtractionPipeline;
import com.whereq.tally.executor.Extractor;
import com.whereq.tally.executor.ExtractorRegistry;
import com.whereq.tally.model.CredentialData;
import com.whereq.tally.model.ExtractedData;
import com.whereq.tally.model.Job;
import com.whereq.tally.model.JobEvent;
import com.whereq.tally.model.JobEventType;
import com.whereq.tally.model.JobStatus;
import com.whereq.tally.model.RetryConfig;
import com.whereq.tally.queue.BackoffCalculator;
import com.whereq.tally.queue.BackoffSpec;
import com.whereq.tally.queue.QueueTask;
import com.whereq.tally.queue.RetryQueue;
import com.whereq.tally.queue.TaskListener;
import com.whereq.tally.queue.TaskOptions;
import com.whereq.tally.queue.TaskState;
import com.whereq.tally.queue.TaskStatus;
import com.whereq.tally.queue.WorkerConfig;
import com.whereq.tally.scheduler.JobScheduler;
import com.whereq.tally.vault.CredentialVault;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Ties scheduling, queueing, credentials and extraction together.
 *
 * A cron fire only enqueues an attempt; extraction runs on the queue's worker pool.
 * Retryable failures are re-delivered by the queue with the job's backoff; anything
 * else fails the run. Cancellation is cooperative: an extraction already in flight
 * finishes, and its result is discarded.
 */
@Slf4j
@Service
public class ExtractionOrchestrator {

    private static final String RESOURCE = "extraction-job";

    private final TallyProperties properties;
    private final JobScheduler scheduler;
    private final RetryQueue queue;
    private final CredentialVault vault;
    private final ExtractorRegistry extractorRegistry;
    private final ExtractionPipeline pipeline;
    private final JobStatusTracker statusTracker;
    private final JobEventBus eventBus;
    private final RetryClassifier retryClassifier;
    private final AuditLogger auditLogger;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final String queueName;

    private Counter completedCounter;
    private Counter failedCounter;
    private Counter retriedCounter;
    private Timer extractionTimer;

    private volatile boolean shutdown = false;

    @Autowired
    public ExtractionOrchestrator(TallyProperties properties,
                                  JobScheduler scheduler,
                                  RetryQueue queue,
                                  CredentialVault vault,
                                  ExtractorRegistry extractorRegistry,
                                  ExtractionPipeline pipeline,
                                  JobStatusTracker statusTracker,
                                  JobEventBus eventBus,
                                  RetryClassifier retryClassifier,
                                  AuditLogger auditLogger,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.properties = properties;
        this.scheduler = scheduler;
        this.queue = queue;
        this.vault = vault;
        this.extractorRegistry = extractorRegistry;
        this.pipeline = pipeline;
        this.statusTracker = statusTracker;
        this.eventBus = eventBus;
        this.retryClassifier = retryClassifier;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.queueName = properties.getQueue().getName();
    }

    @PostConstruct
    public void initialize() {
        // Register metrics
        completedCounter = Counter.builder("tally.jobs.completed")
            .description("Number of successful extraction runs")
            .register(meterRegistry);

        failedCounter = Counter.builder("tally.jobs.failed")
            .description("Number of extraction runs that failed permanently")
            .register(meterRegistry);

        retriedCounter = Counter.builder("tally.jobs.retried")
            .description("Number of extraction attempts scheduled for retry")
            .register(meterRegistry);

        extractionTimer = Timer.builder("tally.extraction.time")
            .description("Extraction attempt time")
            .register(meterRegistry);

        Gauge.builder("tally.queue.waiting", queue, q -> q.getQueueStats(queueName).getWaiting())
            .description("Attempts waiting for a worker")
            .register(meterRegistry);
        Gauge.builder("tally.queue.active", queue, q -> q.getQueueStats(queueName).getActive())
            .description("Attempts being extracted")
            .register(meterRegistry);
        Gauge.builder("tally.queue.delayed", queue, q -> q.getQueueStats(queueName).getDelayed())
            .description("Attempts waiting out a backoff")
            .register(meterRegistry);

        queue.createQueue(queueName);
        queue.addListener(new RetryTracking());
        queue.registerWorker(queueName, this::executeJob, WorkerConfig.from(properties.getQueue()));
        scheduler.setTrigger(this::enqueueExecution);

        log.info("Extraction orchestrator started on queue {} (extractors: {})",
            queueName, extractorRegistry.getMethods());
    }

    /**
     * Register a recurring extraction job
     *
     * @param job job definition; a missing retry config gets the configured defaults
     * @return Mono with the job id
     */
    public Mono<String> scheduleJob(Job job) {
        return Mono.fromCallable(() -> {
                Job normalized = normalize(job);
                statusTracker.register(normalized);
                try {
                    scheduler.scheduleJob(normalized);
                } catch (RuntimeException e) {
                    statusTracker.remove(normalized.getId());
                    throw e;
                }
                return normalized;
            })
            .doOnSuccess(scheduled -> {
                Map<String, Object> data = new HashMap<>();
                data.put("name", scheduled.getName());
                data.put("schedule", scheduled.getSchedule().getExpression());
                scheduler.getNextExecution(scheduled.getId()).ifPresent(next -> data.put("nextRun", next.toString()));
                publish(JobEventType.JOB_SCHEDULED, scheduled.getId(), builder -> builder.data(data));

                auditLogger.record(AuditEntry.builder()
                    .action("job.schedule")
                    .resource(RESOURCE)
                    .resourceId(scheduled.getId())
                    .details(Map.of("name", scheduled.getName(), "schedule", scheduled.getSchedule().getExpression()))
                    .build());
                log.info("Job {} ({}) scheduled with method '{}'",
                    scheduled.getId(), scheduled.getName(), scheduled.getExtractionMethod());
            })
            .map(Job::getId)
            .doOnError(e -> {
                log.error("Failed to schedule job {}: {}", job != null ? job.getId() : null, e.getMessage());
                auditLogger.record(AuditEntry.failure("job.schedule.failed", RESOURCE, job != null ? job.getId() : null, e));
            });
    }

    /**
     * Queue one extraction attempt. Called by the scheduler on every fire.
     *
     * @return the queue task id, or null when the job is cancelled, paused, shut down
     *         or still has an attempt in flight
     */
    public String enqueueExecution(Job job) {
        if (shutdown) {
            log.debug("Orchestrator shut down, dropping fire of job {}", job.getId());
            return null;
        }
        JobStatusTracker.JobRecord record = statusTracker.find(job.getId()).orElse(null);
        if (record == null || record.getJob().getStatus() == JobStatus.CANCELLED) {
            log.debug("Job {} is gone or cancelled, not enqueueing", job.getId());
            return null;
        }
        if (record.getJob().getStatus() == JobStatus.PAUSED) {
            log.debug("Job {} is paused, not enqueueing", job.getId());
            return null;
        }
        if (record.getCurrentTaskId() != null && queue.getTaskStatus(record.getCurrentTaskId())
            .map(status -> !status.getState().isTerminal())
            .orElse(false)) {
            log.warn("Job {} still has attempt {} in flight, skipping this run", job.getId(), record.getCurrentTaskId());
            return null;
        }

        RetryConfig retryConfig = record.getJob().getRetryConfig();
        String taskId = queue.addTask(queueName, record.getJob().getName(), job.getId(), TaskOptions.builder()
            .attempts(retryConfig.getMaxAttempts())
            .backoff(BackoffSpec.from(retryConfig))
            .jobId(job.getId())
            .build());
        statusTracker.setCurrentTask(job.getId(), taskId);
        log.info("Enqueued run of job {} as task {}", job.getId(), taskId);
        return taskId;
    }

    /**
     * Queue worker: run one extraction attempt
     *
     * @param task delivered queue task
     * @return metadata of the extraction, or null when the job was cancelled
     * @throws Exception the failure, when another attempt should follow
     * @throws UnrecoverableTaskException when the run failed for good
     */
    public Object executeJob(QueueTask task) throws Exception {
        String jobId = task.getJobId();
        int attempt = task.getAttempt();

        JobStatusTracker.JobRecord record = statusTracker.find(jobId).orElse(null);
        if (record == null || !statusTracker.markRunning(jobId, attempt)) {
            log.info("Job {} is cancelled or paused, dropping attempt {} (task {})", jobId, attempt, task.getTaskId());
            return null;
        }
        Job job = record.getJob();

        publish(JobEventType.JOB_STARTED, jobId, builder -> builder.attempt(attempt));
        publish(JobEventType.EXTRACTION_STARTED, jobId, builder -> builder.attempt(attempt)
            .data(Map.of("method", job.getExtractionMethod())));

        Timer.Sample sample = Timer.start(meterRegistry);
        ExtractedData data;
        try {
            CredentialData credentials = retrieveCredentials(job);
            Extractor extractor = extractorRegistry.get(job.getExtractionMethod());
            data = extractor.extract(ExtractionParams.builder()
                .job(job)
                .credentials(credentials)
                .attempt(attempt)
                .progressListener(percentage -> reportProgress(jobId, percentage))
                .heartbeatListener(() -> queue.extendLease(task.getTaskId()))
                .build());
        } catch (Exception e) {
            sample.stop(extractionTimer);
            throw handleFailure(task, job, e);
        }
        sample.stop(extractionTimer);

        if (data == null) {
            throw handleFailure(task, job, new IllegalStateException(
                "Extractor '" + job.getExtractionMethod() + "' returned no data"));
        }
        if (abandoned(task)) {
            log.warn("Attempt {} of job {} finished after the queue failed it as stalled, discarding result",
                attempt, jobId);
            return null;
        }
        if (!statusTracker.markCompleted(jobId, data.getMetadata())) {
            log.info("Job {} was cancelled during extraction, discarding result", jobId);
            return null;
        }
        completedCounter.increment();

        Map<String, Object> summary = new HashMap<>();
        if (data.getMetadata() != null) {
            summary.put("recordCount", data.getMetadata().getRecordCount());
            summary.put("checksum", data.getMetadata().getChecksumHash());
            summary.put("durationMs", data.getMetadata().getExtractionDurationMs());
        }
        summary.put("dataSize", data.getDataSize());
        publish(JobEventType.EXTRACTION_COMPLETED, jobId, builder -> builder.attempt(attempt).data(summary));

        Map<String, Object> completion = new HashMap<>();
        scheduler.getNextExecution(jobId).ifPresent(next -> completion.put("nextRun", next.toString()));
        publish(JobEventType.JOB_COMPLETED, jobId, builder -> builder.attempt(attempt).data(completion));

        auditLogger.record(AuditEntry.builder()
            .action("data.extraction.success")
            .resource(RESOURCE)
            .resourceId(jobId)
            .details(summary)
            .build());

        pipeline.process(data)
            .doOnError(e -> log.error("Pipeline failed for job {}: {}", jobId, e.getMessage(), e))
            .onErrorResume(e -> Mono.empty()) // The run already succeeded
            .subscribe();

        log.info("Job {} completed on attempt {}", jobId, attempt);
        return data.getMetadata();
    }

    /**
     * Classify a failed attempt and record it
     *
     * @return the exception for the queue: the original one to retry, or an
     *         {@link UnrecoverableTaskException} to stop
     */
    private Exception handleFailure(QueueTask task, Job job, Exception error) {
        String jobId = job.getId();
        int attempt = task.getAttempt();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        if (statusTracker.isCancelled(jobId)) {
            log.info("Job {} was cancelled during extraction, ignoring failure: {}", jobId, message);
            return new UnrecoverableTaskException("Job " + jobId + " cancelled", error);
        }
        if (abandoned(task)) {
            log.warn("Attempt {} of job {} failed after the queue failed it as stalled, ignoring: {}",
                attempt, jobId, message);
            return new UnrecoverableTaskException(message, error);
        }

        log.error("Job {} attempt {}/{} failed: {}", jobId, attempt, task.getMaxAttempts(), message);
        publish(JobEventType.EXTRACTION_FAILED, jobId, builder -> builder.attempt(attempt).error(message));

        RetryConfig retryConfig = job.getRetryConfig();
        boolean retryable = !(error instanceof CredentialAccessException)
            && retryClassifier.isRetryable(error, retryConfig.getRetryableErrors());
        boolean willRetry = retryable && attempt < task.getMaxAttempts();

        if (willRetry && statusTracker.markRetryPending(jobId, message)) {
            long delayMs = BackoffCalculator.calculate(retryConfig, attempt);
            publish(JobEventType.JOB_FAILED, jobId, builder -> builder.attempt(attempt).error(message)
                .data(Map.of("willRetry", true, "retryDelayMs", delayMs)));
            return error;
        }

        statusTracker.markFailed(jobId, message);
        failedCounter.increment();
        publish(JobEventType.JOB_FAILED, jobId, builder -> builder.attempt(attempt).error(message)
            .data(Map.of("willRetry", false, "retryable", retryable)));
        auditLogger.record(AuditEntry.failure("data.extraction.failed", RESOURCE, jobId, error));

        Throwable cause = error instanceof CredentialAccessException ? error.getCause() : error;
        return new UnrecoverableTaskException(message, cause);
    }

    /**
     * The queue already failed this task, so its outcome no longer counts
     */
    private boolean abandoned(QueueTask task) {
        return queue.getTaskStatus(task.getTaskId())
            .map(status -> status.getState() == TaskState.FAILED)
            .orElse(false);
    }

    private CredentialData retrieveCredentials(Job job) {
        String vaultId = job.getCredentialRef().getVaultId();
        try {
            return vault.retrieve(vaultId).block();
        } catch (RuntimeException e) {
            throw new CredentialAccessException(e);
        }
    }

    /**
     * Current status of a job
     */
    public Mono<JobStatusResponse> getJobStatus(String jobId) {
        return statusTracker.getStatus(jobId)
            .then(Mono.justOrEmpty(statusTracker.find(jobId)))
            .map(record -> JobStatusResponse.builder()
                .jobId(jobId)
                .name(record.getJob().getName())
                .status(record.getJob().getStatus())
                .attempt(record.getAttempt())
                .retryCount(record.getRetryCount())
                .progress(record.getProgress())
                .scheduledAt(record.getScheduledAt())
                .lastRunAt(record.getJob().getLastRunAt())
                .completedAt(record.getCompletedAt())
                .nextRunAt(scheduler.getNextExecution(jobId).orElse(null))
                .errorMessage(record.getErrorMessage())
                .lastResult(record.getLastResult())
                .build());
    }

    /**
     * Known jobs, optionally filtered by status
     */
    public Flux<Job> listJobs(JobStatus status) {
        return statusTracker.findAll(status);
    }

    public Flux<Job> listJobs() {
        return listJobs(null);
    }

    /**
     * Suspend a job's trigger. Queued attempts delivered while paused are dropped;
     * an extraction already running finishes.
     */
    public Mono<Void> pauseJob(String jobId) {
        return statusTracker.getStatus(jobId)
            .flatMap(current -> {
                if (current.isTerminal()) {
                    return Mono.error(new IllegalStateException("Cannot pause job in terminal status: " + current));
                }
                scheduler.pauseJob(jobId);
                statusTracker.updateStatus(jobId, JobStatus.PAUSED);
                return Mono.<Void>empty();
            })
            .doOnSuccess(v -> {
                publish(JobEventType.JOB_PAUSED, jobId, builder -> builder);
                auditLogger.record(AuditEntry.success("job.paused", RESOURCE, jobId));
            })
            .doOnError(e -> log.error("Failed to pause job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Re-arm a paused job from now. Missed runs are not replayed.
     */
    public Mono<Void> resumeJob(String jobId) {
        return statusTracker.getStatus(jobId)
            .flatMap(current -> {
                if (current.isTerminal()) {
                    return Mono.error(new IllegalStateException("Cannot resume job in terminal status: " + current));
                }
                scheduler.resumeJob(jobId);
                if (current == JobStatus.PAUSED) {
                    statusTracker.updateStatus(jobId, JobStatus.SCHEDULED);
                }
                return Mono.<Void>empty();
            })
            .doOnSuccess(v -> {
                Map<String, Object> data = new HashMap<>();
                scheduler.getNextExecution(jobId).ifPresent(next -> data.put("nextRun", next.toString()));
                publish(JobEventType.JOB_RESUMED, jobId, builder -> builder.data(data));
                auditLogger.record(AuditEntry.success("job.resumed", RESOURCE, jobId));
            })
            .doOnError(e -> log.error("Failed to resume job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Cancel a job: no further runs, pending attempts dropped
     *
     * @return Mono with the cancellation summary
     */
    public Mono<JobCancellationResponse> cancelJob(String jobId) {
        return Mono.fromCallable(() -> {
                JobStatus previous = statusTracker.cancel(jobId);
                scheduler.removeJob(jobId);
                int removed = queue.cancelTasksForJob(jobId);
                boolean inFlight = previous == JobStatus.RUNNING;
                return JobCancellationResponse.builder()
                    .jobId(jobId)
                    .previousStatus(previous)
                    .status(JobStatus.CANCELLED)
                    .cancelledAt(clock.instant())
                    .removedTasks(removed)
                    .inFlightDiscarded(inFlight)
                    .message(inFlight
                        ? "Job cancelled, the running extraction will be discarded"
                        : "Job cancelled successfully")
                    .build();
            })
            .doOnSuccess(response -> {
                publish(JobEventType.JOB_CANCELLED, jobId, builder -> builder);
                auditLogger.record(AuditEntry.success("job.cancelled", RESOURCE, jobId));
                log.info("Job {} cancelled ({} pending attempt(s) removed)", jobId, response.getRemovedTasks());
            })
            .doOnError(e -> log.error("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Emit an extraction progress event
     */
    public void reportProgress(String jobId, int percentage) {
        int clamped = Math.max(0, Math.min(100, percentage));
        statusTracker.updateProgress(jobId, clamped);
        publish(JobEventType.EXTRACTION_PROGRESS, jobId, builder -> builder.percentage(clamped));
    }

    /**
     * Stop triggers, then the queue, then detach subscribers
     */
    @PreDestroy
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("Shutting down extraction orchestrator");
        scheduler.shutdown();
        queue.shutdown();
        eventBus.clear();
    }

    private Job normalize(Job job) {
        if (job == null) {
            throw new ValidationException("Job is required");
        }
        requireText(job.getId(), "Job id");
        requireText(job.getName(), "Job name");
        if (job.getSchedule() == null) {
            throw new ValidationException("Schedule is required for job " + job.getId());
        }
        requireText(job.getSchedule().getExpression(), "Schedule expression");
        if (job.getCredentialRef() == null) {
            throw new ValidationException("Credential reference is required for job " + job.getId());
        }
        requireText(job.getCredentialRef().getVaultId(), "Credential vault id");
        requireText(job.getExtractionMethod(), "Extraction method");
        extractorRegistry.get(job.getExtractionMethod());

        RetryConfig retryConfig = job.getRetryConfig() != null ? job.getRetryConfig().copy() : defaultRetryConfig();
        if (retryConfig.getMaxAttempts() < 1) {
            throw new ValidationException("maxAttempts must be at least 1");
        }
        if (retryConfig.getInitialDelay() < 0 || retryConfig.getMaxDelay() < 0) {
            throw new ValidationException("Retry delays must not be negative");
        }

        Instant now = clock.instant();
        return job.copy().toBuilder()
            .retryConfig(retryConfig)
            .status(job.getSchedule().isEnabled() ? JobStatus.SCHEDULED : JobStatus.PAUSED)
            .createdAt(job.getCreatedAt() != null ? job.getCreatedAt() : now)
            .updatedAt(now)
            .build();
    }

    private RetryConfig defaultRetryConfig() {
        TallyProperties.RetryDefaults defaults = properties.getRetry();
        return RetryConfig.builder()
            .maxAttempts(defaults.getMaxAttempts())
            .backoffStrategy(defaults.getBackoffStrategy())
            .initialDelay(defaults.getInitialDelayMs())
            .maxDelay(defaults.getMaxDelayMs())
            .retryableErrors(new ArrayList<>(defaults.getRetryableErrors()))
            .build();
    }

    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private void publish(JobEventType type, String jobId,
                         UnaryOperator<JobEvent.JobEventBuilder> customizer) {
        JobEvent event = customizer.apply(JobEvent.builder()
                .type(type)
                .jobId(jobId)
                .timestamp(clock.instant()))
            .build();
        eventBus.publish(event);
    }

    /**
     * Credentials could not be read; never retried
     */
    private static class CredentialAccessException extends RuntimeException {
        CredentialAccessException(RuntimeException cause) {
            super(cause.getMessage(), cause);
        }
    }

    /**
     * Follows a job's current attempt across queue retries
     */
    private class RetryTracking implements TaskListener {

        @Override
        public void onRetried(TaskStatus failed, String retryTaskId, long delayMs) {
            retriedCounter.increment();
            if (failed.getJobId() != null) {
                statusTracker.setCurrentTask(failed.getJobId(), retryTaskId);
            }
        }

        @Override
        public void onFailed(TaskStatus task, Throwable error, boolean willRetry) {
            // Handler failures are reported by executeJob; only a stall exhausts a task behind its back
            if (willRetry || !(error instanceof QueueStalledException) || task.getJobId() == null) {
                return;
            }
            String jobId = task.getJobId();
            boolean current = statusTracker.find(jobId)
                .map(record -> task.getTaskId().equals(record.getCurrentTaskId()))
                .orElse(false);
            if (!current || !statusTracker.markFailed(jobId, error.getMessage())) {
                return;
            }
            failedCounter.increment();
            log.error("Job {} failed: attempt {} stalled too often", jobId, task.getAttempt());
            publish(JobEventType.JOB_FAILED, jobId, builder -> builder.attempt(task.getAttempt()).error(error.getMessage())
                .data(Map.of("willRetry", false, "stalled", true)));
            auditLogger.record(AuditEntry.failure("data.extraction.failed", RESOURCE, jobId, error));
        }

        @Override
        public void onStalled(TaskStatus task) {
            log.warn("Attempt {} of job {} stalled and will be re-delivered", task.getAttempt(), task.getJobId());
        }
    }
}
