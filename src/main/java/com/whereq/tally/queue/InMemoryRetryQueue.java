package com.whereq.tally.queue;

import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.exception.QueueStalledException;
import com.whereq.tally.exception.UnrecoverableTaskException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Process-local {@link RetryQueue}.
 *
 * A dispatcher promotes due DELAYED tasks and hands WAITING tasks to a fixed worker
 * pool, never more than the configured concurrency at once. An active task holds a
 * lease token; an expired lease sends the task back to WAITING and any late ack
 * carrying the old token is ignored, so delivery is at-least-once.
 */
@Slf4j
@Component
public class InMemoryRetryQueue implements RetryQueue {

    private final Map<String, QueueState> queues = new ConcurrentHashMap<>();
    private final Map<String, String> taskIndex = new ConcurrentHashMap<>();
    private final List<TaskListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    private final TallyProperties.QueueConfig queueConfig;
    private final Clock clock;
    private final ScheduledExecutorService housekeeper;

    private volatile boolean closed = false;

    @Autowired
    public InMemoryRetryQueue(TallyProperties properties, Clock clock) {
        this.queueConfig = properties.getQueue();
        this.clock = clock;
        this.housekeeper = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "tally-queue-housekeeper");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void createQueue(String queueName) {
        ensureOpen();
        queues.computeIfAbsent(queueName, name -> {
            QueueState state = new QueueState(name);
            long cleanMs = queueConfig.getCleanInterval().toMillis();
            housekeeper.scheduleWithFixedDelay(
                () -> runSafely("clean", name, () -> prune(state)), cleanMs, cleanMs, TimeUnit.MILLISECONDS);
            log.info("Created queue {}", name);
            return state;
        });
    }

    @Override
    public String addTask(String queueName, String taskName, Object payload, TaskOptions options) {
        ensureOpen();
        QueueState queue = requireQueue(queueName);
        TaskOptions opts = options != null ? options : TaskOptions.defaults();

        long delayMs = opts.getDelay() != null ? Math.max(0, opts.getDelay().toMillis()) : 0;
        QueueTask task = newTask(queueName, taskName, opts.getJobId(), payload, 1,
            Math.max(1, opts.getAttempts()), opts.getPriority(), opts.getBackoff(), delayMs);
        task.setRemoveOnComplete(opts.isRemoveOnComplete());
        task.setRemoveOnFail(opts.isRemoveOnFail());

        synchronized (queue) {
            queue.tasks.put(task.getTaskId(), task);
            taskIndex.put(task.getTaskId(), queueName);
        }
        log.debug("Added task {} ({}) to {} with state {}", task.getTaskId(), taskName, queueName, task.getState());

        dispatch(queue);
        return task.getTaskId();
    }

    @Override
    public void registerWorker(String queueName, TaskHandler handler, WorkerConfig config) {
        ensureOpen();
        QueueState queue = requireQueue(queueName);
        WorkerConfig worker = config != null ? config : WorkerConfig.from(queueConfig);

        synchronized (queue) {
            if (queue.handler != null) {
                throw new IllegalStateException("Queue " + queueName + " already has a worker");
            }
            queue.handler = handler;
            queue.config = worker;
            AtomicInteger threadCount = new AtomicInteger();
            queue.workers = Executors.newFixedThreadPool(Math.max(1, worker.getConcurrency()), r -> {
                Thread t = new Thread(r, "tally-worker-" + queueName + "-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });

            long pollMs = Math.max(10, queueConfig.getPollInterval().toMillis());
            housekeeper.scheduleWithFixedDelay(
                () -> runSafely("dispatch", queueName, () -> dispatch(queue)), pollMs, pollMs, TimeUnit.MILLISECONDS);

            long stallMs = Math.max(10, worker.getStalledInterval().toMillis());
            housekeeper.scheduleWithFixedDelay(
                () -> runSafely("stall check", queueName, () -> checkStalled(queue)), stallMs, stallMs, TimeUnit.MILLISECONDS);
        }

        log.info("Registered worker for queue {} (concurrency={}, lockDuration={})",
            queueName, worker.getConcurrency(), worker.getLockDuration());
        dispatch(queue);
    }

    @Override
    public void addListener(TaskListener listener) {
        listeners.add(listener);
    }

    @Override
    public boolean extendLease(String taskId) {
        QueueState queue = queueOf(taskId);
        if (queue == null) {
            return false;
        }
        synchronized (queue) {
            QueueTask task = queue.tasks.get(taskId);
            if (task == null || task.getState() != TaskState.ACTIVE) {
                return false;
            }
            task.setLeaseExpiresAt(clock.instant().plus(queue.config.getLockDuration()));
            return true;
        }
    }

    @Override
    public Optional<TaskStatus> getTaskStatus(String taskId) {
        QueueState queue = queueOf(taskId);
        if (queue == null) {
            return Optional.empty();
        }
        synchronized (queue) {
            return Optional.ofNullable(queue.tasks.get(taskId)).map(QueueTask::toStatus);
        }
    }

    @Override
    public boolean cancelTask(String taskId) {
        QueueState queue = queueOf(taskId);
        if (queue == null) {
            return false;
        }
        synchronized (queue) {
            QueueTask task = queue.tasks.get(taskId);
            if (task == null || !task.getState().isPending()) {
                return false;
            }
            removeTask(queue, taskId);
        }
        log.info("Cancelled task {}", taskId);
        return true;
    }

    @Override
    public int cancelTasksForJob(String jobId) {
        int removed = 0;
        for (QueueState queue : queues.values()) {
            synchronized (queue) {
                List<String> ids = queue.tasks.values().stream()
                    .filter(t -> jobId.equals(t.getJobId()) && t.getState().isPending())
                    .map(QueueTask::getTaskId)
                    .toList();
                ids.forEach(id -> removeTask(queue, id));
                removed += ids.size();
            }
        }
        if (removed > 0) {
            log.info("Cancelled {} pending task(s) of job {}", removed, jobId);
        }
        return removed;
    }

    @Override
    public QueueStats getQueueStats(String queueName) {
        QueueState queue = requireQueue(queueName);
        synchronized (queue) {
            Map<TaskState, Long> counts = new EnumMap<>(TaskState.class);
            queue.tasks.values().forEach(t -> counts.merge(t.getState(), 1L, Long::sum));
            return QueueStats.builder()
                .queueName(queueName)
                .waiting(counts.getOrDefault(TaskState.WAITING, 0L))
                .active(counts.getOrDefault(TaskState.ACTIVE, 0L))
                .delayed(counts.getOrDefault(TaskState.DELAYED, 0L))
                .completed(counts.getOrDefault(TaskState.COMPLETED, 0L))
                .failed(counts.getOrDefault(TaskState.FAILED, 0L))
                .paused(queue.paused)
                .total(queue.tasks.size())
                .build();
        }
    }

    @Override
    public void pauseQueue(String queueName) {
        QueueState queue = requireQueue(queueName);
        synchronized (queue) {
            queue.paused = true;
        }
        log.info("Paused queue {}", queueName);
    }

    @Override
    public void resumeQueue(String queueName) {
        QueueState queue = requireQueue(queueName);
        synchronized (queue) {
            queue.paused = false;
        }
        log.info("Resumed queue {}", queueName);
        dispatch(queue);
    }

    @Override
    public int cleanQueue(String queueName, Duration grace) {
        QueueState queue = requireQueue(queueName);
        Instant cutoff = clock.instant().minus(grace);
        return prune(queue, cutoff, cutoff);
    }

    @Override
    @PreDestroy
    public void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Shutting down retry queue ({} queue(s))", queues.size());

        housekeeper.shutdownNow();
        for (QueueState queue : queues.values()) {
            ExecutorService workers;
            synchronized (queue) {
                workers = queue.workers;
            }
            if (workers == null) {
                continue;
            }
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Retry queue shutdown complete");
    }

    /**
     * Promote due delayed tasks and start as many waiting tasks as the worker allows
     */
    void dispatch(QueueState queue) {
        List<QueueTask> started = new ArrayList<>();

        synchronized (queue) {
            if (closed || queue.handler == null) {
                return;
            }
            Instant now = clock.instant();
            queue.tasks.values().stream()
                .filter(t -> t.getState() == TaskState.DELAYED && !t.getAvailableAt().isAfter(now))
                .forEach(t -> t.setState(TaskState.WAITING));

            if (queue.paused) {
                return;
            }

            int free = queue.config.getConcurrency() - queue.active;
            if (free <= 0) {
                return;
            }

            List<QueueTask> next = queue.tasks.values().stream()
                .filter(t -> t.getState() == TaskState.WAITING)
                .sorted(Comparator.comparingInt(QueueTask::getPriority).thenComparingLong(QueueTask::getSequence))
                .limit(free)
                .toList();

            for (QueueTask task : next) {
                task.setState(TaskState.ACTIVE);
                task.setLeaseToken(UUID.randomUUID().toString());
                task.setLeaseExpiresAt(now.plus(queue.config.getLockDuration()));
                queue.active++;
                started.add(task.copy());
            }
        }

        for (QueueTask task : started) {
            try {
                queue.workers.execute(() -> process(queue, task));
            } catch (RejectedExecutionException e) {
                release(queue, task);
            }
        }
    }

    /**
     * Hand a leased task that never reached a worker back to WAITING
     */
    private void release(QueueState queue, QueueTask leased) {
        synchronized (queue) {
            QueueTask task = queue.tasks.get(leased.getTaskId());
            if (!holdsLease(task, leased.getLeaseToken())) {
                return;
            }
            task.setState(TaskState.WAITING);
            clearLease(task);
            queue.active--;
        }
        log.warn("Worker pool of queue {} rejected task {}, returned to waiting", queue.name, leased.getTaskId());
    }

    private void process(QueueState queue, QueueTask task) {
        String token = task.getLeaseToken();
        notifyListeners(l -> l.onStarted(task.toStatus()));
        log.debug("Processing task {} of job {} (attempt {}/{})",
            task.getTaskId(), task.getJobId(), task.getAttempt(), task.getMaxAttempts());

        Object result;
        try {
            result = queue.handler.handle(task);
        } catch (Exception e) {
            fail(queue, task.getTaskId(), token, e);
            return;
        }
        complete(queue, task.getTaskId(), token, result);
    }

    private void complete(QueueState queue, String taskId, String token, Object result) {
        TaskStatus status;
        synchronized (queue) {
            QueueTask task = queue.tasks.get(taskId);
            if (!holdsLease(task, token)) {
                log.debug("Ignoring completion of task {} with an expired lease", taskId);
                return;
            }
            task.setState(TaskState.COMPLETED);
            task.setResult(result);
            task.setFinishedAt(clock.instant());
            clearLease(task);
            queue.active--;
            status = task.toStatus();
            if (task.isRemoveOnComplete()) {
                removeTask(queue, taskId);
            }
        }

        log.debug("Task {} completed", taskId);
        notifyListeners(l -> l.onCompleted(status));
        dispatch(queue);
    }

    private void fail(QueueState queue, String taskId, String token, Throwable error) {
        FailureOutcome outcome;
        synchronized (queue) {
            QueueTask task = queue.tasks.get(taskId);
            if (!holdsLease(task, token)) {
                log.debug("Ignoring failure of task {} with an expired lease: {}", taskId, error.getMessage());
                return;
            }
            queue.active--;
            outcome = markFailed(queue, task, error);
        }

        publish(outcome);
        dispatch(queue);
    }

    /**
     * Mark an active task FAILED and enqueue the follow-up attempt when one is left.
     * Caller holds the queue lock.
     */
    private FailureOutcome markFailed(QueueState queue, QueueTask task, Throwable error) {
        Throwable reason = error instanceof UnrecoverableTaskException && error.getCause() != null
            ? error.getCause()
            : error;

        task.setState(TaskState.FAILED);
        task.setFailedReason(reason.getMessage() != null ? reason.getMessage() : reason.getClass().getSimpleName());
        task.setFinishedAt(clock.instant());
        clearLease(task);

        boolean retry = !(error instanceof UnrecoverableTaskException) && task.getAttempt() < task.getMaxAttempts();
        QueueTask next = null;
        long delayMs = 0;
        if (retry) {
            delayMs = BackoffCalculator.calculate(task.getBackoff(), task.getAttempt());
            next = newTask(task.getQueueName(), task.getName(), task.getJobId(), task.getPayload(),
                task.getAttempt() + 1, task.getMaxAttempts(), task.getPriority(), task.getBackoff(), delayMs);
            next.setRemoveOnComplete(task.isRemoveOnComplete());
            next.setRemoveOnFail(task.isRemoveOnFail());
            queue.tasks.put(next.getTaskId(), next);
            taskIndex.put(next.getTaskId(), queue.name);
            task.setRetriedAs(next.getTaskId());
        }

        TaskStatus status = task.toStatus();
        if (task.isRemoveOnFail()) {
            removeTask(queue, task.getTaskId());
        }
        return new FailureOutcome(status, error, next != null ? next.getTaskId() : null, delayMs);
    }

    private void publish(FailureOutcome outcome) {
        TaskStatus status = outcome.getStatus();
        Throwable error = outcome.getError();
        if (outcome.getRetryTaskId() != null) {
            log.info("Task {} failed on attempt {}/{}, retrying as {} in {}ms: {}",
                status.getTaskId(), status.getAttempt(), status.getMaxAttempts(),
                outcome.getRetryTaskId(), outcome.getDelayMs(), status.getFailedReason());
        } else {
            log.warn("Task {} failed permanently on attempt {}/{}: {}",
                status.getTaskId(), status.getAttempt(), status.getMaxAttempts(), status.getFailedReason());
        }

        boolean willRetry = outcome.getRetryTaskId() != null;
        notifyListeners(l -> l.onFailed(status, error, willRetry));
        if (willRetry) {
            notifyListeners(l -> l.onRetried(status, outcome.getRetryTaskId(), outcome.getDelayMs()));
        }
    }

    /**
     * Return expired leases to WAITING, or fail tasks that stalled too often
     */
    void checkStalled(QueueState queue) {
        List<TaskStatus> stalled = new ArrayList<>();
        List<FailureOutcome> failed = new ArrayList<>();

        synchronized (queue) {
            if (queue.config == null) {
                return;
            }
            Instant now = clock.instant();
            List<QueueTask> expired = queue.tasks.values().stream()
                .filter(t -> t.getState() == TaskState.ACTIVE && t.getLeaseExpiresAt().isBefore(now))
                .toList();

            for (QueueTask task : expired) {
                task.setStalledCount(task.getStalledCount() + 1);
                queue.active--;
                log.warn("Task {} stalled ({} time(s)), lease expired at {}",
                    task.getTaskId(), task.getStalledCount(), task.getLeaseExpiresAt());

                if (task.getStalledCount() > queue.config.getMaxStalledCount()) {
                    failed.add(markFailed(queue, task, new QueueStalledException(
                        "Task " + task.getTaskId() + " stalled more than " + queue.config.getMaxStalledCount() + " time(s)")));
                } else {
                    task.setState(TaskState.WAITING);
                    clearLease(task);
                    stalled.add(task.toStatus());
                }
            }
        }

        stalled.forEach(status -> notifyListeners(l -> l.onStalled(status)));
        failed.forEach(this::publish);
        if (!stalled.isEmpty() || !failed.isEmpty()) {
            dispatch(queue);
        }
    }

    private int prune(QueueState queue) {
        Instant now = clock.instant();
        return prune(queue, now.minus(queueConfig.getCompletedRetention()), now.minus(queueConfig.getFailedRetention()));
    }

    private int prune(QueueState queue, Instant completedCutoff, Instant failedCutoff) {
        int removed;
        synchronized (queue) {
            List<String> ids = queue.tasks.values().stream()
                .filter(t -> (t.getState() == TaskState.COMPLETED && t.getFinishedAt().isBefore(completedCutoff))
                    || (t.getState() == TaskState.FAILED && t.getFinishedAt().isBefore(failedCutoff)))
                .map(QueueTask::getTaskId)
                .toList();
            ids.forEach(id -> removeTask(queue, id));
            removed = ids.size();
        }
        if (removed > 0) {
            log.info("Cleaned {} finished task(s) from {}", removed, queue.name);
        }
        return removed;
    }

    private QueueTask newTask(String queueName, String name, String jobId, Object payload, int attempt,
                              int maxAttempts, int priority, BackoffSpec backoff, long delayMs) {
        Instant now = clock.instant();
        return QueueTask.builder()
            .taskId(UUID.randomUUID().toString())
            .queueName(queueName)
            .name(name)
            .jobId(jobId)
            .payload(payload)
            .attempt(attempt)
            .maxAttempts(maxAttempts)
            .priority(priority)
            .backoff(backoff != null ? backoff : BackoffSpec.none())
            .sequence(sequence.incrementAndGet())
            .enqueuedAt(now)
            .availableAt(now.plusMillis(delayMs))
            .state(delayMs > 0 ? TaskState.DELAYED : TaskState.WAITING)
            .build();
    }

    private boolean holdsLease(QueueTask task, String token) {
        return task != null && task.getState() == TaskState.ACTIVE && token.equals(task.getLeaseToken());
    }

    private void clearLease(QueueTask task) {
        task.setLeaseToken(null);
        task.setLeaseExpiresAt(null);
    }

    private void removeTask(QueueState queue, String taskId) {
        queue.tasks.remove(taskId);
        taskIndex.remove(taskId);
    }

    private QueueState requireQueue(String queueName) {
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            throw new NotFoundException("Queue " + queueName + " does not exist");
        }
        return queue;
    }

    private QueueState queueOf(String taskId) {
        String queueName = taskIndex.get(taskId);
        return queueName != null ? queues.get(queueName) : null;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Retry queue is shut down");
        }
    }

    private void notifyListeners(Consumer<TaskListener> call) {
        for (TaskListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.error("Task listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void runSafely(String what, String queueName, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            // A throwing periodic task would be cancelled by the executor
            log.error("Queue {} {} failed", queueName, what, e);
        }
    }

    @Value
    private static class FailureOutcome {
        TaskStatus status;
        Throwable error;
        String retryTaskId;
        long delayMs;
    }

    static final class QueueState {
        final String name;
        final Map<String, QueueTask> tasks = new LinkedHashMap<>();
        boolean paused;
        int active;
        TaskHandler handler;
        WorkerConfig config;
        ExecutorService workers;

        QueueState(String name) {
            this.name = name;
        }
    }
}
