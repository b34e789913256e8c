package com.whereq.tally.scheduler;

import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.exception.DuplicateJobException;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.exception.ValidationException;
import com.whereq.tally.model.CronSchedule;
import com.whereq.tally.model.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Cron-driven trigger for registered jobs.
 *
 * A fire only hands the job to the trigger callback; it never extracts. Missed fires
 * (while paused, or while the process was down) are not replayed.
 */
@Slf4j
@Service
public class JobScheduler {

    private final Map<String, ScheduleHandle> handles = new ConcurrentHashMap<>();

    private final TaskScheduler taskScheduler;
    private final ScheduleEvaluator evaluator;
    private final Clock clock;
    private final String defaultTimezone;

    private volatile Consumer<Job> trigger = job -> log.warn("No trigger registered, dropping fire of job {}", job.getId());
    private volatile boolean closed = false;

    @Autowired
    public JobScheduler(@Qualifier("jobTimerScheduler") TaskScheduler taskScheduler,
                        ScheduleEvaluator evaluator,
                        TallyProperties properties,
                        Clock clock) {
        this.taskScheduler = taskScheduler;
        this.evaluator = evaluator;
        this.clock = clock;
        this.defaultTimezone = properties.getScheduler().getDefaultTimezone();
    }

    /**
     * Register the callback invoked on every fire
     */
    public void setTrigger(Consumer<Job> trigger) {
        this.trigger = trigger;
    }

    /**
     * Register a job and arm its trigger when the schedule is enabled
     *
     * @throws DuplicateJobException if the job is already scheduled
     * @throws ValidationException if the schedule is invalid
     */
    public void scheduleJob(Job job) {
        if (closed) {
            throw new IllegalStateException("Scheduler is shut down");
        }
        CronSchedule schedule = job.getSchedule();
        if (schedule == null) {
            throw new ValidationException("Job " + job.getId() + " has no schedule");
        }
        ZoneId zone = resolveZone(schedule.getTimezone());
        evaluator.validate(schedule.getExpression(), zone);
        validatePreferredHours(schedule.getPreferredHours());

        synchronized (this) {
            if (handles.containsKey(job.getId())) {
                throw new DuplicateJobException("Job " + job.getId() + " is already scheduled");
            }
            ScheduleHandle handle = new ScheduleHandle(job, zone);
            handles.put(job.getId(), handle);
            if (schedule.isEnabled()) {
                arm(handle, clock.instant());
            }
        }

        log.info("Scheduled job {} with '{}' ({}), next run: {}",
            job.getId(), schedule.getExpression(), zone, getNextExecution(job.getId()).orElse(null));
    }

    /**
     * Disarm a job's trigger
     *
     * @throws NotFoundException if the job is not scheduled
     */
    public synchronized void pauseJob(String jobId) {
        requireHandle(jobId).disarm();
        log.info("Paused schedule of job {}", jobId);
    }

    /**
     * Re-arm from now. Fires missed while paused are skipped.
     *
     * @throws NotFoundException if the job is not scheduled
     */
    public synchronized void resumeJob(String jobId) {
        ScheduleHandle handle = requireHandle(jobId);
        if (!handle.isArmed()) {
            arm(handle, clock.instant());
        }
        log.info("Resumed schedule of job {}, next run: {}", jobId, handle.getNextFire());
    }

    /**
     * Disarm and forget a job. Unknown ids are ignored.
     */
    public synchronized void removeJob(String jobId) {
        ScheduleHandle handle = handles.remove(jobId);
        if (handle != null) {
            handle.disarm();
            log.info("Removed job {} from scheduler", jobId);
        }
    }

    /**
     * Next fire time; empty when the job is unknown or paused
     */
    public synchronized Optional<Instant> getNextExecution(String jobId) {
        ScheduleHandle handle = handles.get(jobId);
        if (handle == null || !handle.isArmed()) {
            return Optional.empty();
        }
        return Optional.ofNullable(handle.getNextFire());
    }

    public boolean isScheduled(String jobId) {
        return handles.containsKey(jobId);
    }

    public List<String> getScheduledJobIds() {
        return new ArrayList<>(handles.keySet());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        handles.values().forEach(ScheduleHandle::disarm);
        handles.clear();
        log.info("Job scheduler stopped");
    }

    private void arm(ScheduleHandle handle, Instant after) {
        Optional<Instant> next = evaluator.next(handle.getJob().getSchedule().getExpression(), handle.getZone(), after);
        if (next.isEmpty()) {
            log.warn("Schedule of job {} has no future fire time", handle.getJobId());
            handle.disarm();
            return;
        }
        Instant fireAt = next.get();
        handle.arm(taskScheduler.schedule(() -> fire(handle, fireAt), fireAt), fireAt);
    }

    private void fire(ScheduleHandle handle, Instant fireAt) {
        synchronized (this) {
            if (closed || handles.get(handle.getJobId()) != handle || !handle.isArmed()) {
                return;
            }
            Instant now = clock.instant();
            arm(handle, now.isAfter(fireAt) ? now : fireAt);
        }

        Job job = handle.getJob();
        logPreferredHours(job, fireAt, handle.getZone());
        log.debug("Firing job {}", job.getId());
        try {
            trigger.accept(job);
        } catch (RuntimeException e) {
            log.error("Trigger failed for job {}, schedule stays armed", job.getId(), e);
        }
    }

    private void logPreferredHours(Job job, Instant fireAt, ZoneId zone) {
        List<Integer> preferred = job.getSchedule().getPreferredHours();
        if (preferred == null || preferred.isEmpty()) {
            return;
        }
        int hour = fireAt.atZone(zone).getHour();
        if (!preferred.contains(hour)) {
            log.debug("Job {} fired at hour {} outside preferred hours {}", job.getId(), hour, preferred);
        }
    }

    private ScheduleHandle requireHandle(String jobId) {
        ScheduleHandle handle = handles.get(jobId);
        if (handle == null) {
            throw new NotFoundException("Job " + jobId + " is not scheduled");
        }
        return handle;
    }

    private ZoneId resolveZone(String timezone) {
        String zone = timezone == null || timezone.isBlank() ? defaultTimezone : timezone;
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone '" + zone + "'", e);
        }
    }

    private void validatePreferredHours(List<Integer> hours) {
        if (hours == null) {
            return;
        }
        for (Integer hour : hours) {
            if (hour == null || hour < 0 || hour > 23) {
                throw new ValidationException("Preferred hour out of range 0-23: " + hour);
            }
        }
    }
}
