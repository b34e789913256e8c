package com.whereq.tally.scheduler;

import com.whereq.tally.model.Job;
import lombok.Getter;

import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.ScheduledFuture;

/**
 * Binds a job to its armed timer. Guarded by the owning {@link JobScheduler}.
 */
@Getter
class ScheduleHandle {

    private final String jobId;
    private final Job job;
    private final ZoneId zone;

    private ScheduledFuture<?> timer;
    private Instant nextFire;
    private boolean armed;

    ScheduleHandle(Job job, ZoneId zone) {
        this.jobId = job.getId();
        this.job = job;
        this.zone = zone;
    }

    void arm(ScheduledFuture<?> timer, Instant nextFire) {
        this.timer = timer;
        this.nextFire = nextFire;
        this.armed = true;
    }

    /**
     * Cancel the pending fire, if any
     */
    void disarm() {
        if (timer != null) {
            timer.cancel(false);
        }
        timer = null;
        nextFire = null;
        armed = false;
    }
}
