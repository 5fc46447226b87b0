package com.umitunal.qcron.service;

import com.umitunal.qcron.core.FireTimeCalculator;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledTask.TaskState;
import com.umitunal.qcron.core.TaskScheduler;
import com.umitunal.qcron.exception.WriteConflictException;
import com.umitunal.qcron.model.CronJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Re-arms jobs whose tick chain was broken.
 *
 * A job is stalled when its recorded tick task is missing, unknown to the scheduler, or already
 * finished: nothing will ever tick it again. This happens when a tick loses a write conflict
 * while re-arming, or when a non-durable scheduler restarts. Repaired jobs resume from the
 * current time rather than replaying missed fires.
 */
public class StalledJobJanitor {
    private static final Logger log = LoggerFactory.getLogger(StalledJobJanitor.class);

    private final JobStore store;
    private final TaskScheduler scheduler;
    private final FireTimeCalculator fireTimes;
    private final Clock clock;

    public StalledJobJanitor(JobStore store, TaskScheduler scheduler, FireTimeCalculator fireTimes, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.fireTimes = fireTimes;
        this.clock = clock;
    }

    static boolean isStalled(CronJob job, TaskScheduler scheduler) {
        String tickId = job.getPendingTickTaskId();
        if (tickId == null) {
            return true;
        }
        return scheduler.getStatus(tickId)
                .map(TaskState::isTerminal)
                .orElse(true);
    }

    /**
     * Scan every job and re-arm the stalled ones.
     *
     * @return number of jobs re-armed
     */
    public int sweep() {
        int rearmed = 0;
        for (CronJob job : store.list()) {
            if (isStalled(job, scheduler) && rearm(job)) {
                rearmed++;
            }
        }
        if (rearmed > 0) {
            log.warn("Janitor re-armed {} stalled cron jobs", rearmed);
        }
        return rearmed;
    }

    private boolean rearm(CronJob observed) {
        String jobId = observed.getId();
        long nextTime = FireTimes.next(observed.getSchedule(), clock.millis(), fireTimes);
        AtomicReference<String> armedTick = new AtomicReference<>();

        try {
            boolean rearmed = store.inTransaction(txn -> {
                Optional<CronJob> current = txn.get(jobId);
                // Deleted, or a tick re-armed it since the scan
                if (current.isEmpty()
                        || !Objects.equals(current.get().getPendingTickTaskId(), observed.getPendingTickTaskId())) {
                    return false;
                }
                CronJob job = current.get();
                String tickId = scheduler.reserveAt(nextTime, Rescheduler.FUNCTION_NAME, Rescheduler.tickArgs(jobId));
                armedTick.set(tickId);

                job.armTick(tickId);
                txn.patch(job);
                txn.afterCommit(() -> scheduler.release(tickId));
                return true;
            });
            if (rearmed) {
                log.warn("Re-armed stalled cron job {} (stale tick {}) for {}",
                        jobId, observed.getPendingTickTaskId(), nextTime);
            }
            return rearmed;
        } catch (WriteConflictException e) {
            cancelArmed(armedTick);
            log.debug("Cron job {} changed during repair, leaving it for the next sweep", jobId);
            return false;
        } catch (RuntimeException e) {
            cancelArmed(armedTick);
            throw e;
        }
    }

    private void cancelArmed(AtomicReference<String> armedTick) {
        String tickId = armedTick.get();
        if (tickId != null) {
            scheduler.cancel(tickId);
        }
    }
}
