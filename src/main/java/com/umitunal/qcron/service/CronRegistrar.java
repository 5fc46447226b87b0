package com.umitunal.qcron.service;

import com.umitunal.qcron.core.FireTimeCalculator;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.TaskScheduler;
import com.umitunal.qcron.exception.DuplicateNameException;
import com.umitunal.qcron.exception.JobNotFoundException;
import com.umitunal.qcron.exception.WriteConflictException;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Validates new cron jobs, stores them and arms their first tick.
 *
 * The record is committed before its first tick is scheduled, and the tick is only released
 * once the record points at it, so the tick always finds a fully armed job.
 */
public class CronRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CronRegistrar.class);

    private final JobStore store;
    private final TaskScheduler scheduler;
    private final FireTimeCalculator fireTimes;
    private final Clock clock;

    public CronRegistrar(JobStore store, TaskScheduler scheduler, FireTimeCalculator fireTimes, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.fireTimes = fireTimes;
        this.clock = clock;
    }

    /**
     * Register a job running every {@code ms} milliseconds. The name is checked before the interval.
     */
    public String registerInterval(long ms, String functionName, Map<String, Object> args, String name) {
        return register(() -> Schedule.interval(ms), functionName, args, name);
    }

    /**
     * Register a job on a cron schedule. The name is checked before the expression.
     */
    public String registerCron(String cronspec, String functionName, Map<String, Object> args, String name) {
        return register(() -> Schedule.cron(cronspec), functionName, args, name);
    }

    /**
     * Register a recurring job.
     *
     * @param schedule interval or cron schedule
     * @param functionName name of the function to dispatch on every fire
     * @param args arguments for the function, may be null
     * @param name optional unique name; null or blank registers an anonymous job
     * @return the id of the new job
     * @throws DuplicateNameException if {@code name} is already taken
     * @throws com.umitunal.qcron.exception.InvalidCronSpecException if the cron expression is malformed
     */
    public String register(Schedule schedule, String functionName, Map<String, Object> args, String name) {
        return register(() -> schedule, functionName, args, name);
    }

    private String register(Supplier<Schedule> scheduleSupplier, String functionName,
                            Map<String, Object> args, String name) {
        String jobName = (name == null || name.isBlank()) ? null : name;
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("functionName is required");
        }
        if (jobName != null && store.findByName(jobName).isPresent()) {
            throw new DuplicateNameException(jobName);
        }
        Schedule schedule = scheduleSupplier.get();
        if (schedule.isCron()) {
            fireTimes.validate(schedule.getCronspec());
        }

        CronJob job = insert(jobName, functionName, args, schedule);
        log.info("Scheduling cron with name \"{}\" and id {} to run {}({}) {}",
                jobName, job.getId(), functionName, job.getArgs(), schedule);

        long firstFireTime = FireTimes.next(schedule, clock.millis(), fireTimes);
        String tickId = scheduler.reserveAt(firstFireTime, Rescheduler.FUNCTION_NAME,
                Rescheduler.tickArgs(job.getId()));
        try {
            armFirstTick(job.getId(), tickId);
        } catch (WriteConflictException e) {
            scheduler.cancel(tickId);
            if (store.get(job.getId()).map(CronJob::isScheduled).orElse(false)) {
                return job.getId();
            }
            throw e;
        } catch (RuntimeException e) {
            scheduler.cancel(tickId);
            throw e;
        }
        return job.getId();
    }

    private CronJob insert(String jobName, String functionName, Map<String, Object> args, Schedule schedule) {
        try {
            return store.inTransaction(txn -> {
                if (jobName != null && txn.findByName(jobName).isPresent()) {
                    throw new DuplicateNameException(jobName);
                }
                return txn.insert(jobName, functionName, args, schedule);
            });
        } catch (WriteConflictException e) {
            // A concurrent registration of the same name committed first
            if (jobName != null && store.findByName(jobName).isPresent()) {
                throw new DuplicateNameException(jobName);
            }
            throw e;
        }
    }

    private void armFirstTick(String jobId, String tickId) {
        boolean armed = store.inTransaction(txn -> {
            CronJob job = txn.get(jobId).orElseThrow(() -> JobNotFoundException.forId(jobId));
            if (job.isScheduled()) {
                // The janitor saw the unarmed record first and armed it
                return false;
            }
            job.armTick(tickId);
            txn.patch(job);
            txn.afterCommit(() -> scheduler.release(tickId));
            return true;
        });
        if (!armed) {
            scheduler.cancel(tickId);
        }
    }
}
