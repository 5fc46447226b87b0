package com.umitunal.qcron.service;

import com.umitunal.qcron.core.FireTimeCalculator;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledTask;
import com.umitunal.qcron.core.ScheduledTask.TaskState;
import com.umitunal.qcron.core.TaskScheduler;
import com.umitunal.qcron.exception.NotScheduledException;
import com.umitunal.qcron.exception.ScheduledTaskNotFoundException;
import com.umitunal.qcron.exception.TickIntegrityException;
import com.umitunal.qcron.exception.WriteConflictException;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.scheduler.ScheduledFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The function every tick runs: dispatches the job's target function unless the previous run is
 * still outstanding, then arms the next tick.
 *
 * Each tick is one store transaction. The dispatch and the next tick are reserved inside it and
 * only released once it commits; if the commit loses a write conflict both are canceled and the
 * job is left without a next tick. This is not retried here, since a retry could dispatch twice.
 * {@link StalledJobJanitor} repairs such jobs.
 */
public class Rescheduler {
    private static final Logger log = LoggerFactory.getLogger(Rescheduler.class);

    /**
     * Name the tick function is registered under.
     */
    public static final String FUNCTION_NAME = "qcron:rescheduler";

    /**
     * Argument carrying the job id in tick tasks.
     */
    public static final String JOB_ID_ARG = "cronJobId";

    private final JobStore store;
    private final TaskScheduler scheduler;
    private final FireTimeCalculator fireTimes;

    public Rescheduler(JobStore store, TaskScheduler scheduler, FireTimeCalculator fireTimes) {
        this.store = store;
        this.scheduler = scheduler;
        this.fireTimes = fireTimes;
    }

    public static Map<String, Object> tickArgs(String jobId) {
        return Map.of(JOB_ID_ARG, jobId);
    }

    /**
     * The tick as a function the task scheduler can invoke. It needs the firing task's handle,
     * so it cannot be invoked with bare arguments.
     */
    public ScheduledFunction asFunction() {
        return new ScheduledFunction() {
            @Override
            public void invoke(Map<String, Object> args) {
                throw new IllegalStateException("Tick tasks must be invoked with their task handle");
            }

            @Override
            public void invoke(ScheduledTask task) {
                handle(task);
            }
        };
    }

    /**
     * Entry point for tick tasks.
     */
    public void handle(ScheduledTask task) {
        Object jobId = task.getArgs().get(JOB_ID_ARG);
        if (jobId == null) {
            throw new IllegalArgumentException("Tick task " + task.getId() + " is missing " + JOB_ID_ARG);
        }
        tick(jobId.toString(), task.getId());
    }

    /**
     * Run one tick for a job.
     *
     * @param jobId the job to tick
     * @param tickTaskId handle of the task running this tick
     * @throws NotScheduledException if the job has no tick task recorded
     * @throws TickIntegrityException if the firing task is not the job's armed tick, or that tick
     *         is not in an executing state
     * @throws ScheduledTaskNotFoundException if the scheduler does not know the recorded tick task
     * @throws WriteConflictException if re-arming lost a write conflict; the job is then stalled
     */
    public void tick(String jobId, String tickTaskId) {
        List<String> reserved = new ArrayList<>();

        try {
            store.inTransaction(txn -> {
                Optional<CronJob> loaded = txn.get(jobId);
                if (loaded.isEmpty()) {
                    // Deleted while this tick was in flight
                    log.info("Cron job {} not found, dropping tick", jobId);
                    return null;
                }
                CronJob job = loaded.get();
                ScheduledTask tick = currentTick(job, tickTaskId);

                if (isPreviousRunOutstanding(job)) {
                    log.info("Cron {} still running, skipping this run.", jobId);
                } else {
                    String dispatchId = scheduler.reserveAfter(0, job.getFunctionName(), job.getArgs());
                    reserved.add(dispatchId);
                    txn.afterCommit(() -> scheduler.release(dispatchId));
                    log.info("Running cron job {} ({}) as task {}", jobId, job.getFunctionName(), dispatchId);
                    job.recordDispatch(dispatchId);
                }

                // Anchored to the scheduled time, not the execution time, so cadence does not drift
                long nextTime = FireTimes.next(job.getSchedule(), tick.getScheduledTime(), fireTimes);
                String nextTickId = scheduler.reserveAt(nextTime, FUNCTION_NAME, tickArgs(jobId));
                reserved.add(nextTickId);
                txn.afterCommit(() -> scheduler.release(nextTickId));

                job.armTick(nextTickId);
                txn.patch(job);
                log.debug("Cron job {} next tick {} at {}", jobId, nextTickId, nextTime);
                return null;
            });
        } catch (WriteConflictException e) {
            reserved.forEach(scheduler::cancel);
            log.error("Cron job {} lost a write conflict while re-arming; it will not fire again until repaired",
                    jobId, e);
            throw e;
        } catch (RuntimeException e) {
            reserved.forEach(scheduler::cancel);
            throw e;
        }
    }

    private ScheduledTask currentTick(CronJob job, String tickTaskId) {
        String armedId = job.getPendingTickTaskId();
        if (armedId == null) {
            throw new NotScheduledException(job.getId());
        }
        if (!armedId.equals(tickTaskId)) {
            throw new TickIntegrityException(
                    "Task " + tickTaskId + " is not the armed tick " + armedId + " of cron job " + job.getId());
        }
        ScheduledTask tick = scheduler.getTask(armedId)
                .orElseThrow(() -> new ScheduledTaskNotFoundException(armedId));

        TaskState state = tick.getState();
        if (state == TaskState.RUNNING) {
            // Schedulers that report transactional functions as RUNNING are tolerated
            log.debug("Tick task {} reported RUNNING at entry", armedId);
        } else if (state != TaskState.PENDING) {
            throw new TickIntegrityException(
                    "Running tick for cron job " + job.getId() + " but task " + armedId + " is " + state);
        }
        return tick;
    }

    private boolean isPreviousRunOutstanding(CronJob job) {
        String dispatchId = job.getLastDispatchTaskId();
        if (dispatchId == null) {
            return false;
        }
        return scheduler.getStatus(dispatchId)
                .map(TaskState::isOutstanding)
                .orElse(false);
    }
}
