package com.umitunal.qcron.service;

import com.umitunal.qcron.core.CronMetrics;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.TaskScheduler;
import com.umitunal.qcron.exception.JobNotFoundException;
import com.umitunal.qcron.exception.NotScheduledException;
import com.umitunal.qcron.exception.WriteConflictException;
import com.umitunal.qcron.model.CronJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Lists, looks up and deletes registered cron jobs.
 */
public class CronJobManager {
    private static final Logger log = LoggerFactory.getLogger(CronJobManager.class);

    /**
     * A delete has no side effects until it commits, so losing a race with a tick is retried.
     */
    private static final int MAX_DELETE_ATTEMPTS = 3;

    private final JobStore store;
    private final TaskScheduler scheduler;

    public CronJobManager(JobStore store, TaskScheduler scheduler) {
        this.store = store;
        this.scheduler = scheduler;
    }

    public List<CronJob> list() {
        return store.list();
    }

    public Optional<CronJob> get(String jobId) {
        return store.get(jobId);
    }

    public Optional<CronJob> getByName(String name) {
        return store.findByName(name);
    }

    /**
     * Cancel a job's outstanding tick and its last dispatch, then delete the record.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws NotScheduledException if the job has no tick task recorded
     */
    public void delete(String jobId) {
        for (int attempt = 1; ; attempt++) {
            try {
                deleteOnce(jobId);
                return;
            } catch (WriteConflictException e) {
                if (attempt >= MAX_DELETE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Delete of cron job {} raced with a tick, retrying (attempt {})", jobId, attempt);
            }
        }
    }

    public void deleteByName(String name) {
        CronJob job = getByName(name).orElseThrow(() -> JobNotFoundException.forName(name));
        delete(job.getId());
    }

    /**
     * Count jobs by kind and by whether their tick is still outstanding.
     */
    public CronMetrics metrics() {
        long total = 0;
        long interval = 0;
        long cron = 0;
        long scheduled = 0;
        long stalled = 0;

        for (CronJob job : store.list()) {
            total++;
            if (job.getSchedule().isInterval()) {
                interval++;
            } else {
                cron++;
            }
            if (StalledJobJanitor.isStalled(job, scheduler)) {
                stalled++;
            } else {
                scheduled++;
            }
        }

        return new CronMetrics(total, interval, cron, scheduled, stalled);
    }

    private void deleteOnce(String jobId) {
        store.inTransaction(txn -> {
            CronJob job = txn.get(jobId).orElseThrow(() -> JobNotFoundException.forId(jobId));
            if (!job.isScheduled()) {
                throw new NotScheduledException(jobId);
            }

            // Canceled only once the delete is final, so a lost race leaves the job running
            String tickId = job.getPendingTickTaskId();
            String dispatchId = job.getLastDispatchTaskId();
            txn.afterCommit(() -> {
                log.info("Canceling scheduler task {}", tickId);
                scheduler.cancel(tickId);
                if (dispatchId != null) {
                    log.info("Canceling execution task {}", dispatchId);
                    scheduler.cancel(dispatchId);
                }
            });

            log.info("Deleting cron job {}", jobId);
            txn.delete(jobId);
            return null;
        });
    }
}
