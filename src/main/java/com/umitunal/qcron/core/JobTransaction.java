package com.umitunal.qcron.core;

import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.model.Schedule;

import java.util.Map;
import java.util.Optional;

/**
 * Read/write view of the job store bound to one open transaction.
 * Every record read through it is checked for concurrent writes at commit.
 */
public interface JobTransaction {

    /**
     * Insert a new record. The store assigns the id.
     *
     * @param name optional unique name, may be null
     */
    CronJob insert(String name, String functionName, Map<String, Object> args, Schedule schedule);

    Optional<CronJob> get(String jobId);

    Optional<CronJob> findByName(String name);

    /**
     * Write back a record previously read in this transaction.
     *
     * @throws com.umitunal.qcron.exception.JobNotFoundException if the record no longer exists
     */
    void patch(CronJob job);

    /**
     * Remove a record and its name index entry.
     */
    void delete(String jobId);

    /**
     * Run {@code action} once this transaction has committed. Actions are dropped if the
     * transaction aborts.
     */
    void afterCommit(Runnable action);
}
