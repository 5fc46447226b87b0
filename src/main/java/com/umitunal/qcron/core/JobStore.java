package com.umitunal.qcron.core;

import com.umitunal.qcron.model.CronJob;

import java.util.List;
import java.util.Optional;

/**
 * Transactional storage for cron job records.
 *
 * All mutations go through {@link #inTransaction(TransactionWork)}; the snapshot reads on this
 * interface never conflict with anything.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Run {@code work} inside a single transaction and commit it.
     *
     * @return whatever {@code work} returned
     * @throws com.umitunal.qcron.exception.WriteConflictException if another transaction
     *         wrote a record this one read or wrote
     */
    <R> R inTransaction(TransactionWork<R> work);

    /**
     * Point lookup by id.
     */
    Optional<CronJob> get(String jobId);

    /**
     * Unique lookup by name.
     */
    Optional<CronJob> findByName(String name);

    /**
     * Snapshot of every record. Order is unspecified.
     */
    List<CronJob> list();

    @Override
    void close();

    /**
     * Unit of work executed against a {@link JobTransaction}.
     */
    @FunctionalInterface
    interface TransactionWork<R> {
        R execute(JobTransaction txn);
    }
}
