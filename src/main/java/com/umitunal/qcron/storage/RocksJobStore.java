package com.umitunal.qcron.storage;

import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.JobTransaction;
import com.umitunal.qcron.exception.JobNotFoundException;
import com.umitunal.qcron.exception.StoreException;
import com.umitunal.qcron.exception.WriteConflictException;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.model.Schedule;
import com.umitunal.qcron.serialization.ArgsCodecs;
import com.umitunal.qcron.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of JobStore.
 *
 * Records live under {@code job:<id>}; named records also have a {@code name:<name>} entry
 * holding the id. Transactions are optimistic: reads made through a {@link JobTransaction}
 * are validated at commit and a lost race surfaces as {@link WriteConflictException}.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    private final OptimisticTransactionDB transactionDB;
    private final PayloadCodec<Map<String, Object>> argsCodec;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final BlockBasedTableConfig tableConfig;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong conflictCount = new AtomicLong(0);

    public RocksJobStore(StorageConfig config) throws RocksDBException {
        this(config, ArgsCodecs.forFormat(config.getArgsFormat()));
    }

    public RocksJobStore(StorageConfig config, PayloadCodec<Map<String, Object>> argsCodec)
            throws RocksDBException {
        this.argsCodec = argsCodec;

        RocksDB.loadLibrary();

        // Job rows are few and small; a modest cache covers the whole table
        this.blockCache = new LRUCache(8 * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        this.tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        // Snapshot at begin so commit validation covers everything read in the transaction
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        log.info("Opened job store at {}", config.getDataDirectory());
    }

    @Override
    public <R> R inTransaction(TransactionWork<R> work) {
        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions readOpts = new ReadOptions().setSnapshot(txn.getSnapshot())) {

            RocksJobTransaction jobTxn = new RocksJobTransaction(txn, readOpts);
            R result = work.execute(jobTxn);
            txn.commit();
            jobTxn.runCommitActions();
            return result;

        } catch (RocksDBException e) {
            if (isConflict(e)) {
                conflictCount.incrementAndGet();
                throw new WriteConflictException("Transaction aborted by a concurrent write", e);
            }
            throw new StoreException("Job store transaction failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<CronJob> get(String jobId) {
        try {
            byte[] value = transactionDB.get(CronJob.createStorageKey(jobId));
            return Optional.ofNullable(value).map(this::decode);
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read cron job " + jobId, e);
        }
    }

    @Override
    public Optional<CronJob> findByName(String name) {
        try {
            byte[] id = transactionDB.get(CronJob.createNameIndexKey(name));
            if (id == null) {
                return Optional.empty();
            }
            return get(new String(id, UTF_8));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to look up cron job \"" + name + "\"", e);
        }
    }

    @Override
    public List<CronJob> list() {
        List<CronJob> jobs = new ArrayList<>();
        byte[] prefix = CronJob.KEY_PREFIX.getBytes(UTF_8);

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(prefix);

            while (iter.isValid() && startsWith(iter.key(), prefix)) {
                jobs.add(decode(iter.value()));
                iter.next();
            }
        }

        return jobs;
    }

    /**
     * Get the number of transactions aborted by write conflicts.
     * Useful for monitoring contention.
     */
    public long getConflictCount() {
        return conflictCount.get();
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }

    private CronJob decode(byte[] value) {
        return CronJob.deserialize(value, argsCodec);
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        return key.length >= prefix.length
                && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    /**
     * JobTransaction bound to one optimistic RocksDB transaction.
     */
    private class RocksJobTransaction implements JobTransaction {
        private final Transaction txn;
        private final ReadOptions readOpts;
        private final List<Runnable> commitActions = new ArrayList<>();

        RocksJobTransaction(Transaction txn, ReadOptions readOpts) {
            this.txn = txn;
            this.readOpts = readOpts;
        }

        @Override
        public void afterCommit(Runnable action) {
            commitActions.add(action);
        }

        void runCommitActions() {
            for (Runnable action : commitActions) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    // Already committed; the remaining actions still have to run
                    log.error("After-commit action failed", e);
                }
            }
        }

        @Override
        public CronJob insert(String name, String functionName, Map<String, Object> args, Schedule schedule) {
            String jobId = UUID.randomUUID().toString();
            CronJob job = new CronJob(jobId, name, functionName, args, schedule);

            try {
                txn.put(CronJob.createStorageKey(jobId), job.serialize(argsCodec));
                if (name != null) {
                    txn.put(CronJob.createNameIndexKey(name), jobId.getBytes(UTF_8));
                }
            } catch (RocksDBException e) {
                throw new StoreException("Failed to insert cron job " + jobId, e);
            }
            return job;
        }

        @Override
        public Optional<CronJob> get(String jobId) {
            try {
                byte[] value = txn.getForUpdate(readOpts, CronJob.createStorageKey(jobId), true);
                return Optional.ofNullable(value).map(RocksJobStore.this::decode);
            } catch (RocksDBException e) {
                throw new StoreException("Failed to read cron job " + jobId, e);
            }
        }

        @Override
        public Optional<CronJob> findByName(String name) {
            try {
                // Tracked even when absent, so two registrations of one name cannot both commit
                byte[] id = txn.getForUpdate(readOpts, CronJob.createNameIndexKey(name), true);
                if (id == null) {
                    return Optional.empty();
                }
                return get(new String(id, UTF_8));
            } catch (RocksDBException e) {
                throw new StoreException("Failed to look up cron job \"" + name + "\"", e);
            }
        }

        @Override
        public void patch(CronJob job) {
            byte[] key = CronJob.createStorageKey(job.getId());
            try {
                if (txn.getForUpdate(readOpts, key, true) == null) {
                    throw JobNotFoundException.forId(job.getId());
                }
                txn.put(key, job.serialize(argsCodec));
            } catch (RocksDBException e) {
                throw new StoreException("Failed to patch cron job " + job.getId(), e);
            }
        }

        @Override
        public void delete(String jobId) {
            byte[] key = CronJob.createStorageKey(jobId);
            try {
                byte[] value = txn.getForUpdate(readOpts, key, true);
                if (value == null) {
                    return;
                }
                CronJob job = decode(value);
                txn.delete(key);
                if (job.getName() != null) {
                    txn.delete(CronJob.createNameIndexKey(job.getName()));
                }
            } catch (RocksDBException e) {
                throw new StoreException("Failed to delete cron job " + jobId, e);
            }
        }
    }
}
