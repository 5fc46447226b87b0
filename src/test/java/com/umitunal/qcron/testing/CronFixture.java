package com.umitunal.qcron.testing;

import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.cron.CronUtilsFireTimeCalculator;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.scheduler.FunctionRegistry;
import com.umitunal.qcron.service.CronService;
import com.umitunal.qcron.service.Rescheduler;
import com.umitunal.qcron.storage.RocksJobStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires a CronService over a real RocksDB store and a {@link ManualTaskScheduler}.
 */
public class CronFixture implements AutoCloseable {
    public static final String TARGET = "jobs:target";

    public final MutableClock clock;
    public final FunctionRegistry functions = new FunctionRegistry();
    public final ManualTaskScheduler scheduler;
    public final RocksJobStore store;
    public final CronService crons;
    public final List<Map<String, Object>> targetCalls = new ArrayList<>();

    public CronFixture(Path dataDir, long startMillis) throws Exception {
        this.clock = new MutableClock(startMillis);
        this.scheduler = new ManualTaskScheduler(functions, clock);
        this.store = new RocksJobStore(StorageConfig.newBuilder(dataDir.toString())
                .withDurableWrites(false)
                .build());
        functions.registerAction(TARGET, targetCalls::add);
        this.crons = new CronService(store, scheduler, functions, new CronUtilsFireTimeCalculator(), clock);
    }

    public CronJob job(String jobId) {
        return store.get(jobId).orElseThrow();
    }

    /**
     * Scheduled time of the job's outstanding tick.
     */
    public long nextTickTime(String jobId) {
        return scheduler.getTask(job(jobId).getPendingTickTaskId()).orElseThrow().getScheduledTime();
    }

    public List<Long> tickTimes() {
        List<Long> times = new ArrayList<>();
        scheduler.tasksFor(Rescheduler.FUNCTION_NAME).forEach(t -> times.add(t.getScheduledTime()));
        return times;
    }

    @Override
    public void close() {
        store.close();
    }
}
