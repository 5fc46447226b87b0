package com.umitunal.qcron.service;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.core.CronMetrics;
import com.umitunal.qcron.core.FireTimeCalculator;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.TaskScheduler;
import com.umitunal.qcron.cron.CronUtilsFireTimeCalculator;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.scheduler.ExecutorTaskScheduler;
import com.umitunal.qcron.scheduler.FunctionRegistry;
import com.umitunal.qcron.storage.RocksJobStore;
import org.rocksdb.RocksDBException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry points for registering, inspecting and deleting recurring jobs.
 *
 * <pre>{@code
 * FunctionRegistry functions = new FunctionRegistry()
 *         .registerAction("presence:clear", args -> presence.clear());
 *
 * try (CronService crons = CronService.open(storageConfig, SchedulerConfig.defaults(), functions)) {
 *     crons.scheduleInterval(30_000, "presence:clear", Map.of());
 *     crons.registerNamed("daily", "0 0 * * *", "reports:daily", Map.of("message", "daily cron"));
 * }
 * }</pre>
 *
 * Like unix cron, Sunday is 0 (or 7), Monday is 1, etc.
 */
public class CronService implements AutoCloseable {
    private final CronRegistrar registrar;
    private final CronJobManager manager;
    private final StalledJobJanitor janitor;
    private final List<AutoCloseable> owned = new ArrayList<>();

    public CronService(JobStore store, TaskScheduler scheduler, FunctionRegistry functions,
                       FireTimeCalculator fireTimes, Clock clock) {
        Rescheduler rescheduler = new Rescheduler(store, scheduler, fireTimes);
        functions.registerMutation(Rescheduler.FUNCTION_NAME, rescheduler.asFunction());

        this.registrar = new CronRegistrar(store, scheduler, fireTimes, clock);
        this.manager = new CronJobManager(store, scheduler);
        this.janitor = new StalledJobJanitor(store, scheduler, fireTimes, clock);
    }

    /**
     * Open a RocksDB job store and an in-process task scheduler, both closed with the service.
     * Jobs already in the store are re-armed immediately, since in-process tasks do not survive
     * a restart.
     */
    public static CronService open(StorageConfig storage, SchedulerConfig config, FunctionRegistry functions)
            throws RocksDBException {
        RocksJobStore store = new RocksJobStore(storage);
        ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(functions, config);
        CronService service = new CronService(store, scheduler, functions,
                new CronUtilsFireTimeCalculator(config.getCronZone()), Clock.systemUTC());
        // Close the scheduler before the store so no tick runs against a closed database
        service.owned.add(scheduler);
        service.owned.add(store);
        service.sweepStalled();
        return service;
    }

    /**
     * Run {@code functionName} on a cron schedule.
     *
     * @param cronspec cron string like {@code "15 7 * * *"} (every day at 7:15 in the cron zone)
     * @return the id of the cron job
     */
    public String register(String cronspec, String functionName, Map<String, Object> args) {
        return registrar.registerCron(cronspec, functionName, args, null);
    }

    /**
     * Run {@code functionName} on a cron schedule under a unique name.
     *
     * @throws com.umitunal.qcron.exception.DuplicateNameException if the name is taken
     */
    public String registerNamed(String name, String cronspec, String functionName, Map<String, Object> args) {
        return registrar.registerCron(cronspec, functionName, args, name);
    }

    /**
     * Run {@code functionName} every {@code ms} milliseconds, {@code ms >= 1000}.
     */
    public String scheduleInterval(long ms, String functionName, Map<String, Object> args) {
        return registrar.registerInterval(ms, functionName, args, null);
    }

    /**
     * Run {@code functionName} every {@code ms} milliseconds under a unique name.
     */
    public String scheduleIntervalNamed(String name, long ms, String functionName, Map<String, Object> args) {
        return registrar.registerInterval(ms, functionName, args, name);
    }

    public List<CronJob> list() {
        return manager.list();
    }

    public Optional<CronJob> get(String jobId) {
        return manager.get(jobId);
    }

    public Optional<CronJob> getByName(String name) {
        return manager.getByName(name);
    }

    public void delete(String jobId) {
        manager.delete(jobId);
    }

    public void deleteByName(String name) {
        manager.deleteByName(name);
    }

    /**
     * Re-arm jobs whose tick chain is broken.
     *
     * @return number of jobs re-armed
     */
    public int sweepStalled() {
        return janitor.sweep();
    }

    public CronMetrics metrics() {
        return manager.metrics();
    }

    public StalledJobJanitor janitor() {
        return janitor;
    }

    @Override
    public void close() throws Exception {
        Exception failure = null;
        for (AutoCloseable resource : owned) {
            try {
                resource.close();
            } catch (Exception e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
