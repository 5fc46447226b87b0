package com.umitunal.qcron.scheduler;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.core.ScheduledTask;
import com.umitunal.qcron.core.ScheduledTask.TaskState;
import com.umitunal.qcron.core.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process TaskScheduler backed by a ScheduledExecutorService.
 *
 * Tasks are held in memory only and are lost on shutdown; finished tasks stay queryable for
 * the configured retention period. Functions are resolved by name through a
 * {@link FunctionRegistry} when the task fires, so an unknown name fails the task rather than
 * the scheduling call.
 *
 * Mutations run on the fixed timer pool. Actions have unbounded duration and are handed to a
 * separate cached pool, so slow actions never hold up mutations that are due.
 */
public class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final FunctionRegistry functions;
    private final Clock clock;
    private final long retentionMillis;
    private final ScheduledExecutorService executor;
    private final ExecutorService actionExecutor;
    private final ConcurrentMap<String, TaskEntry> tasks = new ConcurrentHashMap<>();

    public ExecutorTaskScheduler(FunctionRegistry functions, SchedulerConfig config) {
        this(functions, config, Clock.systemUTC());
    }

    public ExecutorTaskScheduler(FunctionRegistry functions, SchedulerConfig config, Clock clock) {
        this.functions = functions;
        this.clock = clock;
        this.retentionMillis = config.getTaskRetentionMillis();
        this.executor = Executors.newScheduledThreadPool(config.getSchedulerThreads(),
                new NamedThreadFactory("TaskScheduler-"));
        this.actionExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("TaskAction-"));

        long sweepEvery = Math.max(1000, retentionMillis / 4);
        executor.scheduleWithFixedDelay(this::purgeExpired, sweepEvery, sweepEvery, TimeUnit.MILLISECONDS);
    }

    @Override
    public String reserveAt(long timeMillis, String functionName, Map<String, Object> args) {
        TaskEntry entry = new TaskEntry(UUID.randomUUID().toString(), functionName, args, timeMillis);
        tasks.put(entry.id, entry);
        log.debug("Reserved task {} for {} at {}", entry.id, functionName, timeMillis);
        return entry.id;
    }

    @Override
    public void release(String taskId) {
        TaskEntry entry = tasks.get(taskId);
        if (entry == null || !entry.markReleased()) {
            return;
        }
        long delay = Math.max(0, entry.scheduledTime - clock.millis());
        entry.future = executor.schedule(() -> run(entry), delay, TimeUnit.MILLISECONDS);
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    @Override
    public void cancel(String taskId) {
        TaskEntry entry = tasks.get(taskId);
        if (entry == null) {
            return;
        }
        if (entry.cancel(clock.millis())) {
            ScheduledFuture<?> future = entry.future;
            if (future != null) {
                future.cancel(false);
            }
            log.debug("Canceled task {} ({})", taskId, entry.functionName);
        }
    }

    @Override
    public Optional<ScheduledTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Number of tasks currently known, finished ones included.
     */
    public int size() {
        return tasks.size();
    }

    /**
     * Forget finished tasks older than the retention period.
     *
     * @return number of tasks removed
     */
    public int purgeExpired() {
        long cutoff = clock.millis() - retentionMillis;
        int purged = 0;
        for (TaskEntry entry : tasks.values()) {
            if (entry.isFinishedBefore(cutoff) && tasks.remove(entry.id, entry)) {
                purged++;
            }
        }
        if (purged > 0) {
            log.debug("Purged {} finished tasks", purged);
        }
        return purged;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        actionExecutor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)
                    || !actionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Task scheduler threads did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void run(TaskEntry entry) {
        Optional<FunctionRegistry.Registration> registration = functions.resolve(entry.functionName);
        if (registration.isEmpty()) {
            log.error("Task {} names unknown function {}", entry.id, entry.functionName);
            entry.finish(TaskState.FAILED, clock.millis());
            return;
        }
        if (registration.get().getKind() == ScheduledFunction.Kind.ACTION) {
            actionExecutor.execute(() -> execute(entry, registration.get()));
        } else {
            execute(entry, registration.get());
        }
    }

    private void execute(TaskEntry entry, FunctionRegistry.Registration registration) {
        if (!entry.start(registration.getKind())) {
            return; // canceled before it fired
        }

        try {
            registration.getFunction().invoke(entry);
            entry.finish(TaskState.COMPLETED, clock.millis());
        } catch (Exception e) {
            log.error("Task {} ({}) failed", entry.id, entry.functionName, e);
            entry.finish(TaskState.FAILED, clock.millis());
        }
    }

    /**
     * Mutable task state. Transitions are guarded by the entry's monitor.
     */
    private static final class TaskEntry implements ScheduledTask {
        private final String id;
        private final String functionName;
        private final Map<String, Object> args;
        private final long scheduledTime;

        private TaskState state = TaskState.PENDING;
        private boolean released;
        private long finishedAt;
        private volatile ScheduledFuture<?> future;

        TaskEntry(String id, String functionName, Map<String, Object> args, long scheduledTime) {
            this.id = id;
            this.functionName = functionName;
            this.args = args == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(args));
            this.scheduledTime = scheduledTime;
        }

        @Override public String getId() { return id; }
        @Override public String getFunctionName() { return functionName; }
        @Override public Map<String, Object> getArgs() { return args; }
        @Override public long getScheduledTime() { return scheduledTime; }

        @Override
        public synchronized TaskState getState() {
            return state;
        }

        synchronized boolean markReleased() {
            if (released || state != TaskState.PENDING) {
                return false;
            }
            released = true;
            return true;
        }

        synchronized boolean start(ScheduledFunction.Kind kind) {
            if (state != TaskState.PENDING) {
                return false;
            }
            if (kind == ScheduledFunction.Kind.ACTION) {
                state = TaskState.RUNNING;
            }
            return true;
        }

        synchronized void finish(TaskState outcome, long now) {
            if (state.isTerminal()) {
                return; // canceled while executing; keep CANCELED
            }
            state = outcome;
            finishedAt = now;
        }

        synchronized boolean cancel(long now) {
            if (state.isTerminal()) {
                return false;
            }
            state = TaskState.CANCELED;
            finishedAt = now;
            return true;
        }

        synchronized boolean isFinishedBefore(long cutoff) {
            return state.isTerminal() && finishedAt < cutoff;
        }

        @Override
        public String toString() {
            return String.format("Task{id='%s', function='%s', scheduled=%d, state=%s}",
                    id, functionName, scheduledTime, getState());
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
