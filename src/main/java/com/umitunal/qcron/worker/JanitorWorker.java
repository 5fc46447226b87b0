package com.umitunal.qcron.worker;

import com.umitunal.qcron.service.StalledJobJanitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background thread that runs janitor sweeps at a fixed interval.
 */
public class JanitorWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JanitorWorker.class);

    private final String workerId;
    private final StalledJobJanitor janitor;
    private final long pollInterval;
    private final AtomicBoolean running;
    private final AtomicLong sweepCount;
    private final AtomicLong rearmedCount;
    private final AtomicLong failedCount;
    private final Object sleepLock = new Object();

    private Thread workerThread;

    private JanitorWorker(Builder builder) {
        this.workerId = builder.workerId;
        this.janitor = builder.janitor;
        this.pollInterval = builder.pollInterval;
        this.running = new AtomicBoolean(false);
        this.sweepCount = new AtomicLong(0);
        this.rearmedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "JanitorWorker-" + workerId);
            workerThread.setDaemon(true);
            workerThread.start();
            log.info("Janitor worker {} started, sweeping every {} ms", workerId, pollInterval);
        }
    }

    /**
     * Stop the worker gracefully.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        synchronized (sleepLock) {
            sleepLock.notifyAll();
        }
        if (workerThread != null) {
            try {
                workerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Janitor worker {} stopped after {} sweeps", workerId, sweepCount.get());
    }

    /**
     * Run a single sweep synchronously.
     *
     * @return number of jobs re-armed
     */
    public int sweepOnce() {
        int rearmed = janitor.sweep();
        sweepCount.incrementAndGet();
        rearmedCount.addAndGet(rearmed);
        return rearmed;
    }

    private void run() {
        while (running.get()) {
            try {
                sweepOnce();
            } catch (RuntimeException e) {
                failedCount.incrementAndGet();
                log.error("Janitor worker {} sweep failed", workerId, e);
            }

            try {
                synchronized (sleepLock) {
                    if (running.get()) {
                        sleepLock.wait(pollInterval);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    public String getWorkerId() { return workerId; }
    public long getSweepCount() { return sweepCount.get(); }
    public long getRearmedCount() { return rearmedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(String workerId, StalledJobJanitor janitor) {
        return new Builder(workerId, janitor);
    }

    public static class Builder {
        private final String workerId;
        private final StalledJobJanitor janitor;
        private long pollInterval = 60000; // 1 minute

        private Builder(String workerId, StalledJobJanitor janitor) {
            this.workerId = workerId;
            this.janitor = janitor;
        }

        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public JanitorWorker build() {
            return new JanitorWorker(this);
        }
    }
}
