package com.umitunal.examples;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.scheduler.FunctionRegistry;
import com.umitunal.qcron.service.CronService;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Interval example - runs a function every second and deletes the job afterwards.
 */
public class IntervalJobExample {

    public static void main(String[] args) {
        System.out.println("=== Interval Job Example ===\n");

        AtomicInteger runs = new AtomicInteger();
        FunctionRegistry functions = new FunctionRegistry()
                .registerAction("examples:heartbeat", jobArgs ->
                        System.out.println("  heartbeat #" + runs.incrementAndGet() + " " + jobArgs));

        StorageConfig storage = StorageConfig.newBuilder("/tmp/qcron-interval").build();

        try (CronService crons = CronService.open(storage, SchedulerConfig.defaults(), functions)) {
            String jobId = crons.scheduleInterval(1000, "examples:heartbeat", Map.of("source", "interval-example"));
            System.out.println("Registered job " + jobId);

            Thread.sleep(3500);

            System.out.println("\n" + crons.metrics());
            crons.delete(jobId);
            System.out.println("Deleted job after " + runs.get() + " runs");

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
