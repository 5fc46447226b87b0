package com.umitunal.examples;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.scheduler.FunctionRegistry;
import com.umitunal.qcron.service.CronService;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Overlap example - a 2.5 second job on a 1 second interval never runs twice at once.
 */
public class OverlapExample {

    public static void main(String[] args) {
        System.out.println("=== Overlap Suppression Example ===\n");

        AtomicInteger concurrent = new AtomicInteger();
        FunctionRegistry functions = new FunctionRegistry()
                .registerAction("examples:slow", jobArgs -> {
                    System.out.println("  slow job started, concurrent runs = " + concurrent.incrementAndGet());
                    Thread.sleep(2500);
                    concurrent.decrementAndGet();
                    System.out.println("  slow job finished");
                });

        StorageConfig storage = StorageConfig.newBuilder("/tmp/qcron-overlap").build();

        try (CronService crons = CronService.open(storage, SchedulerConfig.defaults(), functions)) {
            String jobId = crons.scheduleInterval(1000, "examples:slow", Map.of());

            Thread.sleep(6500);

            crons.delete(jobId);
        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
