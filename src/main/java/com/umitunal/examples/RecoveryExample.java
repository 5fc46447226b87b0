package com.umitunal.examples;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.scheduler.FunctionRegistry;
import com.umitunal.qcron.service.CronService;

import java.util.Map;

/**
 * Recovery example - jobs survive a restart; the janitor re-arms them on open.
 */
public class RecoveryExample {

    public static void main(String[] args) {
        System.out.println("=== Recovery Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/qcron-recovery").build();

        // Simulate first run
        try (CronService crons = CronService.open(storage, SchedulerConfig.defaults(), registry())) {
            if (crons.getByName("recovered").isEmpty()) {
                crons.scheduleIntervalNamed("recovered", 1000, "examples:recovered", Map.of("phase", "after restart"));
            }
            System.out.println("Registered job, shutting down before it fires");
        } catch (Exception e) {
            e.printStackTrace();
        }

        // Simulate restart
        try (CronService crons = CronService.open(storage, SchedulerConfig.defaults(), registry())) {
            System.out.println("Reopened: " + crons.metrics());

            Thread.sleep(2500);

            crons.deleteByName("recovered");
        } catch (Exception e) {
            e.printStackTrace();
        }
    }

    private static FunctionRegistry registry() {
        return new FunctionRegistry()
                .registerAction("examples:recovered", jobArgs -> System.out.println("  fired " + jobArgs));
    }
}
