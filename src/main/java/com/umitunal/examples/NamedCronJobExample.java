package com.umitunal.examples;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.exception.DuplicateNameException;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.scheduler.FunctionRegistry;
import com.umitunal.qcron.service.CronService;

import java.util.Map;

/**
 * Named cron example - idempotent registration by name, listing and deletion by name.
 */
public class NamedCronJobExample {

    public static void main(String[] args) {
        System.out.println("=== Named Cron Job Example ===\n");

        FunctionRegistry functions = new FunctionRegistry()
                .registerAction("examples:tick", jobArgs -> System.out.println("  cron fired: " + jobArgs.get("message")));

        StorageConfig storage = StorageConfig.newBuilder("/tmp/qcron-named").build();

        try (CronService crons = CronService.open(storage, SchedulerConfig.defaults(), functions)) {

            // Register once; a second run of this example finds the job already there
            if (crons.getByName("every-two-seconds").isEmpty()) {
                crons.registerNamed("every-two-seconds", "*/2 * * * * *", "examples:tick",
                        Map.of("message", "six-field cron with seconds"));
            }

            try {
                crons.registerNamed("every-two-seconds", "*/2 * * * * *", "examples:tick", Map.of());
            } catch (DuplicateNameException e) {
                System.out.println("Second registration rejected: " + e.getMessage());
            }

            for (CronJob job : crons.list()) {
                System.out.println("Registered: " + job);
            }

            Thread.sleep(5000);

            crons.deleteByName("every-two-seconds");
            System.out.println("Deleted. Remaining jobs: " + crons.list().size());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
