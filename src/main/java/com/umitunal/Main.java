package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all qcron examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== qcron Examples ===\n");

        IntervalJobExample.main(args);
        NamedCronJobExample.main(args);
        OverlapExample.main(args);
        RecoveryExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
