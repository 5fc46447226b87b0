package com.umitunal.qcron.core;

import java.util.Map;

/**
 * A single-shot invocation managed by a {@link TaskScheduler}.
 */
public interface ScheduledTask {

    /**
     * Gets the opaque task handle.
     */
    String getId();

    /**
     * Gets the name of the function this task invokes.
     */
    String getFunctionName();

    /**
     * Gets the arguments passed to the function.
     */
    Map<String, Object> getArgs();

    /**
     * Gets the time the task was scheduled for, in milliseconds since epoch.
     */
    long getScheduledTime();

    /**
     * Gets the current execution state.
     */
    TaskState getState();

    /**
     * Possible execution states for a scheduled task.
     */
    enum TaskState {
        PENDING,     // Waiting for its time, or executing as a transactional function
        RUNNING,     // Executing as a non-transactional function
        COMPLETED,   // Returned normally
        FAILED,      // Threw, or named an unknown function
        CANCELED;    // Canceled before completion

        public boolean isOutstanding() {
            return this == PENDING || this == RUNNING;
        }

        public boolean isTerminal() {
            return !isOutstanding();
        }
    }
}
