package com.umitunal.qcron.core;

import java.util.Map;
import java.util.Optional;

/**
 * Primitive that runs a named function once at or after a given time.
 * Every scheduled task fires at most once and independently of the others.
 *
 * Tasks scheduled from inside a store transaction are reserved first and released once the
 * transaction commits, so a task never observes the state from before its own scheduling
 * committed. A reserved task is PENDING and can be canceled, but does not start until
 * {@link #release(String)}.
 */
public interface TaskScheduler {

    /**
     * Reserve a task for the given time without letting it start.
     *
     * @param timeMillis when the task should run (millis since epoch)
     * @param functionName name of the function to invoke
     * @param args arguments for the function
     * @return the task handle
     */
    String reserveAt(long timeMillis, String functionName, Map<String, Object> args);

    /**
     * Let a reserved task start. A task whose time has passed starts immediately.
     * Releasing a canceled, unknown or already released task is a no-op.
     */
    void release(String taskId);

    /**
     * Current time as seen by this scheduler.
     */
    long currentTimeMillis();

    /**
     * Schedule a function to run at the given time.
     *
     * @return the task handle
     */
    default String scheduleAt(long timeMillis, String functionName, Map<String, Object> args) {
        String taskId = reserveAt(timeMillis, functionName, args);
        release(taskId);
        return taskId;
    }

    /**
     * Schedule a function to run after a delay. A delay of zero means "as soon as possible".
     *
     * @return the task handle
     */
    default String scheduleAfter(long delayMillis, String functionName, Map<String, Object> args) {
        return scheduleAt(currentTimeMillis() + Math.max(0, delayMillis), functionName, args);
    }

    /**
     * Reserve a task that runs after a delay once released.
     */
    default String reserveAfter(long delayMillis, String functionName, Map<String, Object> args) {
        return reserveAt(currentTimeMillis() + Math.max(0, delayMillis), functionName, args);
    }

    /**
     * Cancel a task. Canceling a task that already finished, or an unknown handle, is a no-op.
     * A task that is already executing may still run to completion.
     */
    void cancel(String taskId);

    /**
     * Look up a task by handle.
     *
     * @return the task, or empty if the scheduler has no record of it
     */
    Optional<ScheduledTask> getTask(String taskId);

    /**
     * Get the current state of a task.
     *
     * @return the state, or empty if the scheduler has no record of the task
     */
    default Optional<ScheduledTask.TaskState> getStatus(String taskId) {
        return getTask(taskId).map(ScheduledTask::getState);
    }
}
