package com.umitunal.qcron.scheduler;

import com.umitunal.qcron.core.ScheduledTask;

import java.util.Map;

/**
 * A function that a task scheduler can invoke by name.
 */
@FunctionalInterface
public interface ScheduledFunction {

    /**
     * Run the function.
     *
     * @param args arguments the task was scheduled with
     * @throws Exception if the invocation fails; the task is then marked FAILED
     */
    void invoke(Map<String, Object> args) throws Exception;

    /**
     * Run the function for a firing task. Schedulers call this form; functions that need
     * their own task handle override it.
     */
    default void invoke(ScheduledTask task) throws Exception {
        invoke(task.getArgs());
    }

    /**
     * How a task's state is reported while the function executes.
     */
    enum Kind {
        /**
         * Transactional function: its task stays PENDING until the function returns.
         */
        MUTATION,
        /**
         * Side-effecting function of unbounded duration: its task is RUNNING while it executes.
         */
        ACTION
    }
}
