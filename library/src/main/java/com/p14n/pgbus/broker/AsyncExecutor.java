package com.p14n.pgbus.broker;

import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the bus's periodic tasks: the watchdog and the retention reaper.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules a task for repeated fixed-rate execution.
     *
     * @param command      The task to execute
     * @param initialDelay The time to delay first execution
     * @param period       The period between successive executions
     * @param unit         The time unit of the initialDelay and period parameters
     * @return A ScheduledFuture representing pending completion of the task
     */
    ScheduledFuture<?> scheduleAtFixedRate(Runnable command,
            long initialDelay,
            long period,
            TimeUnit unit);

    /**
     * Stops immediately, interrupting running tasks.
     *
     * @return tasks that never ran
     */
    List<Runnable> shutdownNow();

}
