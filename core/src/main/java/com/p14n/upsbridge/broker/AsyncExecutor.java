package com.p14n.upsbridge.broker;

import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Interface for delayed task execution.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules a one-shot task.
     *
     * @param command The task to execute
     * @param delay   The time to delay execution
     * @param unit    The time unit of the delay parameter
     * @return A ScheduledFuture representing pending completion of the task
     */
    ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit);

    /**
     * Shuts down the executor and returns a list of runnables that were not
     * executed.
     *
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    @Override
    default void close() {
        shutdownNow();
    }
}
