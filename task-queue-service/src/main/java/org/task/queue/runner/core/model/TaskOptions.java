package org.task.queue.runner.core.model;

import java.time.Duration;

/**
 * Options for a single task.
 *
 * @param timeout        how long to wait for the task before abandoning it; {@code null} falls back
 *                       to the queue's default timeout and {@link Duration#ZERO} disables the timeout
 * @param runImmediately put the task at the front of the pending sequence and let it start even if
 *                       the queue is already running {@code maxConcurrentTasks} tasks
 */
public record TaskOptions(Duration timeout, boolean runImmediately) {

    /** No timeout override, normal FIFO admission. */
    public static final TaskOptions DEFAULT = new TaskOptions(null, false);

    public TaskOptions {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("Task timeout cannot be negative: " + timeout);
        }
    }

    public static TaskOptions immediate() {
        return new TaskOptions(null, true);
    }

    public static TaskOptions withTimeout(Duration timeout) {
        return new TaskOptions(timeout, false);
    }

    /**
     * Resolves the timeout that applies to the task.
     *
     * @param defaultTimeout the queue's default timeout
     * @return the per-task override if set, otherwise {@code defaultTimeout}
     */
    public Duration effectiveTimeout(Duration defaultTimeout) {
        return timeout != null ? timeout : defaultTimeout;
    }
}
