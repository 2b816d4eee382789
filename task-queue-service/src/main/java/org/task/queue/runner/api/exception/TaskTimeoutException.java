package org.task.queue.runner.api.exception;

import java.time.Duration;

/**
 * Reported when a task did not settle within its timeout.
 *
 * <p>The queue stops tracking the task and frees its slot, but the task's own work is not
 * interrupted. Whatever it eventually produces is discarded.
 */
public class TaskTimeoutException extends TaskQueueException {

    private final Duration timeout;

    public TaskTimeoutException(Duration timeout) {
        super("Task timed out after " + timeout.toMillis() + " milliseconds");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
