package org.task.queue.runner.api.exception;

/**
 * Base class for the errors a task queue reports through task events and task futures.
 *
 * <p>These are never thrown out of the queue's public operations; a failing or timed out task only
 * shows up in {@code onTaskFailed}/{@code onTaskFinished} and in the future returned by
 * {@code pushAsync}.
 */
public abstract class TaskQueueException extends RuntimeException {

    protected TaskQueueException(String message) {
        super(message);
    }

    protected TaskQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
