package org.task.queue.runner.api.exception;

/**
 * Wraps a task failure whose cause is not an {@link Exception}, so that task errors can always be
 * reported as exceptions.
 */
public class TaskFailedException extends TaskQueueException {

    public TaskFailedException(Throwable cause) {
        super("Task failed: " + cause, cause);
    }
}
