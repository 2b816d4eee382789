package org.task.queue.runner.core.model;

/**
 * How a dispatched task ended. Exactly one outcome is determined per task.
 */
public enum TaskOutcome {
    COMPLETED,
    FAILED,
    TIMED_OUT
}
