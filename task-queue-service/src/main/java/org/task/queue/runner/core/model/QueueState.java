package org.task.queue.runner.core.model;

/**
 * Lifecycle state of a task queue.
 *
 * <ul>
 *   <li>{@link #IDLE} - nothing dispatched since the last shutdown finalisation</li>
 *   <li>{@link #RUNNING} - at least one task has been dispatched and the queue has not drained</li>
 *   <li>{@link #STOPPING} - a graceful stop was requested, waiting for running tasks</li>
 * </ul>
 */
public enum QueueState {
    IDLE,
    RUNNING,
    STOPPING
}
