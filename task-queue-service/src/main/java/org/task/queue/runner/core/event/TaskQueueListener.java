package org.task.queue.runner.core.event;

import org.task.queue.runner.core.model.QueuedTask;

/**
 * Listener for task queue and task group events. All methods have default no-op implementations.
 *
 * <p>Events are delivered synchronously on the queue's loop thread, in subscription order. For a
 * single task the sequence is always {@code onTaskStarted}, then exactly one of
 * {@code onTaskCompleted}/{@code onTaskFailed}/{@code onTaskTimedOut}, then {@code onTaskFinished}.
 *
 * @param <P> payload type
 */
public interface TaskQueueListener<P> {

    /**
     * Called when an item is admitted to an item queue, before it is dispatched. Function queues
     * and groups never emit this event.
     */
    default void onTaskAdded(QueuedTask<P> task) {}

    default void onTaskStarted(QueuedTask<P> task) {}

    default void onTaskCompleted(QueuedTask<P> task) {}

    /**
     * Called when a task exceeded its timeout and was dropped from the queue. The task's work may
     * still be running.
     */
    default void onTaskTimedOut(QueuedTask<P> task) {}

    default void onTaskFailed(Exception error, QueuedTask<P> task) {}

    /**
     * Called after the outcome event of every task.
     *
     * @param error the failure or timeout error, {@code null} if the task completed
     */
    default void onTaskFinished(Exception error, QueuedTask<P> task) {}

    /**
     * Called when the queue dispatches its first task after being idle. Queue only.
     */
    default void onStarted() {}

    /**
     * Called when the queue stops, either on request or because it ran out of tasks. Queue only.
     */
    default void onStopped() {}

    /**
     * Called when no tasks remain. For a queue, {@code onStopped} follows.
     */
    default void onFinished() {}
}
