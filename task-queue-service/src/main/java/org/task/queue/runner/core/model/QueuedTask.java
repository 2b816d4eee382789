package org.task.queue.runner.core.model;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caller-visible handle of an admitted task, carried by every task event.
 *
 * <p>The {@code id} is unique within the process, so two tasks with equal payloads are still told
 * apart. Task groups track their tasks by this id.
 *
 * @param id      unique task id
 * @param payload the queued item, or the task itself for function queues
 * @param options the options the task was admitted with
 * @param <P>     payload type
 */
public record QueuedTask<P>(long id, P payload, TaskOptions options) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public QueuedTask {
        Objects.requireNonNull(payload, "Task payload cannot be null");
        Objects.requireNonNull(options, "Task options cannot be null");
    }

    /**
     * Creates a handle with the next task id.
     */
    public static <P> QueuedTask<P> next(P payload, TaskOptions options) {
        return new QueuedTask<>(SEQUENCE.incrementAndGet(), payload, options != null ? options : TaskOptions.DEFAULT);
    }
}
