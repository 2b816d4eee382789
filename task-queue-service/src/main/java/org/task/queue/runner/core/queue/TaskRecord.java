package org.task.queue.runner.core.queue;

import lombok.AccessLevel;
import lombok.Getter;
import org.task.queue.runner.core.model.QueuedTask;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Internal bookkeeping for one admitted task.
 *
 * <p>Wraps the caller-visible {@link QueuedTask} with the state the queue needs while the task is
 * pending and in flight: the optional completion future handed out by {@code pushAsync}, timing
 * metadata and the finished flag that guarantees a single outcome per task.
 *
 * @param <P> payload type
 */
@Getter
class TaskRecord<P> {

    /** The task handle carried by every event for this task */
    private final QueuedTask<P> task;

    /** Future returned by {@code pushAsync}, or null for {@code push} */
    private final CompletableFuture<Void> completion;

    /** Timestamp when the task was admitted */
    private final LocalDateTime queuedAt;

    /** Nanotime of dispatch, 0 while pending */
    private volatile long startedAtNanos;

    /** Set by whichever of timer, result or failure determines the outcome first */
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean finished = new AtomicBoolean(false);

    TaskRecord(QueuedTask<P> task, CompletableFuture<Void> completion) {
        if (task == null) {
            throw new NullPointerException("Task cannot be null");
        }
        this.task = task;
        this.completion = completion;
        this.queuedAt = LocalDateTime.now();
    }

    long getId() {
        return task.id();
    }

    void markStarted() {
        startedAtNanos = System.nanoTime();
    }

    /**
     * Claims the right to finish this task.
     *
     * @return true if THIS call determined the outcome, false if the task was already finished
     */
    boolean markFinished() {
        return finished.compareAndSet(false, true);
    }

    boolean isFinished() {
        return finished.get();
    }

    /**
     * @return milliseconds between admission and now
     */
    long getQueuedMillis() {
        return Duration.between(queuedAt, LocalDateTime.now()).toMillis();
    }

    /**
     * @return milliseconds since dispatch, or 0 if the task never started
     */
    long getElapsedMillis() {
        long started = startedAtNanos;
        return started == 0 ? 0 : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }

    /**
     * Settles the completion future, if one was requested.
     *
     * @param error the task error, or null on success
     */
    void settle(Exception error) {
        if (completion == null) {
            return;
        }
        if (error == null) {
            completion.complete(null);
        } else {
            completion.completeExceptionally(error);
        }
    }
}
