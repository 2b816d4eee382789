package org.task.queue.runner.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Options for a task queue instance.
 *
 * <p>Example:
 * <pre>{@code
 * QueueOptions options = QueueOptions.builder()
 *         .maxConcurrentTasks(4)
 *         .defaultTimeout(Duration.ofSeconds(30))
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class QueueOptions {

    /**
     * Whether admitting a task triggers a scheduling attempt. When disabled, {@code start()} has to
     * be called explicitly, including after the queue stopped because it ran out of tasks.
     * <p>Default: {@code true}</p>
     */
    @Builder.Default
    boolean autoStart = true;

    /**
     * Number of tasks that may be in flight at once. Extra tasks wait in the pending sequence.
     * <p>Default: {@code 1}</p>
     */
    @Builder.Default
    int maxConcurrentTasks = 1;

    /**
     * Timeout applied to tasks without their own, or {@link Duration#ZERO} to disable. A timed out
     * task keeps executing, but its slot is released and the next task may start.
     * <p>Default: {@link Duration#ZERO}</p>
     */
    @Builder.Default
    Duration defaultTimeout = Duration.ZERO;

    /**
     * When a task finishes, start the next one on the following loop tick instead of inline. This
     * lets continuations of settled task futures run before the next task starts.
     * <p>Default: {@code true}</p>
     */
    @Builder.Default
    boolean useAsyncTicking = true;

    public static QueueOptions defaults() {
        return builder().build();
    }
}
