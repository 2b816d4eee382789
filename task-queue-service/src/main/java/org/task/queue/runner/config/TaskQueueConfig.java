package org.task.queue.runner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.task.queue.runner.core.loop.TaskLoop;
import org.task.queue.runner.core.model.QueueOptions;

import java.time.Duration;

/**
 * Configuration properties for the task queue.
 * <p>
 * This class is bound to properties with the prefix {@code task.queue}
 * from the application configuration (e.g., {@code application.yml} or {@code application.properties}).
 * </p>
 *
 * <p>Example configuration in {@code application.yml}:</p>
 * <pre>{@code
 * task:
 *   queue:
 *     auto-start: true
 *     max-concurrent-tasks: 5
 *     default-timeout-millis: 30000
 *     use-async-ticking: true
 *     loop-thread-name: TaskLoop
 *     shutdown-timeout-seconds: 5
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "task.queue")
public class TaskQueueConfig {

    /**
     * Whether pushing a task immediately tries to start it.
     * <p>Default: {@code true}</p>
     */
    private boolean autoStart = true;

    /**
     * Maximum number of tasks allowed to run concurrently.
     * <p>Default: {@code 1}</p>
     */
    private int maxConcurrentTasks = 1;

    /**
     * Timeout (in milliseconds) for tasks that do not set their own, {@code 0} to disable.
     * <p>Default: {@code 0}</p>
     */
    private long defaultTimeoutMillis = 0;

    /**
     * Whether the next task starts on the following loop tick after one finishes.
     * <p>Default: {@code true}</p>
     */
    private boolean useAsyncTicking = true;

    /**
     * Name of the loop thread.
     * <p>Default: {@code TaskLoop}</p>
     */
    private String loopThreadName = TaskLoop.DEFAULT_THREAD_NAME;

    /**
     * Timeout (in seconds) to wait for queued loop work when the
     * application shuts down.
     * <p>Default: {@code 5}</p>
     */
    private int shutdownTimeoutSeconds = (int) TaskLoop.DEFAULT_SHUTDOWN_TIMEOUT.toSeconds();

    public QueueOptions toQueueOptions() {
        return QueueOptions.builder()
                .autoStart(autoStart)
                .maxConcurrentTasks(maxConcurrentTasks)
                .defaultTimeout(Duration.ofMillis(defaultTimeoutMillis))
                .useAsyncTicking(useAsyncTicking)
                .build();
    }
}
