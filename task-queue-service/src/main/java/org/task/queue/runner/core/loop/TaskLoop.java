package org.task.queue.runner.core.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single logical thread of control shared by a task queue and its groups.
 *
 * <p>All queue bookkeeping (pending sequence, slot counts, timers, group sets) is mutated only from
 * this loop, so none of it needs locking. Callers on other threads are marshalled onto the loop in
 * submission order; callers already on the loop run inline.
 *
 * <p>The loop also provides the two other suspension points a queue needs: deferring work to the
 * next tick ({@link #execute(Runnable)}) and timers ({@link #schedule(Runnable, Duration)}).
 */
public class TaskLoop implements Executor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TaskLoop.class);

    public static final String DEFAULT_THREAD_NAME = "TaskLoop";
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String name;
    private final Duration shutdownTimeout;
    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    public TaskLoop() {
        this(DEFAULT_THREAD_NAME);
    }

    public TaskLoop(String threadName) {
        this(threadName, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * @param threadName      name of the loop thread
     * @param shutdownTimeout how long {@link #close()} waits for queued loop work before forcing
     *                        the executor down
     */
    public TaskLoop(String threadName, Duration shutdownTimeout) {
        this.name = Objects.requireNonNull(threadName, "Thread name cannot be null");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "Shutdown timeout cannot be null");

        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);  // Abandoned task work must not keep the JVM alive
            loopThread = thread;
            return thread;
        });
        // Disarmed task timeouts are dropped from the work queue right away
        this.executor.setRemoveOnCancelPolicy(true);
    }

    /**
     * @return {@code true} if the calling thread is this loop's thread
     */
    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Runs the action on the next loop tick, after everything already submitted.
     *
     * @throws RejectedExecutionException if the loop has been closed
     */
    @Override
    public void execute(Runnable action) {
        Objects.requireNonNull(action, "Action cannot be null");
        executor.execute(() -> runSafely(action));
    }

    /**
     * Runs the action inline when called on the loop, otherwise on the next tick.
     */
    public void runInLoop(Runnable action) {
        if (inLoop()) {
            action.run();
        } else {
            execute(action);
        }
    }

    /**
     * Like {@link #execute(Runnable)}, but a closed loop drops the action with a warning instead of
     * throwing. Used for continuations of work that may outlive the loop.
     *
     * @return {@code true} if the action was accepted
     */
    public boolean post(Runnable action) {
        try {
            execute(action);
            return true;
        } catch (RejectedExecutionException e) {
            logger.warn("{} is closed, dropping loop action", name);
            return false;
        }
    }

    /**
     * Runs the action inline when called on the loop, otherwise {@link #post(Runnable) posts} it.
     */
    public void runInLoopOrPost(Runnable action) {
        if (inLoop()) {
            action.run();
        } else {
            post(action);
        }
    }

    /**
     * Evaluates the supplier on the loop and completes the returned future with its value.
     */
    public <T> CompletableFuture<T> supply(Supplier<T> supplier) {
        if (inLoop()) {
            return CompletableFuture.completedFuture(supplier.get());
        }
        return CompletableFuture.supplyAsync(supplier, this);
    }

    /**
     * Evaluates an action that itself produces a future on the loop. Called on the loop, the
     * action's own future is returned unchanged; otherwise a future that settles with it.
     */
    public <T> CompletableFuture<T> callInLoop(Supplier<CompletableFuture<T>> action) {
        if (inLoop()) {
            return action.get();
        }
        return CompletableFuture.supplyAsync(action, this).thenCompose(Function.identity());
    }

    /**
     * Runs the action on the loop once the delay has elapsed.
     */
    public ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        return executor.schedule(() -> runSafely(action), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /**
     * Shuts the loop down. Pending timers are dropped; already submitted actions get up to the
     * shutdown timeout to run before the executor is forced down.
     */
    @Override
    public void close() {
        if (executor.isShutdown()) {
            return;
        }

        logger.info("Shutting down {}...", name);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.shutdown();

        // Waiting from the loop thread itself would only wait out the timeout
        if (inLoop()) {
            return;
        }

        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("{} did not terminate within {}ms, forcing shutdown", name, shutdownTimeout.toMillis());
                executor.shutdownNow();
            }
            logger.info("{} shut down", name);
        } catch (InterruptedException e) {
            logger.warn("{} shutdown interrupted, forcing immediate shutdown", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runSafely(Runnable action) {
        try {
            action.run();
        } catch (VirtualMachineError e) {
            logger.error("Fatal error on {}", name, e);
            throw e;
        } catch (Throwable e) {
            // The executor would swallow it silently
            logger.error("Unhandled exception on {}", name, e);
        }
    }
}
