package org.task.queue.runner.core.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.task.queue.runner.api.exception.TaskFailedException;
import org.task.queue.runner.api.exception.TaskTimeoutException;
import org.task.queue.runner.core.event.ListenerRegistration;
import org.task.queue.runner.core.event.TaskEventEmitter;
import org.task.queue.runner.core.event.TaskQueueListener;
import org.task.queue.runner.core.loop.TaskLoop;
import org.task.queue.runner.core.model.QueueOptions;
import org.task.queue.runner.core.model.QueueState;
import org.task.queue.runner.core.model.QueuedTask;
import org.task.queue.runner.core.model.TaskOptions;
import org.task.queue.runner.core.model.TaskOutcome;
import org.task.queue.runner.core.processor.TaskInvoker;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency task queue with per-task timeouts, a priority bypass and graceful shutdown.
 *
 * <p>The queue executes at most {@link QueueOptions#getMaxConcurrentTasks()} tasks at a time.
 * "Concurrency" means overlapping in-flight asynchronous work: every task is invoked on the queue's
 * {@link TaskLoop} thread and all bookkeeping happens there too. Public operations may be called
 * from any thread; calls from other threads are marshalled onto the loop in call order.
 *
 * <p>Task lifecycle:
 * <ul>
 *   <li><b>Admission:</b> the task enters the pending sequence, at the front if it is
 *       {@code runImmediately}, otherwise at the back</li>
 *   <li><b>Dispatch:</b> the slot count goes up, {@code taskStarted} is emitted, the timeout timer
 *       is armed and the task is invoked</li>
 *   <li><b>Outcome:</b> the first of timer, result or failure wins; the slot is released and
 *       {@code taskTimedOut}/{@code taskFailed}/{@code taskCompleted} then {@code taskFinished}
 *       are emitted before the task's future settles</li>
 * </ul>
 *
 * <p>Timeouts never interrupt a task. The queue only stops tracking it; the abandoned work keeps
 * running and its eventual result is discarded, so tasks with timeouts should be idempotent or
 * cancel themselves.
 *
 * <p>The two shapes, {@link ItemQueue} and {@link FunctionQueue}, only differ in their
 * {@link TaskInvoker} and in whether admissions are announced.
 *
 * @param <P> payload type
 */
public abstract class TaskQueue<P> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TaskQueue.class);

    /** Options the queue was created with */
    private final QueueOptions options;

    /** Turns a payload into running work */
    private final TaskInvoker<P> invoker;

    /** Single logical thread owning all state below */
    private final TaskLoop loop;

    /** Whether {@link #close()} also closes the loop */
    private final boolean ownsLoop;

    /** Subscribers of this queue's events */
    private final TaskEventEmitter<P> events;

    /** Tasks waiting for a slot, front first */
    private final BlockingDeque<TaskRecord<P>> pending = new LinkedBlockingDeque<>();

    /** Number of dispatched tasks whose outcome is not determined yet */
    private final AtomicInteger runningCount = new AtomicInteger(0);

    /** Armed timeouts of in-flight tasks */
    private final Map<TaskRecord<P>, ScheduledFuture<?>> activeTimers = new HashMap<>();

    private volatile QueueState state = QueueState.IDLE;

    /** Settles when the current run finalises; shared by startAsync and stopAsync */
    private CompletableFuture<Void> stopFuture;

    /**
     * @param invoker strategy invoking a dispatched payload
     * @param options queue options, defaults if null
     * @param loop    loop to run on, or null to create one owned by this queue
     */
    protected TaskQueue(TaskInvoker<P> invoker, QueueOptions options, TaskLoop loop) {
        this.invoker = Objects.requireNonNull(invoker, "Task invoker cannot be null");
        this.options = options != null ? options : QueueOptions.defaults();
        validateOptions(this.options);

        this.ownsLoop = loop == null;
        this.loop = loop != null ? loop : new TaskLoop();
        this.events = new TaskEventEmitter<>(getClass().getSimpleName());

        logger.debug("{} created - Max concurrent tasks: {}, Default timeout: {}ms, Auto start: {}, Async ticking: {}",
                getClass().getSimpleName(), this.options.getMaxConcurrentTasks(),
                this.options.getDefaultTimeout().toMillis(), this.options.isAutoStart(),
                this.options.isUseAsyncTicking());
    }

    /**
     * Adds a task to the queue.
     *
     * @param payload the item to process, or the task to run
     * @return handle identifying the task in events
     */
    public QueuedTask<P> push(P payload) {
        return push(payload, TaskOptions.DEFAULT);
    }

    /**
     * Adds a task to the queue with custom options.
     *
     * @param payload the item to process, or the task to run
     * @param options options for this task only
     * @return handle identifying the task in events
     */
    public QueuedTask<P> push(P payload, TaskOptions options) {
        TaskRecord<P> record = newRecord(payload, options, null);
        admit(record);
        return record.getTask();
    }

    /**
     * Adds a task to the queue and returns a future tracking it.
     *
     * @param payload the item to process, or the task to run
     * @return future that completes when the task completes, or completes exceptionally with the
     *         task's error, or a {@link TaskTimeoutException} if it timed out
     */
    public CompletableFuture<Void> pushAsync(P payload) {
        return pushAsync(payload, TaskOptions.DEFAULT);
    }

    /**
     * Adds a task with custom options and returns a future tracking it.
     *
     * @see #pushAsync(Object)
     */
    public CompletableFuture<Void> pushAsync(P payload, TaskOptions options) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        admit(newRecord(payload, options, completion));
        return completion;
    }

    /**
     * Attempts to dispatch the next pending task.
     *
     * <p>A single call dispatches at most one task. When all slots are taken, only a
     * {@code runImmediately} task at the front of the pending sequence is dispatched.
     */
    public void start() {
        loop.runInLoop(this::startInLoop);
    }

    /**
     * Starts the queue and returns a future that settles once it stops. If a run is already being
     * awaited, its future is returned.
     */
    public CompletableFuture<Void> startAsync() {
        return loop.callInLoop(this::startAsyncInLoop);
    }

    /**
     * Requests a graceful stop: running tasks are allowed to finish, nothing new is dispatched.
     * Does nothing if the queue is idle.
     */
    public void stop() {
        loop.runInLoop(this::stopInLoop);
    }

    /**
     * Requests a graceful stop and returns a future that settles once the queue has stopped.
     * Repeated calls while a stop is outstanding return the same future; an idle queue returns an
     * already completed one.
     */
    public CompletableFuture<Void> stopAsync() {
        return loop.callInLoop(this::stopAsyncInLoop);
    }

    /**
     * Returns a future that completes once all tasks are done, immediately if there are none.
     */
    public CompletableFuture<Void> getCompletionFuture() {
        return loop.callInLoop(() -> CompletionFutures.whenFinished(this::getLength, events));
    }

    /**
     * Creates a group for tracking a subset of this queue's tasks. Groups share this queue's slots
     * and emit events only for their own tasks; the queue keeps emitting events for all tasks.
     */
    public QueueGroup<P> createGroup() {
        return new QueueGroup<>(this);
    }

    public ListenerRegistration addListener(TaskQueueListener<P> listener) {
        return events.addListener(listener);
    }

    public boolean removeListener(TaskQueueListener<P> listener) {
        return events.removeListener(listener);
    }

    /**
     * @return number of pending and running tasks
     */
    public int getLength() {
        return pending.size() + runningCount.get();
    }

    public int getRunningCount() {
        return runningCount.get();
    }

    public int getPendingCount() {
        return pending.size();
    }

    public boolean isRunning() {
        return state != QueueState.IDLE;
    }

    public boolean isStopping() {
        return state == QueueState.STOPPING;
    }

    public QueueState getState() {
        return state;
    }

    public QueueOptions getOptions() {
        return options;
    }

    public TaskLoop getLoop() {
        return loop;
    }

    /**
     * Closes the queue's own loop, if it created one. Pending tasks are never dispatched and
     * in-flight tasks are abandoned without events.
     */
    @Override
    public void close() {
        logger.info("Closing {} - Running: {}, Pending: {}", getClass().getSimpleName(),
                runningCount.get(), pending.size());
        if (ownsLoop) {
            loop.close();
        }
    }

    /**
     * Hook invoked on the loop after a task entered the pending sequence, before any scheduling
     * attempt.
     */
    protected void onAdmitted(QueuedTask<P> task) {
    }

    protected TaskEventEmitter<P> getEvents() {
        return events;
    }

    TaskRecord<P> newRecord(P payload, TaskOptions options, CompletableFuture<Void> completion) {
        return new TaskRecord<>(QueuedTask.next(payload, options), completion);
    }

    /**
     * Hands a record to the loop for admission.
     */
    void admit(TaskRecord<P> record) {
        loop.runInLoop(() -> enqueue(record));
    }

    private void enqueue(TaskRecord<P> record) {
        QueuedTask<P> task = record.getTask();

        // start() only ever looks at the front, so immediate tasks go there
        if (task.options().runImmediately()) {
            pending.addFirst(record);
        } else {
            pending.addLast(record);
        }
        logger.debug("Task {} queued - Pending: {}, Running: {}, Immediate: {}",
                task.id(), pending.size(), runningCount.get(), task.options().runImmediately());

        onAdmitted(task);

        if (options.isAutoStart()) {
            startInLoop();
        }
    }

    private void startInLoop() {
        if (pending.isEmpty() || state == QueueState.STOPPING) {
            return;
        }

        if (runningCount.get() >= options.getMaxConcurrentTasks()) {
            TaskRecord<P> head = pending.peekFirst();
            if (head != null && head.getTask().options().runImmediately()) {
                dispatch(pending.pollFirst());
            }
            return;
        }

        dispatch(pending.pollFirst());
    }

    private CompletableFuture<Void> startAsyncInLoop() {
        if (stopFuture != null) {
            return stopFuture;
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        stopFuture = future;
        startInLoop();
        return future;
    }

    private void stopInLoop() {
        if (state == QueueState.IDLE) {
            return;
        }

        if (state != QueueState.STOPPING) {
            state = QueueState.STOPPING;
            logger.info("{} stop requested - Running: {}, Pending: {}", getClass().getSimpleName(),
                    runningCount.get(), pending.size());
        }

        // Between a finished task and the next tick nothing is running that could finalise
        if (runningCount.get() == 0) {
            finishStopping();
        }
    }

    private CompletableFuture<Void> stopAsyncInLoop() {
        if (state == QueueState.IDLE) {
            return CompletableFuture.completedFuture(null);
        }

        if (stopFuture == null) {
            stopFuture = new CompletableFuture<>();
        }
        CompletableFuture<Void> future = stopFuture;
        stopInLoop();
        return future;
    }

    private void dispatch(TaskRecord<P> record) {
        QueuedTask<P> task = record.getTask();
        runningCount.incrementAndGet();

        try {
            MDC.put("taskId", String.valueOf(task.id()));

            if (state == QueueState.IDLE) {
                state = QueueState.RUNNING;
                logger.debug("{} started", getClass().getSimpleName());
                events.emitStarted();
            }

            logger.debug("STARTED task after {}ms in queue - Running: {}, Pending: {}",
                    record.getQueuedMillis(), runningCount.get(), pending.size());
            record.markStarted();
            events.emitTaskStarted(task);

            Duration timeout = task.options().effectiveTimeout(options.getDefaultTimeout());
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                activeTimers.put(record, loop.schedule(
                        () -> finish(record, TaskOutcome.TIMED_OUT, new TaskTimeoutException(timeout)), timeout));
            }
        } finally {
            MDC.remove("taskId");
        }

        invoke(record);
    }

    private void invoke(TaskRecord<P> record) {
        CompletionStage<?> result;
        try {
            result = invoker.invoke(record.getTask().payload());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            finish(record, TaskOutcome.FAILED, toTaskError(e));
            return;
        }

        if (result == null) {
            finish(record, TaskOutcome.COMPLETED, null);
            return;
        }

        // Already settled stages call back inline, keeping synchronous tasks synchronous
        result.whenComplete((value, error) -> loop.runInLoopOrPost(() -> {
            if (error == null) {
                finish(record, TaskOutcome.COMPLETED, null);
            } else {
                finish(record, TaskOutcome.FAILED, toTaskError(error));
            }
        }));
    }

    private void finish(TaskRecord<P> record, TaskOutcome outcome, Exception error) {
        if (!record.markFinished()) {
            // Timer fired first, or the abandoned work settled after its timeout
            return;
        }

        QueuedTask<P> task = record.getTask();
        try {
            MDC.put("taskId", String.valueOf(task.id()));
            runningCount.decrementAndGet();

            ScheduledFuture<?> timer = activeTimers.remove(record);
            if (timer != null) {
                timer.cancel(false);
            }

            switch (outcome) {
                case TIMED_OUT -> {
                    logger.warn("Task TIMEOUT after {}ms - abandoning it, its work may still be running",
                            record.getElapsedMillis());
                    events.emitTaskTimedOut(task);
                }
                case FAILED -> {
                    logger.debug("Task FAILED after {}ms - Error: {}", record.getElapsedMillis(), error.toString());
                    events.emitTaskFailed(error, task);
                }
                case COMPLETED -> {
                    logger.debug("COMPLETED task in {}ms", record.getElapsedMillis());
                    events.emitTaskCompleted(task);
                }
            }

            events.emitTaskFinished(error, task);
            record.settle(error);
        } finally {
            MDC.remove("taskId");
        }

        if (getLength() == 0 || (state == QueueState.STOPPING && runningCount.get() == 0)) {
            finishStopping();
        } else if (state != QueueState.STOPPING) {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (options.isUseAsyncTicking()) {
            // A stop finalised before the tick leaves the queue idle; the tick must not revive it
            loop.post(() -> {
                if (state == QueueState.RUNNING) {
                    startInLoop();
                }
            });
        } else {
            startInLoop();
        }
    }

    private void finishStopping() {
        state = QueueState.IDLE;
        activeTimers.values().forEach(timer -> timer.cancel(false));
        activeTimers.clear();

        CompletableFuture<Void> future = stopFuture;
        stopFuture = null;

        logger.debug("{} stopped - Pending: {}", getClass().getSimpleName(), pending.size());
        if (getLength() == 0) {
            events.emitFinished();
        }
        events.emitStopped();

        if (future != null) {
            future.complete(null);
        }
    }

    /**
     * Unwraps future wrappers and makes sure the result is an {@link Exception}.
     */
    static Exception toTaskError(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof Exception ? (Exception) cause : new TaskFailedException(cause);
    }

    private static void validateOptions(QueueOptions options) {
        if (options.getMaxConcurrentTasks() < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1, was "
                    + options.getMaxConcurrentTasks());
        }
        if (options.getDefaultTimeout() == null || options.getDefaultTimeout().isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be zero or positive, was "
                    + options.getDefaultTimeout());
        }
    }
}
