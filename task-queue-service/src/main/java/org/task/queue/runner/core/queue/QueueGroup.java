package org.task.queue.runner.core.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.task.queue.runner.core.event.ListenerRegistration;
import org.task.queue.runner.core.event.TaskEventEmitter;
import org.task.queue.runner.core.event.TaskQueueListener;
import org.task.queue.runner.core.model.QueuedTask;
import org.task.queue.runner.core.model.TaskOptions;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A view over a subset of one queue's tasks.
 *
 * <p>Tasks pushed through a group run on the parent queue and share its slots; the group only
 * tracks them. It re-emits the parent's task events for its own tasks, and emits its own
 * {@code finished} event when none of them remain. Groups never emit {@code taskAdded},
 * {@code started} or {@code stopped}.
 *
 * <p>After {@link #destroy()} the group emits nothing more. Tasks it already admitted keep running
 * on the parent, and a completion future obtained earlier never settles.
 *
 * @param <P> payload type
 */
public class QueueGroup<P> {
    private static final Logger logger = LoggerFactory.getLogger(QueueGroup.class);

    private final TaskQueue<P> parent;
    private final TaskEventEmitter<P> events = new TaskEventEmitter<>(getClass().getSimpleName());

    /** Admitted through this group, not dispatched yet */
    private final Set<Long> pendingIds = ConcurrentHashMap.newKeySet();

    /** Dispatched, outcome not determined yet */
    private final Set<Long> activeIds = ConcurrentHashMap.newKeySet();

    private final ListenerRegistration registration;
    private volatile boolean active = true;

    QueueGroup(TaskQueue<P> parent) {
        this.parent = parent;
        this.registration = parent.addListener(new ParentListener());
    }

    public QueuedTask<P> push(P payload) {
        return push(payload, TaskOptions.DEFAULT);
    }

    /**
     * Adds a task to the parent queue and tracks it in this group.
     */
    public QueuedTask<P> push(P payload, TaskOptions options) {
        TaskRecord<P> record = parent.newRecord(payload, options, null);
        track(record);
        parent.admit(record);
        return record.getTask();
    }

    public CompletableFuture<Void> pushAsync(P payload) {
        return pushAsync(payload, TaskOptions.DEFAULT);
    }

    /**
     * Adds a task to the parent queue, tracks it in this group and returns the parent's future
     * for it.
     */
    public CompletableFuture<Void> pushAsync(P payload, TaskOptions options) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        TaskRecord<P> record = parent.newRecord(payload, options, completion);
        track(record);
        parent.admit(record);
        return completion;
    }

    /**
     * Returns a future that completes once all of this group's tasks are done, immediately if
     * there are none.
     */
    public CompletableFuture<Void> getCompletionFuture() {
        return parent.getLoop().callInLoop(() -> CompletionFutures.whenFinished(this::getLength, events));
    }

    /**
     * @return number of this group's tasks that are pending or running
     */
    public int getLength() {
        return pendingIds.size() + activeIds.size();
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Detaches the group from its parent queue. Already admitted tasks still run; pushing after
     * this still reaches the parent queue, but the task is not tracked.
     */
    public void destroy() {
        if (!active) {
            return;
        }
        active = false;
        registration.remove();
        logger.debug("Group destroyed - Pending: {}, Active: {}", pendingIds.size(), activeIds.size());
    }

    public ListenerRegistration addListener(TaskQueueListener<P> listener) {
        return events.addListener(listener);
    }

    public boolean removeListener(TaskQueueListener<P> listener) {
        return events.removeListener(listener);
    }

    private void track(TaskRecord<P> record) {
        if (active) {
            pendingIds.add(record.getId());
        }
    }

    /**
     * Filters the parent's events down to this group's tasks. Runs on the loop thread.
     */
    private class ParentListener implements TaskQueueListener<P> {

        @Override
        public void onTaskStarted(QueuedTask<P> task) {
            if (active && pendingIds.remove(task.id())) {
                activeIds.add(task.id());
                events.emitTaskStarted(task);
            }
        }

        @Override
        public void onTaskCompleted(QueuedTask<P> task) {
            if (active && activeIds.contains(task.id())) {
                events.emitTaskCompleted(task);
            }
        }

        @Override
        public void onTaskTimedOut(QueuedTask<P> task) {
            if (active && activeIds.contains(task.id())) {
                events.emitTaskTimedOut(task);
            }
        }

        @Override
        public void onTaskFailed(Exception error, QueuedTask<P> task) {
            if (active && activeIds.contains(task.id())) {
                events.emitTaskFailed(error, task);
            }
        }

        @Override
        public void onTaskFinished(Exception error, QueuedTask<P> task) {
            if (active && activeIds.remove(task.id())) {
                events.emitTaskFinished(error, task);
                if (getLength() == 0) {
                    events.emitFinished();
                }
            }
        }
    }
}
