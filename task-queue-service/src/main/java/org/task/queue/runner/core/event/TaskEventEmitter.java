package org.task.queue.runner.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.task.queue.runner.core.model.QueuedTask;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publish/subscribe channel owned by one queue or one group.
 *
 * <p>Listeners may subscribe and unsubscribe from any thread, including from inside a listener
 * callback; a dispatch in progress keeps delivering to the listeners present when it started. A
 * listener that throws is logged and the remaining listeners still receive the event.
 *
 * @param <P> payload type
 */
public class TaskEventEmitter<P> {
    private static final Logger logger = LoggerFactory.getLogger(TaskEventEmitter.class);

    private final String owner;
    private final List<TaskQueueListener<P>> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param owner name of the emitting queue or group, used in log messages
     */
    public TaskEventEmitter(String owner) {
        this.owner = owner;
    }

    public ListenerRegistration addListener(TaskQueueListener<P> listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Removes one subscription of the listener.
     *
     * @return {@code true} if the listener was subscribed
     */
    public boolean removeListener(TaskQueueListener<P> listener) {
        return listeners.remove(listener);
    }

    /**
     * Runs the action on the next {@code finished} event only.
     */
    public ListenerRegistration onceFinished(Runnable action) {
        Objects.requireNonNull(action, "Action cannot be null");
        TaskQueueListener<P> once = new TaskQueueListener<>() {
            @Override
            public void onFinished() {
                listeners.remove(this);
                action.run();
            }
        };
        return addListener(once);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void emitTaskAdded(QueuedTask<P> task) {
        dispatch("taskAdded", listener -> listener.onTaskAdded(task));
    }

    public void emitTaskStarted(QueuedTask<P> task) {
        dispatch("taskStarted", listener -> listener.onTaskStarted(task));
    }

    public void emitTaskCompleted(QueuedTask<P> task) {
        dispatch("taskCompleted", listener -> listener.onTaskCompleted(task));
    }

    public void emitTaskTimedOut(QueuedTask<P> task) {
        dispatch("taskTimedOut", listener -> listener.onTaskTimedOut(task));
    }

    public void emitTaskFailed(Exception error, QueuedTask<P> task) {
        dispatch("taskFailed", listener -> listener.onTaskFailed(error, task));
    }

    public void emitTaskFinished(Exception error, QueuedTask<P> task) {
        dispatch("taskFinished", listener -> listener.onTaskFinished(error, task));
    }

    public void emitStarted() {
        dispatch("started", TaskQueueListener::onStarted);
    }

    public void emitStopped() {
        dispatch("stopped", TaskQueueListener::onStopped);
    }

    public void emitFinished() {
        dispatch("finished", TaskQueueListener::onFinished);
    }

    private void dispatch(String event, Consumer<TaskQueueListener<P>> delivery) {
        for (TaskQueueListener<P> listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                logger.error("{} listener {} failed handling '{}' event", owner,
                        listener.getClass().getName(), event, e);
            }
        }
    }
}
