package org.task.queue.runner.core.queue;

import org.task.queue.runner.core.event.TaskQueueListener;
import org.task.queue.runner.core.model.QueuedTask;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every event as {@code "name"} or {@code "name payload"}, in delivery order.
 */
class RecordingListener<P> implements TaskQueueListener<P> {

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final List<QueuedTask<P>> startedTasks = new CopyOnWriteArrayList<>();
    private final List<Exception> finishErrors = new CopyOnWriteArrayList<>();

    List<String> events() {
        return new ArrayList<>(events);
    }

    List<QueuedTask<P>> startedTasks() {
        return new ArrayList<>(startedTasks);
    }

    List<Exception> finishErrors() {
        return new ArrayList<>(finishErrors);
    }

    long count(String event) {
        return events.stream().filter(e -> e.equals(event) || e.startsWith(event + " ")).count();
    }

    @Override
    public void onTaskAdded(QueuedTask<P> task) {
        events.add("taskAdded " + task.payload());
    }

    @Override
    public void onTaskStarted(QueuedTask<P> task) {
        startedTasks.add(task);
        events.add("taskStarted " + task.payload());
    }

    @Override
    public void onTaskCompleted(QueuedTask<P> task) {
        events.add("taskCompleted " + task.payload());
    }

    @Override
    public void onTaskTimedOut(QueuedTask<P> task) {
        events.add("taskTimedOut " + task.payload());
    }

    @Override
    public void onTaskFailed(Exception error, QueuedTask<P> task) {
        events.add("taskFailed " + task.payload());
    }

    @Override
    public void onTaskFinished(Exception error, QueuedTask<P> task) {
        if (error != null) {
            finishErrors.add(error);
        }
        events.add("taskFinished " + task.payload());
    }

    @Override
    public void onStarted() {
        events.add("started");
    }

    @Override
    public void onStopped() {
        events.add("stopped");
    }

    @Override
    public void onFinished() {
        events.add("finished");
    }
}
