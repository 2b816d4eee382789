package org.task.queue.runner.core.queue;

import org.task.queue.runner.core.loop.TaskLoop;
import org.task.queue.runner.core.model.QueueOptions;
import org.task.queue.runner.core.model.QueuedTask;
import org.task.queue.runner.core.processor.ItemProcessor;

import java.util.Objects;

/**
 * Task queue whose tasks are data items, all handled by one shared {@link ItemProcessor}.
 *
 * <p>Unlike {@link FunctionQueue}, this queue announces every admitted item with a
 * {@code taskAdded} event.
 *
 * @param <T> item type
 */
public class ItemQueue<T> extends TaskQueue<T> {

    private final ItemProcessor<T> processor;

    public ItemQueue(ItemProcessor<T> processor) {
        this(processor, QueueOptions.defaults());
    }

    public ItemQueue(ItemProcessor<T> processor, QueueOptions options) {
        this(processor, options, null);
    }

    /**
     * @param processor function invoked for every dispatched item
     * @param options   queue options, defaults if null
     * @param loop      loop to run on; null creates one that {@link #close()} shuts down
     */
    public ItemQueue(ItemProcessor<T> processor, QueueOptions options, TaskLoop loop) {
        super(Objects.requireNonNull(processor, "Item processor cannot be null")::process, options, loop);
        this.processor = processor;
    }

    public ItemProcessor<T> getProcessor() {
        return processor;
    }

    @Override
    protected void onAdmitted(QueuedTask<T> task) {
        getEvents().emitTaskAdded(task);
    }
}
