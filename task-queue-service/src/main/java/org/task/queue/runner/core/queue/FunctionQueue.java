package org.task.queue.runner.core.queue;

import org.task.queue.runner.core.loop.TaskLoop;
import org.task.queue.runner.core.model.QueueOptions;
import org.task.queue.runner.core.processor.FunctionTask;

/**
 * Task queue whose tasks are self-contained {@link FunctionTask}s.
 */
public class FunctionQueue extends TaskQueue<FunctionTask> {

    public FunctionQueue() {
        this(QueueOptions.defaults());
    }

    public FunctionQueue(QueueOptions options) {
        this(options, null);
    }

    /**
     * @param options queue options, defaults if null
     * @param loop    loop to run on; null creates one that {@link #close()} shuts down
     */
    public FunctionQueue(QueueOptions options, TaskLoop loop) {
        super(FunctionTask::call, options, loop);
    }
}
