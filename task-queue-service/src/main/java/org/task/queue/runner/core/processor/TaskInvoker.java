package org.task.queue.runner.core.processor;

import java.util.concurrent.CompletionStage;

/**
 * How a queue turns a payload into running work. This is the only thing that differs between
 * queue shapes.
 *
 * @param <P> payload type
 */
@FunctionalInterface
public interface TaskInvoker<P> {

    /**
     * @param payload the dispatched payload
     * @return {@code null} if the work already finished, otherwise a stage that settles with it
     * @throws Exception if the work failed synchronously
     */
    CompletionStage<?> invoke(P payload) throws Exception;
}
