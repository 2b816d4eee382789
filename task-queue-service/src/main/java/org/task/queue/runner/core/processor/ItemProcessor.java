package org.task.queue.runner.core.processor;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Shared processing function of an item queue, invoked once per dispatched item on the queue's
 * loop thread.
 *
 * <p>Implementations either:
 * <ol>
 *   <li>do their work synchronously and return {@code null} (or an already completed stage), or</li>
 *   <li>start asynchronous work and return a stage that settles when it is done.</li>
 * </ol>
 * Throwing, or returning a stage that completes exceptionally, fails the item. Long blocking work
 * belongs on another executor: while {@code process} runs, the queue cannot do anything else.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface ItemProcessor<T> {

    CompletionStage<?> process(T item) throws Exception;

    /**
     * Adapts a synchronous consumer.
     */
    static <T> ItemProcessor<T> of(Consumer<? super T> consumer) {
        Objects.requireNonNull(consumer, "Consumer cannot be null");
        return item -> {
            consumer.accept(item);
            return null;
        };
    }
}
