package org.task.queue.runner.core.processor;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * A self-contained unit of work for a function queue.
 *
 * <p>Same contract as {@link ItemProcessor}: return {@code null} when done synchronously, or a stage
 * that settles when the asynchronous work is done.
 */
@FunctionalInterface
public interface FunctionTask {

    CompletionStage<?> call() throws Exception;

    static FunctionTask of(Runnable runnable) {
        Objects.requireNonNull(runnable, "Runnable cannot be null");
        return () -> {
            runnable.run();
            return null;
        };
    }
}
