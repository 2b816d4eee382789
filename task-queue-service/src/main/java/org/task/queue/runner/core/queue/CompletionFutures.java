package org.task.queue.runner.core.queue;

import org.task.queue.runner.core.event.TaskEventEmitter;

import java.util.concurrent.CompletableFuture;
import java.util.function.IntSupplier;

/**
 * Completion futures shared by queues and groups. Must be called on the loop thread.
 */
final class CompletionFutures {

    private CompletionFutures() {
    }

    /**
     * Returns a future that completes on the emitter's next {@code finished} event, or an already
     * completed future if nothing is outstanding.
     *
     * @param length number of pending and running tasks
     * @param events emitter whose {@code finished} event ends the wait
     */
    static CompletableFuture<Void> whenFinished(IntSupplier length, TaskEventEmitter<?> events) {
        if (length.getAsInt() == 0) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        events.onceFinished(() -> future.complete(null));
        return future;
    }
}
