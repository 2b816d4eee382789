package org.task.queue.runner.core.event;

/**
 * Handle returned when subscribing a listener.
 */
@FunctionalInterface
public interface ListenerRegistration {

    /**
     * Detaches the listener. Calling this more than once has no further effect.
     */
    void remove();
}
