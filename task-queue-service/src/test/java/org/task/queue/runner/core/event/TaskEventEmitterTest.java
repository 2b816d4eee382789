package org.task.queue.runner.core.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.task.queue.runner.core.model.QueuedTask;
import org.task.queue.runner.core.model.TaskOptions;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TaskEventEmitterTest {

    @Mock private TaskQueueListener<String> first;
    @Mock private TaskQueueListener<String> second;

    private final TaskEventEmitter<String> emitter = new TaskEventEmitter<>("TestQueue");
    private final QueuedTask<String> task = QueuedTask.next("item", TaskOptions.DEFAULT);

    @Test
    void emit_deliversToListenersInSubscriptionOrder() {
        emitter.addListener(first);
        emitter.addListener(second);

        emitter.emitTaskStarted(task);

        InOrder order = inOrder(first, second);
        order.verify(first).onTaskStarted(task);
        order.verify(second).onTaskStarted(task);
    }

    @Test
    void emit_failingListener_doesNotStopOthers() {
        IllegalStateException boom = new IllegalStateException("Boom");
        doThrow(boom).when(first).onTaskFailed(boom, task);
        emitter.addListener(first);
        emitter.addListener(second);

        emitter.emitTaskFailed(boom, task);

        verify(second).onTaskFailed(boom, task);
    }

    @Test
    void emit_listenerThrowingError_doesNotStopOthers() {
        doThrow(new AssertionError("listener")).when(first).onTaskCompleted(task);
        emitter.addListener(first);
        emitter.addListener(second);

        emitter.emitTaskCompleted(task);

        verify(second).onTaskCompleted(task);
    }

    @Test
    void registrationRemove_unsubscribes() {
        ListenerRegistration registration = emitter.addListener(first);
        emitter.addListener(second);

        registration.remove();
        emitter.emitFinished();

        verify(first, never()).onFinished();
        verify(second).onFinished();
        assertThat(emitter.getListenerCount()).isEqualTo(1);
    }

    @Test
    void removeListener_returnsWhetherSubscribed() {
        emitter.addListener(first);

        assertThat(emitter.removeListener(first)).isTrue();
        assertThat(emitter.removeListener(first)).isFalse();
    }

    @Test
    void onceFinished_runsOnlyOnce() {
        AtomicInteger runs = new AtomicInteger();
        emitter.onceFinished(runs::incrementAndGet);

        emitter.emitFinished();
        emitter.emitFinished();

        assertThat(runs).hasValue(1);
        assertThat(emitter.getListenerCount()).isZero();
    }

    @Test
    void listenerRemovedDuringDispatch_stillReceivesCurrentEvent() {
        AtomicInteger calls = new AtomicInteger();
        TaskQueueListener<String> selfRemoving = new TaskQueueListener<>() {
            @Override
            public void onStopped() {
                emitter.removeListener(first);
                calls.incrementAndGet();
            }
        };
        emitter.addListener(selfRemoving);
        emitter.addListener(first);

        emitter.emitStopped();
        emitter.emitStopped();

        assertThat(calls).hasValue(2);
        verify(first).onStopped();
    }

    @Test
    void emit_withoutListeners_doesNothing() {
        emitter.emitTaskAdded(task);
        emitter.emitStarted();

        assertThat(emitter.getListenerCount()).isZero();
    }
}
