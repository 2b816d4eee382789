package org.task.queue.runner.core.queue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.task.queue.runner.api.exception.TaskFailedException;
import org.task.queue.runner.core.event.TaskQueueListener;
import org.task.queue.runner.core.loop.TaskLoop;
import org.task.queue.runner.core.model.QueueOptions;
import org.task.queue.runner.core.model.QueuedTask;
import org.task.queue.runner.core.processor.FunctionTask;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FunctionQueueTest {

    @Mock private TaskQueueListener<FunctionTask> listener;

    private FunctionQueue queue;

    @BeforeEach
    void setUp() {
        queue = new FunctionQueue(QueueOptions.builder().autoStart(false).build());
        queue.addListener(listener);
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    void startAsync_runsTasksInOrder_andNeverEmitsTaskAdded() throws Exception {
        List<String> ran = new CopyOnWriteArrayList<>();
        QueuedTask<FunctionTask> a = queue.push(FunctionTask.of(() -> ran.add("A")));
        QueuedTask<FunctionTask> b = queue.push(FunctionTask.of(() -> ran.add("B")));

        queue.startAsync().get(2, TimeUnit.SECONDS);

        assertThat(ran).containsExactly("A", "B");
        InOrder order = inOrder(listener);
        order.verify(listener).onStarted();
        order.verify(listener).onTaskStarted(a);
        order.verify(listener).onTaskCompleted(a);
        order.verify(listener).onTaskFinished(isNull(), any());
        order.verify(listener).onTaskStarted(b);
        order.verify(listener).onTaskCompleted(b);
        order.verify(listener).onTaskFinished(isNull(), any());
        order.verify(listener).onFinished();
        order.verify(listener).onStopped();
        verify(listener, never()).onTaskAdded(any());
    }

    @Test
    void pushAsync_asyncTask_completesWithTask() throws Exception {
        CompletableFuture<Void> work = new CompletableFuture<>();
        CompletableFuture<Void> result = queue.pushAsync(() -> work);
        queue.start();

        await().atMost(2, TimeUnit.SECONDS).until(() -> queue.getRunningCount() == 1);
        assertThat(result).isNotDone();

        work.complete(null);

        result.get(2, TimeUnit.SECONDS);
    }

    @Test
    void pushAsync_throwingTask_failsFuture() {
        IllegalStateException boom = new IllegalStateException("Boom");
        CompletableFuture<Void> result = queue.pushAsync(() -> {
            throw boom;
        });
        queue.start();

        assertThatThrownBy(() -> result.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCause(boom);
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> verify(listener).onTaskFailed(any(), any()));
        verify(listener).onTaskFinished(any(IllegalStateException.class), any());
    }

    @Test
    void pushAsync_taskThrowingError_failsFuture_andNextTaskStillRuns() throws Exception {
        AssertionError fatal = new AssertionError("Boom");
        CompletableFuture<Void> failed = queue.pushAsync(() -> {
            throw fatal;
        });
        CompletableFuture<Void> next = queue.pushAsync(FunctionTask.of(() -> { }));

        queue.startAsync().get(2, TimeUnit.SECONDS);

        assertThatThrownBy(failed::get)
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(TaskFailedException.class)
                .hasCause(fatal);
        assertThat(next).isCompleted().isNotCompletedExceptionally();
        assertThat(queue.getLength()).isZero();
        verify(listener).onTaskFailed(any(TaskFailedException.class), any());
    }

    @Test
    void push_withAutoStart_runsImmediately() throws Exception {
        try (FunctionQueue autoStarting = new FunctionQueue()) {
            CompletableFuture<Void> ran = new CompletableFuture<>();

            autoStarting.push(FunctionTask.of(() -> ran.complete(null)));

            ran.get(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void queuesOnSharedLoop_runIndependently() throws Exception {
        try (TaskLoop loop = new TaskLoop("SharedLoop");
             FunctionQueue first = new FunctionQueue(QueueOptions.defaults(), loop);
             FunctionQueue second = new FunctionQueue(QueueOptions.defaults(), loop)) {
            CompletableFuture<Void> blocked = new CompletableFuture<>();

            first.push(() -> blocked);
            second.pushAsync(FunctionTask.of(() -> { })).get(2, TimeUnit.SECONDS);

            assertThat(first.getLength()).isEqualTo(1);
            assertThat(second.getLength()).isZero();
            assertThat(first.getLoop()).isSameAs(second.getLoop());
            blocked.complete(null);
        }
    }

    @Test
    void close_withSharedLoop_leavesLoopOpen() {
        try (TaskLoop loop = new TaskLoop()) {
            new FunctionQueue(QueueOptions.defaults(), loop).close();

            assertThat(loop.isClosed()).isFalse();
        }
    }

    @Test
    void close_withOwnLoop_closesIt() {
        FunctionQueue owning = new FunctionQueue();

        owning.close();

        assertThat(owning.getLoop().isClosed()).isTrue();
    }
}
