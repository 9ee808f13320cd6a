package io.scanflow.core.execution.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.scanflow.core.exception.WorkerPoolException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkerControllerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Mock private WorkerControllerListener<Integer, Integer> listener;

    private static List<Integer> tasks(int count) {
        return IntStream.range(0, count).boxed().collect(Collectors.toList());
    }

    private static WorkerController<Integer, Integer> squaring(int workers, int failAt) {
        return new WorkerController<>(
                "squares",
                workers,
                () ->
                        task -> {
                            if (task == failAt) {
                                throw new IllegalStateException("bad task " + task);
                            }
                            return task * task;
                        });
    }

    @Nested
    class DeliveryTest {

        @Test
        void shouldReportFailuresAndKeepProcessing() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller = squaring(2, 3);
            Map<Integer, Integer> results = new ConcurrentHashMap<>();
            Map<Integer, Throwable> failures = new ConcurrentHashMap<>();
            controller.onResult(results::put);
            controller.onFailure(failures::put);

            // When
            controller.submit(tasks(5));
            controller.start();
            controller.finalizeTasks();

            // Then
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(results).containsOnlyKeys(0, 1, 2, 4).containsEntry(4, 16);
            assertThat(failures).containsOnlyKeys(3);
            assertThat(failures.get(3)).hasMessage("bad task 3");
            assertThat(controller.getProgress()).isEqualTo(1.0);
            assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
        }

        @Test
        void shouldAcceptMoreTasksAfterFailure() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller = squaring(2, 3);
            Map<Integer, Integer> results = new ConcurrentHashMap<>();
            Map<Integer, Throwable> failures = new ConcurrentHashMap<>();
            controller.onResult(results::put);
            controller.onFailure(failures::put);
            controller.submit(tasks(5));
            controller.start();
            await().atMost(TIMEOUT).until(() -> controller.getCompletedCount() == 5);
            assertThat(failures).containsOnlyKeys(3);

            // When
            controller.submit(List.of(10, 11, 12));
            await().atMost(TIMEOUT).until(() -> controller.getCompletedCount() == 8);
            controller.finalizeTasks();

            // Then
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(results)
                    .containsOnlyKeys(0, 1, 2, 4, 10, 11, 12)
                    .containsEntry(12, 144);
            assertThat(failures).containsOnlyKeys(3);
            assertThat(controller.getProgress()).isEqualTo(1.0);
        }

        @Test
        void shouldNotifyListenerOncePerTaskAndFinishOnce() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller = squaring(3, -1);
            controller.addListener(listener);

            // When
            controller.submit(tasks(4));
            controller.start();
            controller.finalizeTasks();
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();

            // Then
            verify(listener).onResult(2, 4);
            verify(listener, times(4)).onResult(any(), any());
            verify(listener, times(4)).onProgress(anyDouble());
            verify(listener, never()).onFailure(any(), any());
            verify(listener, times(1)).onFinished();
        }

        @Test
        void shouldKeepDeliveringWhenListenerThrows() throws Exception {
            WorkerController<Integer, Integer> controller = squaring(2, -1);
            controller.onResult(
                    (task, result) -> {
                        throw new IllegalArgumentException("listener bug");
                    });
            controller.submit(tasks(6));
            controller.start();
            controller.finalizeTasks();

            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(controller.getCompletedCount()).isEqualTo(6);
        }

        @Test
        void shouldAcceptTasksAfterStart() throws Exception {
            WorkerController<Integer, Integer> controller = squaring(2, -1);
            Set<Integer> seen = ConcurrentHashMap.newKeySet();
            controller.onResult((task, result) -> seen.add(task));

            controller.start();
            controller.submit(1);
            controller.submit(List.of(2, 3));
            controller.finalizeTasks();

            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(seen).containsExactlyInAnyOrder(1, 2, 3);
        }
    }

    @Nested
    class LifecycleTest {

        @Test
        void shouldReportNoProgressBeforeSubmission() {
            WorkerController<Integer, Integer> controller = squaring(1, -1);

            assertThat(controller.getProgress()).isEqualTo(-1.0);
            assertThat(controller.getState()).isEqualTo(ControllerState.IDLE);
        }

        @Test
        void shouldHoldBackResultsWhileSuspended() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller = squaring(2, -1);
            Set<Integer> seen = ConcurrentHashMap.newKeySet();
            controller.onResult((task, result) -> seen.add(task));
            controller.start();
            controller.suspend();

            // When
            controller.submit(tasks(10));
            Thread.sleep(200);

            // Then
            assertThat(seen).isEmpty();
            assertThat(controller.getState()).isEqualTo(ControllerState.SUSPENDED);

            controller.restart();
            controller.finalizeTasks();
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(seen).hasSize(10);
        }

        @Test
        void shouldDiscardPendingTasksOnStop() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller =
                    new WorkerController<>(
                            "slow",
                            1,
                            () ->
                                    task -> {
                                        Thread.sleep(50);
                                        return task;
                                    });
            controller.submit(tasks(20));
            controller.start();
            await().atMost(TIMEOUT).until(() -> controller.getCompletedCount() >= 1);

            // When
            controller.stop();

            // Then
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(controller.getCompletedCount()).isLessThan(20);
            assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
            assertThatThrownBy(() -> controller.submit(99))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldFinishImmediatelyWhenStoppedBeforeStart() throws Exception {
            WorkerController<Integer, Integer> controller = squaring(1, -1);
            controller.addListener(listener);
            controller.submit(tasks(3));

            controller.stop();

            assertThat(controller.awaitTermination(Duration.ZERO)).isTrue();
            verify(listener).onFinished();
            assertThatThrownBy(controller::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldRejectSecondStart() throws Exception {
            WorkerController<Integer, Integer> controller = squaring(1, -1);
            controller.start();

            assertThatThrownBy(controller::start).isInstanceOf(IllegalStateException.class);

            controller.finalizeTasks();
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
        }
    }

    @Nested
    class WorkerFailureTest {

        @Test
        void shouldStopWhenWorkerDiesFromError() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller =
                    new WorkerController<>(
                            "fragile",
                            2,
                            () ->
                                    task -> {
                                        if (task == 2) {
                                            throw new AssertionError("corrupted state");
                                        }
                                        Thread.sleep(20);
                                        return task;
                                    });
            AtomicReference<WorkerPoolException> failure = new AtomicReference<>();
            controller.onWorkerFailure(failure::set);

            // When
            controller.submit(tasks(50));
            controller.start();
            controller.finalizeTasks();

            // Then
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(failure.get()).isNotNull();
            assertThat(failure.get().getCause()).isInstanceOf(AssertionError.class);
            assertThat(failure.get().getWorkerName()).startsWith("fragile-worker-");
            assertThat(controller.getCompletedCount()).isLessThan(50);
            assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
        }

        @Test
        void shouldReportInterruptedTaskAndLoseItsWorker() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller =
                    new WorkerController<>(
                            "interrupted",
                            1,
                            () ->
                                    task -> {
                                        if (task == 0) {
                                            throw new InterruptedException("woken up");
                                        }
                                        return task;
                                    });
            Map<Integer, Throwable> failures = new ConcurrentHashMap<>();
            AtomicReference<WorkerPoolException> lost = new AtomicReference<>();
            controller.onFailure(failures::put);
            controller.onWorkerFailure(lost::set);

            // When
            controller.submit(tasks(3));
            controller.start();

            // Then
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            assertThat(failures).containsOnlyKeys(0);
            assertThat(failures.get(0)).isInstanceOf(InterruptedException.class);
            assertThat(lost.get()).isNotNull();
            assertThat(lost.get().getCause()).isInstanceOf(InterruptedException.class);
            assertThat(controller.getCompletedCount()).isEqualTo(1);
            assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
        }

        @Test
        void shouldStopWhenTaskFunctionCannotBeCreated() throws Exception {
            // Given
            WorkerController<Integer, Integer> controller =
                    new WorkerController<>("broken", 2) {
                        @Override
                        protected TaskFunction<Integer, Integer> newTaskFunction()
                                throws Exception {
                            throw new IllegalStateException("no tree to run");
                        }
                    };
            controller.addListener(listener);

            // When
            controller.submit(tasks(3));
            controller.start();

            // Then
            assertThat(controller.awaitTermination(TIMEOUT)).isTrue();
            verify(listener, times(2)).onWorkerFailure(any());
            verify(listener, never()).onResult(any(), any());
            verify(listener).onFinished();
        }
    }
}
