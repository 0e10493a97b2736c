package ptychodus.diffraction.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskManagerTest {

    private TaskManager taskManager;

    @BeforeEach
    void setUp() {
        taskManager = new TaskManager();
    }

    @AfterEach
    void tearDown() {
        taskManager.stop(false);
    }

    @Test
    void emptyDrainIsNoOp() {
        assertEquals(0, taskManager.runForegroundTasks());
        assertEquals(0, taskManager.runForegroundTasks());
    }

    @Test
    void backgroundResultRunsOnConsumerThread() {
        List<String> threads = new CopyOnWriteArrayList<>();
        taskManager.start();
        taskManager.putBackgroundTask(() -> {
            threads.add(Thread.currentThread().getName());
            return Optional.of(() -> threads.add(Thread.currentThread().getName()));
        });
        taskManager.stop(true);

        assertEquals(1, taskManager.runForegroundTasks());
        assertEquals(List.of("Diffraction-TaskManager", Thread.currentThread().getName()), threads);
    }

    @Test
    void failingBackgroundTaskDoesNotStopWorker() {
        List<Integer> results = new CopyOnWriteArrayList<>();
        taskManager.start();
        taskManager.putBackgroundTask(() -> {
            throw new IllegalStateException("boom");
        });
        taskManager.putBackgroundTask(() -> Optional.of(() -> results.add(2)));
        taskManager.stop(true);

        taskManager.runForegroundTasks();
        assertEquals(List.of(2), results);
    }

    @Test
    void foregroundTasksRunInOrderPastFailures() {
        List<Integer> results = new CopyOnWriteArrayList<>();
        taskManager.putForegroundTask(() -> results.add(1));
        taskManager.putForegroundTask(() -> {
            throw new IllegalArgumentException("boom");
        });
        taskManager.putForegroundTask(() -> results.add(3));

        assertEquals(3, taskManager.getForegroundQueueSize());
        assertEquals(3, taskManager.runForegroundTasks());
        assertEquals(List.of(1, 3), results);
        assertEquals(0, taskManager.getForegroundQueueSize());
    }

    @Test
    void drainFromSecondThreadIsRejected() throws InterruptedException {
        taskManager.runForegroundTasks();

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread other = new Thread(() -> {
            try {
                taskManager.runForegroundTasks();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        other.start();
        other.join();

        assertInstanceOf(IllegalStateException.class, failure.get());
    }

    @Test
    void startAndStopAreIdempotent() {
        assertEquals(TaskManager.State.STOPPED, taskManager.getState());
        taskManager.start();
        taskManager.start();
        assertEquals(TaskManager.State.RUNNING, taskManager.getState());
        taskManager.stop(false);
        taskManager.stop(false);
        assertEquals(TaskManager.State.STOPPED, taskManager.getState());
    }

    @Test
    void stopWithAwaitFinishesQueuedTasks() {
        List<Integer> results = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 5; i++) {
            int value = i;
            taskManager.putBackgroundTask(() -> {
                results.add(value);
                return Optional.empty();
            });
        }
        assertEquals(5, taskManager.getBackgroundQueueSize());

        taskManager.start();
        taskManager.stop(true);

        assertEquals(List.of(0, 1, 2, 3, 4), results);
        assertTrue(taskManager.getBackgroundQueueSize() == 0);
    }
}
