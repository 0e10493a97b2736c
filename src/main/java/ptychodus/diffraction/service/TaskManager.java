package ptychodus.diffraction.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-queue task runner: one background worker thread and a foreground queue that is
 * drained by a single consumer thread.
 * <p>
 * Background tasks run in submission order on the worker. A background task may
 * return a {@link ForegroundTask}; it is queued for the consumer thread, which runs it
 * in {@link #runForegroundTasks()}. Only the consumer thread mutates state that
 * observers can see, so foreground tasks need no locking among themselves.
 * <p>
 * The first thread that calls {@link #runForegroundTasks()} becomes the consumer;
 * later calls from other threads are rejected.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class TaskManager implements BackgroundTaskManager, ForegroundTaskManager {

    private static final Logger logger = LoggerFactory.getLogger(TaskManager.class);

    /** Poll timeout for the worker, so a stop request is seen promptly */
    public static final long WAIT_TIME_MS = 1000;

    /**
     * Lifecycle state of the background worker.
     */
    public enum State {
        STOPPED,
        RUNNING
    }

    private final BlockingQueue<BackgroundTask> backgroundQueue = new LinkedBlockingQueue<>();
    private final Queue<ForegroundTask> foregroundQueue = new ConcurrentLinkedQueue<>();
    private final AtomicReference<Thread> consumerThread = new AtomicReference<>();

    // Background tasks submitted but not yet finished
    private final Object unfinishedLock = new Object();
    private int unfinishedTasks = 0;

    private volatile boolean stopRequested = false;
    private Thread worker;

    // ==================== Lifecycle ====================

    /**
     * Starts the background worker. Does nothing if already running.
     */
    public synchronized void start() {
        if (worker != null) {
            logger.warn("Background thread already started!");
            return;
        }
        stopRequested = false;
        worker = new Thread(this::runBackgroundTasks, "Diffraction-TaskManager");
        worker.setDaemon(true);
        worker.start();
        logger.info("Started background thread");
    }

    /**
     * Stops the background worker.
     *
     * @param awaitFinish if true, first wait for every background task submitted so far
     */
    public synchronized void stop(boolean awaitFinish) {
        if (worker == null) {
            logger.debug("Background thread already stopped");
            return;
        }
        if (awaitFinish) {
            logger.info("Finishing background tasks...");
            awaitBackgroundTasks();
        }
        logger.info("Stopping background thread...");
        stopRequested = true;
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while joining background thread");
        }
        worker = null;
        logger.info("Background thread stopped");
    }

    public synchronized State getState() {
        return worker == null ? State.STOPPED : State.RUNNING;
    }

    /**
     * Blocks until every background task submitted so far has finished. The worker
     * must be running, otherwise this waits until it is started.
     */
    public void awaitBackgroundTasks() {
        synchronized (unfinishedLock) {
            while (unfinishedTasks > 0) {
                try {
                    unfinishedLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while waiting for {} background tasks", unfinishedTasks);
                    return;
                }
            }
        }
    }

    // ==================== Background ====================

    @Override
    public void putBackgroundTask(BackgroundTask task) {
        Objects.requireNonNull(task, "Background task must not be null");
        synchronized (unfinishedLock) {
            unfinishedTasks++;
        }
        backgroundQueue.add(task);
    }

    @Override
    public int getBackgroundQueueSize() {
        return backgroundQueue.size();
    }

    private void runBackgroundTasks() {
        while (!stopRequested) {
            BackgroundTask task;
            try {
                task = backgroundQueue.poll(WAIT_TIME_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Background thread interrupted");
                break;
            }
            if (task == null) {
                continue;
            }
            try {
                Optional<ForegroundTask> foregroundTask = task.call();
                if (foregroundTask != null) {
                    foregroundTask.ifPresent(this::putForegroundTask);
                }
            } catch (Exception e) {
                logger.error("Background task {} failed", task, e);
            } finally {
                taskDone();
            }
        }
    }

    private void taskDone() {
        synchronized (unfinishedLock) {
            unfinishedTasks--;
            if (unfinishedTasks <= 0) {
                unfinishedLock.notifyAll();
            }
        }
    }

    // ==================== Foreground ====================

    @Override
    public void putForegroundTask(ForegroundTask task) {
        foregroundQueue.add(Objects.requireNonNull(task, "Foreground task must not be null"));
    }

    @Override
    public int getForegroundQueueSize() {
        return foregroundQueue.size();
    }

    /**
     * Runs every queued foreground task on the calling thread, in submission order.
     * A failing task is logged and the drain continues.
     *
     * @return the number of tasks run
     * @throws IllegalStateException if called from a thread other than the consumer
     */
    public int runForegroundTasks() {
        Thread current = Thread.currentThread();
        if (!consumerThread.compareAndSet(null, current) && consumerThread.get() != current) {
            throw new IllegalStateException("Foreground tasks must run on " + consumerThread.get().getName()
                    + ", not " + current.getName());
        }
        int count = 0;
        ForegroundTask task;
        while ((task = foregroundQueue.poll()) != null) {
            try {
                task.run();
            } catch (Exception e) {
                logger.error("Foreground task {} failed", task, e);
            }
            count++;
        }
        if (count > 0) {
            logger.debug("Ran {} foreground tasks", count);
        }
        return count;
    }
}
