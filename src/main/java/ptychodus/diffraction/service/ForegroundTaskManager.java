package ptychodus.diffraction.service;

/**
 * Accepts work for the consumer thread.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public interface ForegroundTaskManager {

    /**
     * Enqueues a task without blocking. Safe to call from any thread.
     */
    void putForegroundTask(ForegroundTask task);

    int getForegroundQueueSize();
}
