package ptychodus.diffraction.service;

/**
 * Accepts work for the background worker.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public interface BackgroundTaskManager {

    /**
     * Enqueues a task without blocking. Safe to call from any thread.
     */
    void putBackgroundTask(BackgroundTask task);

    int getBackgroundQueueSize();
}
