package ptychodus.diffraction.service;

import java.util.Optional;

/**
 * Unit of work run on the background worker. May hand a follow-up task to the
 * consumer thread by returning it.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
@FunctionalInterface
public interface BackgroundTask {

    /**
     * Runs the task.
     *
     * @return a task to run on the consumer thread, or empty
     * @throws Exception any failure; logged by the worker
     */
    Optional<ForegroundTask> call() throws Exception;
}
