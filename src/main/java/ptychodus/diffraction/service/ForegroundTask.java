package ptychodus.diffraction.service;

/**
 * Unit of work run on the consumer thread by {@link TaskManager#runForegroundTasks()}.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
@FunctionalInterface
public interface ForegroundTask {

    void run() throws Exception;
}
