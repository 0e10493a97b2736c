package ptychodus.diffraction.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.api.DiffractionArray;
import ptychodus.diffraction.api.SimpleDiffractionDataset;
import ptychodus.diffraction.model.DiffractionMetadata;
import ptychodus.diffraction.service.AssembledDiffractionDataset;
import ptychodus.diffraction.service.TaskManager;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Feeds arrays into the dataset as they arrive, e.g. from a detector during a scan.
 * <p>
 * {@link #start()} sizes the dataset from metadata announced up front; each
 * {@link #appendArray} schedules one loader. {@link #stop()} must be called on the
 * consumer thread.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class PatternsStreamingContext {

    private static final Logger logger = LoggerFactory.getLogger(PatternsStreamingContext.class);

    private final AssembledDiffractionDataset dataset;
    private final TaskManager taskManager;
    private final DiffractionMetadata metadata;

    public PatternsStreamingContext(AssembledDiffractionDataset dataset, TaskManager taskManager,
                                    DiffractionMetadata metadata) {
        this.dataset = Objects.requireNonNull(dataset, "Dataset must not be null");
        this.taskManager = Objects.requireNonNull(taskManager, "Task manager must not be null");
        this.metadata = Objects.requireNonNull(metadata, "Metadata must not be null");
    }

    /**
     * Resets the dataset to an empty source with this context's metadata.
     *
     * @throws IOException if the pattern buffer cannot be allocated
     */
    public void start() throws IOException {
        dataset.reload(new SimpleDiffractionDataset(metadata, List.of()), true);
        logger.info("Started streaming {} arrays", metadata.getNumPatternsPerArray().size());
    }

    public void appendArray(DiffractionArray array) {
        dataset.appendArray(array);
    }

    public int getQueueSize() {
        return dataset.getQueueSize();
    }

    /**
     * Waits for outstanding loads and runs their foreground tasks on the calling thread.
     */
    public void stop() {
        if (taskManager.getState() == TaskManager.State.RUNNING) {
            taskManager.awaitBackgroundTasks();
        } else {
            logger.warn("Task manager is not running; {} background tasks left queued",
                    taskManager.getBackgroundQueueSize());
        }
        int ran = taskManager.runForegroundTasks();
        logger.info("Stopped streaming after {} final tasks; {} arrays assembled", ran, dataset.size());
    }
}
