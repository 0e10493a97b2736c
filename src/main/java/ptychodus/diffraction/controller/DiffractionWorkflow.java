package ptychodus.diffraction.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.api.BadPixelsFileReader;
import ptychodus.diffraction.api.DiffractionDataset;
import ptychodus.diffraction.api.DiffractionFileReader;
import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionMetadata;
import ptychodus.diffraction.service.AssembledDiffractionDataset;
import ptychodus.diffraction.service.FileReaderRegistry;
import ptychodus.diffraction.service.LoadAllArrays;
import ptychodus.diffraction.service.TaskManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for scripted diffraction workflows: open a file, assemble, export.
 * <p>
 * Methods are meant to be called from the consumer thread, which is also where
 * {@link #finishAssemblingPatterns(boolean)} runs foreground tasks.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class DiffractionWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(DiffractionWorkflow.class);

    private final AssembledDiffractionDataset dataset;
    private final TaskManager taskManager;
    private final FileReaderRegistry<DiffractionFileReader> patternReaders;
    private final FileReaderRegistry<BadPixelsFileReader> badPixelsReaders;

    private LoadAllArrays loadTask;

    public DiffractionWorkflow(AssembledDiffractionDataset dataset, TaskManager taskManager,
                               FileReaderRegistry<DiffractionFileReader> patternReaders,
                               FileReaderRegistry<BadPixelsFileReader> badPixelsReaders) {
        this.dataset = Objects.requireNonNull(dataset, "Dataset must not be null");
        this.taskManager = Objects.requireNonNull(taskManager, "Task manager must not be null");
        this.patternReaders = Objects.requireNonNull(patternReaders, "Pattern readers must not be null");
        this.badPixelsReaders = Objects.requireNonNull(badPixelsReaders, "Bad pixel readers must not be null");
    }

    public AssembledDiffractionDataset getDataset() {
        return dataset;
    }

    // ==================== Patterns ====================

    /**
     * Reads a pattern file and reloads the dataset from it. Arrays are not loaded until
     * {@link #startAssemblingPatterns()}.
     *
     * @param filePath file to open
     * @param fileType registered file type
     * @return 0 on success, -1 if the path is not a file
     * @throws IllegalArgumentException if no reader is registered for the file type
     * @throws IOException              if the file cannot be read
     */
    public int openPatterns(Path filePath, String fileType) throws IOException {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            logger.warn("Refusing to load patterns from invalid file path {}", filePath);
            return -1;
        }
        DiffractionFileReader reader = patternReaders.getReader(fileType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown diffraction file type: " + fileType));

        logger.info("Reading {} as {}", filePath, fileType);
        DiffractionDataset source = reader.read(filePath);
        dataset.reload(source, true);
        return 0;
    }

    /**
     * Schedules loading of every array of the opened dataset.
     */
    public void startAssemblingPatterns() {
        loadTask = dataset.loadAllArrays();
    }

    /**
     * Runs pending foreground tasks on the calling thread.
     *
     * @param block if true, first wait until every scheduled load has finished
     * @return number of foreground tasks run
     */
    public int finishAssemblingPatterns(boolean block) {
        if (block && taskManager.getState() == TaskManager.State.RUNNING) {
            taskManager.awaitBackgroundTasks();
            if (loadTask != null) {
                try {
                    if (!loadTask.awaitFinished(1, TimeUnit.HOURS)) {
                        logger.warn("Timed out waiting for arrays to load");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while waiting for arrays to load");
                }
            }
        }
        return taskManager.runForegroundTasks();
    }

    public void closePatterns() {
        loadTask = null;
        dataset.clear();
    }

    /**
     * Creates a streaming context for arrays announced by the given metadata.
     */
    public PatternsStreamingContext createStreamingContext(DiffractionMetadata metadata) {
        return new PatternsStreamingContext(dataset, taskManager, metadata);
    }

    // ==================== Bad pixels ====================

    /**
     * Reads a bad-pixel map. It applies from the next open or reload.
     *
     * @return 0 on success, -1 if the path is not a file
     */
    public int openBadPixels(Path filePath, String fileType) throws IOException {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            logger.warn("Refusing to load bad pixels from invalid file path {}", filePath);
            return -1;
        }
        BadPixelsFileReader reader = badPixelsReaders.getReader(fileType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown bad pixels file type: " + fileType));
        BadPixels badPixels = reader.read(filePath);
        dataset.setBadPixels(badPixels);
        return 0;
    }

    public void clearBadPixels() {
        dataset.setBadPixels(null);
    }

    // ==================== Snapshots ====================

    public void importAssembledPatterns(Path filePath) throws IOException {
        dataset.importAssembledPatterns(filePath);
    }

    public int exportAssembledPatterns(Path filePath) throws IOException {
        return dataset.exportAssembledPatterns(filePath);
    }
}
