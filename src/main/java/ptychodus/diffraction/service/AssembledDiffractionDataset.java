package ptychodus.diffraction.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.api.BadPixelsProvider;
import ptychodus.diffraction.api.DiffractionArray;
import ptychodus.diffraction.api.DiffractionDataset;
import ptychodus.diffraction.api.DiffractionDatasetObserver;
import ptychodus.diffraction.model.AssembledDiffractionData;
import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionMetadata;
import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.InvalidShapeException;
import ptychodus.diffraction.model.MissingBadPixelsException;
import ptychodus.diffraction.model.PatternDataType;
import ptychodus.diffraction.preferences.DiffractionSettings;
import ptychodus.diffraction.service.buffer.PatternBuffer;
import ptychodus.diffraction.service.buffer.PatternBufferFactory;
import ptychodus.diffraction.utilities.PatternProcessor;
import ptychodus.diffraction.utilities.PatternSizer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assembles the processed patterns of a diffraction dataset into one shared buffer.
 * <p>
 * On {@link #reload} the dataset sizes a buffer for every pattern the metadata
 * announces and gives array {@code i} the slot range starting at the sum of the
 * counts of arrays {@code 0..i-1}. Arrays are read and processed off the consumer
 * thread by {@link LoadArray} tasks; their results are written into the buffer,
 * and their views published, only by foreground tasks on the consumer thread.
 * Completion order therefore does not affect the final layout.
 * <p>
 * Each reload, clear or import starts a new generation. Results that belong to an
 * earlier generation are dropped when they reach the consumer thread.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class AssembledDiffractionDataset implements BadPixelsProvider {

    private static final Logger logger = LoggerFactory.getLogger(AssembledDiffractionDataset.class);

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    /**
     * Everything that belongs to one generation. Replaced as a whole.
     */
    private static final class Generation {
        final long id;
        final String label;
        final DiffractionMetadata metadata;
        final List<DiffractionArray> sourceArrays;
        final PatternBuffer buffer;
        final long[] indexes;
        final double[] patternCounts;
        final int[] arrayOffsets;
        final BadPixels processedBadPixels;
        final PatternProcessor processor;
        final List<AssembledDiffractionPatternArray> arrays = new CopyOnWriteArrayList<>();
        int arrayCounter = 0;  // guarded by dataset lock

        Generation(long id, String label, DiffractionMetadata metadata, List<DiffractionArray> sourceArrays,
                   PatternBuffer buffer, BadPixels processedBadPixels, PatternProcessor processor) {
            this.id = id;
            this.label = label;
            this.metadata = metadata;
            this.sourceArrays = List.copyOf(sourceArrays);
            this.buffer = buffer;
            this.processedBadPixels = processedBadPixels;
            this.processor = processor;
            this.indexes = new long[buffer.getNumPatterns()];
            Arrays.fill(this.indexes, -1L);
            this.patternCounts = new double[buffer.getNumPatterns()];
            this.arrayOffsets = computeArrayOffsets(metadata.getNumPatternsPerArray());
        }
    }

    private final DiffractionSettings settings;
    private final PatternSizer sizer;
    private final BackgroundTaskManager backgroundTaskManager;
    private final ForegroundTaskManager foregroundTaskManager;
    private final List<DiffractionDatasetObserver> observers = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();
    private final AtomicLong generationCounter = new AtomicLong();

    private volatile Generation generation;
    private volatile BadPixels badPixels;

    public AssembledDiffractionDataset(DiffractionSettings settings, BackgroundTaskManager backgroundTaskManager,
                                       ForegroundTaskManager foregroundTaskManager) {
        this.settings = Objects.requireNonNull(settings, "Settings must not be null");
        this.sizer = new PatternSizer(settings);
        this.backgroundTaskManager = Objects.requireNonNull(backgroundTaskManager,
                "Background task manager must not be null");
        this.foregroundTaskManager = Objects.requireNonNull(foregroundTaskManager,
                "Foreground task manager must not be null");
        this.generation = createNullGeneration();
    }

    /**
     * Convenience constructor for a {@link TaskManager} serving both queues.
     */
    public AssembledDiffractionDataset(DiffractionSettings settings, TaskManager taskManager) {
        this(settings, taskManager, taskManager);
    }

    /**
     * Slot offset of each array; element {@code i} is the sum of the first {@code i}
     * counts and the last element is the total.
     */
    public static int[] computeArrayOffsets(List<Integer> numPatternsPerArray) {
        int[] offsets = new int[numPatternsPerArray.size() + 1];
        for (int i = 0; i < numPatternsPerArray.size(); i++) {
            offsets[i + 1] = Math.addExact(offsets[i], numPatternsPerArray.get(i));
        }
        return offsets;
    }

    // ==================== Observers ====================

    public void addObserver(DiffractionDatasetObserver observer) {
        if (observer != null && !observers.contains(observer)) {
            observers.add(observer);
        }
    }

    public void removeObserver(DiffractionDatasetObserver observer) {
        observers.remove(observer);
    }

    private void notifyReloaded() {
        for (DiffractionDatasetObserver observer : observers) {
            observer.handleDatasetReloaded();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Drops all assembled data and returns to the empty dataset.
     */
    public void clear() {
        replaceGeneration(createNullGeneration());
        logger.info("Cleared assembled patterns");
        notifyReloaded();
    }

    /**
     * Prepares for a new dataset: sizes the buffer from the metadata and remembers the
     * source arrays for {@link #loadAllArrays()}. Nothing is read yet.
     *
     * @param dataset         source dataset
     * @param processPatterns false to keep raw patterns
     * @throws MissingBadPixelsException if bad pixels are required but not set
     * @throws InvalidShapeException     if the bad pixels do not match the detector or the crop does not fit
     * @throws IOException               if a scratch file cannot be allocated
     */
    public void reload(DiffractionDataset dataset, boolean processPatterns) throws IOException {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        DiffractionMetadata metadata = dataset.getMetadata();
        ImageExtent detectorExtent = metadata.getDetectorExtent().orElseGet(sizer::getDetectorExtent);
        Optional<BadPixels> shippedBadPixels = dataset.getBadPixels();
        if (shippedBadPixels.isPresent()) {
            applyBadPixels(shippedBadPixels.get(), detectorExtent);
        }

        BadPixels rawBadPixels = badPixels;
        if (rawBadPixels == null) {
            if (settings.isBadPixelsRequired()) {
                throw new MissingBadPixelsException("Missing bad pixels!");
            }
            rawBadPixels = BadPixels.none(detectorExtent);
        } else if (!rawBadPixels.getExtent().equals(detectorExtent)) {
            throw new InvalidShapeException(String.format("Bad pixel extent %s does not match detector extent %s",
                    rawBadPixels.getExtent(), detectorExtent));
        }

        PatternProcessor processor = processPatterns ? sizer.createProcessor(detectorExtent) : null;
        BadPixels processedBadPixels = processor != null ? processor.processBadPixels(rawBadPixels) : rawBadPixels;
        ImageExtent patternExtent = processedBadPixels.getExtent();
        int numPatterns = Math.toIntExact(metadata.getNumPatternsTotal());

        // Close the old buffer before allocating a new one of similar size
        replaceGeneration(createNullGeneration());
        PatternBuffer buffer;
        try {
            buffer = PatternBufferFactory.createBuffer(settings, metadata.getPatternDataType(),
                    numPatterns, patternExtent);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to allocate buffer for {} patterns of {}", numPatterns, patternExtent, e);
            // Observers must drop views of the closed buffer
            notifyReloaded();
            throw e;
        }
        String label = metadata.getFilePath().map(AssembledDiffractionDataset::stemOf).orElse("None");
        replaceGeneration(new Generation(generationCounter.incrementAndGet(), label, metadata,
                dataset.getArrays(), buffer, processedBadPixels, processor));

        logger.info("Reloaded {} with {} arrays, {} patterns of {}", label,
                metadata.getNumPatternsPerArray().size(), numPatterns, patternExtent);
        notifyReloaded();
    }

    private Generation createNullGeneration() {
        return new Generation(generationCounter.incrementAndGet(), "None", DiffractionMetadata.createNull(),
                List.of(), PatternBufferFactory.createNullBuffer(), BadPixels.none(new ImageExtent(0, 0)), null);
    }

    private void replaceGeneration(Generation next) {
        Generation previous;
        synchronized (lock) {
            previous = generation;
            generation = next;
        }
        if (previous != null) {
            try {
                previous.buffer.close();
            } catch (IOException e) {
                logger.warn("Failed to close pattern buffer", e);
            }
        }
    }

    /**
     * Identifier of the current generation. Changes on every clear, reload and import.
     */
    public long getGeneration() {
        return generation.id;
    }

    // ==================== Loading ====================

    /**
     * Creates a loader for one array of the current generation. The loader takes the
     * next submission index, which fixes its slot range.
     */
    public BackgroundTask createArrayLoader(DiffractionArray array) {
        Generation current = generation;
        return createArrayLoader(current, array, current.processor != null);
    }

    /**
     * Creates a loader, overriding whether patterns are processed.
     */
    public BackgroundTask createArrayLoader(DiffractionArray array, boolean processPatterns) {
        Generation current = generation;
        return createArrayLoader(current, array, processPatterns);
    }

    private BackgroundTask createArrayLoader(Generation current, DiffractionArray array, boolean processPatterns) {
        int arrayIndex;
        synchronized (lock) {
            arrayIndex = current.arrayCounter++;
        }
        return createArrayLoader(current, arrayIndex, array, processPatterns);
    }

    private BackgroundTask createArrayLoader(Generation current, int arrayIndex, DiffractionArray array,
                                             boolean processPatterns) {
        PatternProcessor processor = processPatterns
                ? (current.processor != null ? current.processor : PatternProcessor.identity())
                : null;
        return new LoadArray(arrayIndex, array, current.processedBadPixels, processor,
                (index, label, data) -> assembleArray(current, index, label, data));
    }

    /**
     * Schedules loading of every source array given to the last {@link #reload}.
     * Each array keeps the index of its position in the source, so calling this again
     * retries the arrays that failed; arrays already assembled are skipped.
     *
     * @return handle to wait on
     */
    public LoadAllArrays loadAllArrays() {
        Generation current = generation;
        synchronized (lock) {
            // Later appended arrays must not reuse a source position
            current.arrayCounter = Math.max(current.arrayCounter, current.sourceArrays.size());
        }
        LoadAllArrays task = new LoadAllArrays(current.sourceArrays,
                (arrayIndex, array) -> createArrayLoader(current, arrayIndex, array, current.processor != null),
                foregroundTaskManager, settings.getNumDataThreads());
        backgroundTaskManager.putBackgroundTask(task);
        return task;
    }

    /**
     * Schedules one more array, e.g. while streaming.
     */
    public void appendArray(DiffractionArray array) {
        backgroundTaskManager.putBackgroundTask(createArrayLoader(array));
    }

    /**
     * Number of queued background and foreground tasks.
     */
    public int getQueueSize() {
        return backgroundTaskManager.getBackgroundQueueSize() + foregroundTaskManager.getForegroundQueueSize();
    }

    // Consumer thread only
    private void assembleArray(Generation target, int arrayIndex, String label, AssembledDiffractionData data) {
        if (target != generation) {
            logger.debug("Discarding array {} \"{}\" from stale generation {}", arrayIndex, label, target.id);
            return;
        }
        int numArrays = target.arrayOffsets.length - 1;
        if (arrayIndex >= numArrays) {
            logger.warn("Discarding array {} \"{}\": dataset only has {} arrays", arrayIndex, label, numArrays);
            return;
        }

        int position = insertionPoint(target.arrays, arrayIndex);
        if (position > 0 && target.arrays.get(position - 1).getArrayIndex() == arrayIndex) {
            logger.debug("Skipping array {} \"{}\": already assembled", arrayIndex, label);
            return;
        }

        int offset = target.arrayOffsets[arrayIndex];
        int capacity = target.arrayOffsets[arrayIndex + 1] - offset;
        int count = data.getNumPatterns();
        if (count > capacity) {
            throw new IllegalStateException(String.format("Array %d \"%s\" has %d patterns but %d were announced",
                    arrayIndex, label, count, capacity));
        }

        target.buffer.writePatterns(offset, data.patterns());
        System.arraycopy(data.patternCounts(), 0, target.patternCounts, offset, count);
        System.arraycopy(data.indexes(), 0, target.indexes, offset, count);

        AssembledDiffractionPatternArray view = new AssembledDiffractionPatternArray(label, arrayIndex,
                target.buffer, offset, data.indexes().clone(), data.patternCounts().clone(),
                target.processedBadPixels, () -> generation == target);

        target.arrays.add(position, view);
        logger.debug("Assembled array {} \"{}\" at position {} ({} patterns)", arrayIndex, label, position, count);

        for (DiffractionDatasetObserver observer : observers) {
            observer.handleArrayInserted(position);
        }
    }

    // First position whose array index is greater than the given one
    private static int insertionPoint(List<AssembledDiffractionPatternArray> arrays, int arrayIndex) {
        int low = 0;
        int high = arrays.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (arrays.get(mid).getArrayIndex() <= arrayIndex) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    // ==================== Views ====================

    public DiffractionMetadata getMetadata() {
        return generation.metadata;
    }

    public PatternDataType getPatternDataType() {
        return generation.buffer.getDataType();
    }

    public ImageExtent getPatternExtent() {
        return generation.buffer.getPatternExtent();
    }

    /**
     * Number of assembled arrays.
     */
    public int size() {
        return generation.arrays.size();
    }

    public AssembledDiffractionPatternArray get(int position) {
        return generation.arrays.get(position);
    }

    /**
     * Assembled arrays ordered by submission index.
     */
    public List<AssembledDiffractionPatternArray> getArrays() {
        return Collections.unmodifiableList(new ArrayList<>(generation.arrays));
    }

    /**
     * Indexes of all filled slots, in slot order.
     */
    public long[] getAssembledIndexes() {
        return Arrays.stream(generation.indexes).filter(index -> index >= 0).toArray();
    }

    /**
     * Copies the patterns of all filled slots, in slot order.
     */
    public DiffractionPatterns getAssembledPatterns() {
        Generation current = generation;
        PatternBuffer buffer = current.buffer;
        ImageExtent extent = buffer.getPatternExtent();
        int[] slots = filledSlots(current);
        int patternBytes = extent.getNumPixels() * buffer.getDataType().getByteSize();
        ByteBuffer bytes = ByteBuffer.allocate(Math.multiplyExact(slots.length, patternBytes))
                .order(ByteOrder.LITTLE_ENDIAN);
        for (int slot : slots) {
            bytes.put(buffer.getPatternBytes(slot));
        }
        return DiffractionPatterns.wrap(buffer.getDataType(), slots.length, extent.heightPx(), extent.widthPx(), bytes);
    }

    /**
     * Good-pixel counts of all filled slots, in slot order.
     */
    public double[] getAssembledPatternCounts() {
        Generation current = generation;
        return Arrays.stream(filledSlots(current)).mapToDouble(slot -> current.patternCounts[slot]).toArray();
    }

    /**
     * Map from pattern index to good-pixel counts for all filled slots.
     */
    public Map<Long, Double> getPatternCountsLut() {
        Generation current = generation;
        Map<Long, Double> lut = new LinkedHashMap<>();
        for (int slot : filledSlots(current)) {
            lut.put(current.indexes[slot], current.patternCounts[slot]);
        }
        return lut;
    }

    public double getMaximumPatternCounts() {
        double max = 0.0;
        for (AssembledDiffractionPatternArray array : generation.arrays) {
            max = Math.max(max, array.getMaxPatternCounts());
        }
        return max;
    }

    /**
     * One-line summary, e.g. {@code scan: 100 x 64W x 64H uint16 [0.78MB]}.
     */
    public String getInfoText() {
        Generation current = generation;
        PatternBuffer buffer = current.buffer;
        ImageExtent extent = buffer.getPatternExtent();
        return String.format("%s: %d x %dW x %dH %s [%.2fMB]", current.label, buffer.getNumPatterns(),
                extent.widthPx(), extent.heightPx(), buffer.getDataType().getTypeName(),
                buffer.getSizeInBytes() / BYTES_PER_MB);
    }

    private static int[] filledSlots(Generation current) {
        long[] indexes = current.indexes;
        int[] slots = new int[indexes.length];
        int count = 0;
        for (int slot = 0; slot < indexes.length; slot++) {
            if (indexes[slot] >= 0) {
                slots[count++] = slot;
            }
        }
        return Arrays.copyOf(slots, count);
    }

    // ==================== Bad pixels ====================

    @Override
    public Optional<BadPixels> getBadPixels() {
        return Optional.ofNullable(badPixels);
    }

    /**
     * Replaces the raw bad-pixel map. It takes effect on the next reload.
     *
     * @param badPixels mask with the detector extent, or null to clear
     * @throws InvalidShapeException if the extent does not match the detector
     */
    @Override
    public void setBadPixels(BadPixels badPixels) {
        applyBadPixels(badPixels, generation.metadata.getDetectorExtent().orElseGet(sizer::getDetectorExtent));
    }

    private void applyBadPixels(BadPixels badPixels, ImageExtent detectorExtent) {
        if (badPixels != null) {
            if (!badPixels.getExtent().equals(detectorExtent)) {
                throw new InvalidShapeException(String.format(
                        "Bad pixel extent %s does not match detector extent %s",
                        badPixels.getExtent(), detectorExtent));
            }
        }
        this.badPixels = badPixels;
        int numBadPixels = badPixels == null ? 0 : badPixels.countBadPixels();
        logger.info("Bad pixels changed: {} bad pixels", numBadPixels);
        for (DiffractionDatasetObserver observer : observers) {
            observer.handleBadPixelsChanged(numBadPixels);
        }
    }

    /**
     * The bad-pixel mask after processing, as used for the current generation.
     */
    public BadPixels getProcessedBadPixels() {
        return generation.processedBadPixels;
    }

    // ==================== Snapshots ====================

    /**
     * Writes the filled slots and the processed bad-pixel mask to a snapshot file.
     *
     * @return number of patterns exported
     * @throws IOException if the file cannot be written
     */
    public int exportAssembledPatterns(Path filePath) throws IOException {
        Generation current = generation;
        AssembledPatternsFile.Compression compression =
                AssembledPatternsFile.Compression.fromName(settings.getSnapshotCompression());
        return AssembledPatternsFile.write(filePath, compression, current.buffer, current.indexes.clone(),
                current.processedBadPixels);
    }

    /**
     * Replaces the dataset with the contents of a snapshot file, as a single array
     * labelled with the file name stem. A path that is not a regular file is refused
     * with a warning and leaves the dataset unchanged.
     *
     * @throws IOException if the file is unreadable or malformed
     */
    public void importAssembledPatterns(Path filePath) throws IOException {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            logger.warn("Refusing to import assembled patterns from invalid file path {}", filePath);
            return;
        }

        AssembledPatternsFile.Contents contents = AssembledPatternsFile.read(filePath,
                (dataType, numPatterns, extent) -> PatternBufferFactory.createBuffer(settings, dataType, numPatterns, extent));
        PatternBuffer buffer = contents.buffer();
        ImageExtent extent = buffer.getPatternExtent();
        BadPixels importedBadPixels = contents.badPixels() != null ? contents.badPixels() : BadPixels.none(extent);
        int numPatterns = buffer.getNumPatterns();
        String label = stemOf(filePath);

        DiffractionMetadata metadata = DiffractionMetadata.builder()
                .numPatternsPerArray(List.of(numPatterns))
                .patternDataType(buffer.getDataType())
                .detectorExtent(extent)
                .filePath(filePath)
                .build();
        Generation imported = new Generation(generationCounter.incrementAndGet(), label, metadata, List.of(),
                buffer, importedBadPixels, null);

        double[] counts = new double[numPatterns];
        for (int i = 0; i < numPatterns; i++) {
            counts[i] = AssembledDiffractionData.computePatternCounts(buffer.readPatterns(i, 1), importedBadPixels)[0];
        }
        System.arraycopy(contents.indexes(), 0, imported.indexes, 0, numPatterns);
        System.arraycopy(counts, 0, imported.patternCounts, 0, numPatterns);
        imported.arrayCounter = 1;
        imported.arrays.add(new AssembledDiffractionPatternArray(label, 0, buffer, 0, contents.indexes().clone(),
                counts, importedBadPixels, () -> generation == imported));

        // The imported mask is already processed; the raw mask stays as it was
        replaceGeneration(imported);
        logger.info("Imported {} patterns from {}", numPatterns, filePath);
        notifyReloaded();
    }

    private static String stemOf(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return filePath.toString();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
