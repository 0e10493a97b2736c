package ptychodus.diffraction.service.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.PatternDataType;
import ptychodus.diffraction.preferences.DiffractionSettings;

import java.io.IOException;

/**
 * Chooses and creates the {@link PatternBuffer} backend for a dataset.
 * <p>
 * A file-backed buffer is used when memory mapping is enabled in settings, or when the
 * buffer would be at least as large as the configured threshold. Otherwise the buffer
 * is allocated on the heap.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public final class PatternBufferFactory {

    private static final Logger logger = LoggerFactory.getLogger(PatternBufferFactory.class);

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private PatternBufferFactory() {
        // Utility class - no instantiation
    }

    /**
     * Creates a buffer for {@code numPatterns} patterns of the given type and extent.
     *
     * @throws IOException if a scratch file is needed and cannot be created
     */
    public static PatternBuffer createBuffer(DiffractionSettings settings, PatternDataType dataType,
                                             int numPatterns, ImageExtent patternExtent) throws IOException {
        long sizeInBytes = (long) numPatterns * patternExtent.getNumPixels() * dataType.getByteSize();
        if (isFileBacked(settings, sizeInBytes)) {
            return MappedFilePatternBuffer.create(settings.getScratchDirectory(), dataType,
                    numPatterns, patternExtent);
        }
        logger.info("Scratch memory is {} MB", String.format("%.1f", sizeInBytes / (double) BYTES_PER_MB));
        return new HeapPatternBuffer(dataType, numPatterns, patternExtent);
    }

    /**
     * The zero-size buffer of an empty dataset.
     */
    public static PatternBuffer createNullBuffer() {
        return new HeapPatternBuffer(PatternDataType.UINT8, 0, new ImageExtent(0, 0));
    }

    static boolean isFileBacked(DiffractionSettings settings, long sizeInBytes) {
        if (settings.isMemmapEnabled()) {
            return true;
        }
        long threshold = settings.getMemmapThresholdMB();
        return threshold > 0 && sizeInBytes >= threshold * BYTES_PER_MB;
    }
}
