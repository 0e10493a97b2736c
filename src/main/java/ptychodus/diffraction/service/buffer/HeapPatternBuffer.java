package ptychodus.diffraction.service.buffer;

import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.PatternDataType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Pattern buffer held in heap memory.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class HeapPatternBuffer extends SegmentedPatternBuffer {

    public HeapPatternBuffer(PatternDataType dataType, int numPatterns, ImageExtent patternExtent) {
        this(dataType, numPatterns, patternExtent, DEFAULT_MAX_SEGMENT_BYTES);
    }

    HeapPatternBuffer(PatternDataType dataType, int numPatterns, ImageExtent patternExtent, int maxSegmentBytes) {
        super(dataType, numPatterns, patternExtent, maxSegmentBytes,
                allocate(dataType, numPatterns, patternExtent, maxSegmentBytes));
    }

    private static List<ByteBuffer> allocate(PatternDataType dataType, int numPatterns,
                                             ImageExtent extent, int maxSegmentBytes) {
        List<ByteBuffer> segments = new ArrayList<>();
        for (int size : segmentSizes(dataType, numPatterns, extent, maxSegmentBytes)) {
            segments.add(ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN));
        }
        return segments;
    }

    @Override
    public boolean isFileBacked() {
        return false;
    }

    @Override
    public void close() {
        markClosed();
    }
}
