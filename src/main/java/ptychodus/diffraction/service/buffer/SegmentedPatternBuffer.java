package ptychodus.diffraction.service.buffer;

import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.InvalidShapeException;
import ptychodus.diffraction.model.PatternDataType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Pattern buffer split into {@link ByteBuffer} segments, each holding a whole number of
 * patterns and staying below the 2 GB limit of a single buffer.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
abstract class SegmentedPatternBuffer implements PatternBuffer {

    /** Largest segment size in bytes */
    static final int DEFAULT_MAX_SEGMENT_BYTES = Integer.MAX_VALUE - 8;

    private final PatternDataType dataType;
    private final int numPatterns;
    private final ImageExtent patternExtent;
    private final int patternBytes;
    private final int patternsPerSegment;
    private final List<ByteBuffer> segments;
    private final BitSet sealed;
    private volatile boolean closed = false;

    protected SegmentedPatternBuffer(PatternDataType dataType, int numPatterns, ImageExtent patternExtent,
                                     int maxSegmentBytes, List<ByteBuffer> segments) {
        this.dataType = dataType;
        this.numPatterns = numPatterns;
        this.patternExtent = patternExtent;
        this.patternBytes = patternBytes(dataType, patternExtent);
        this.patternsPerSegment = patternsPerSegment(patternBytes, maxSegmentBytes);
        this.segments = List.copyOf(segments);
        this.sealed = new BitSet(numPatterns);
    }

    static int patternBytes(PatternDataType dataType, ImageExtent extent) {
        long bytes = (long) extent.getNumPixels() * dataType.getByteSize();
        if (bytes > DEFAULT_MAX_SEGMENT_BYTES) {
            throw new IllegalArgumentException("Single pattern too large: " + bytes + " bytes");
        }
        return (int) bytes;
    }

    static int patternsPerSegment(int patternBytes, int maxSegmentBytes) {
        if (patternBytes <= 0) {
            return Integer.MAX_VALUE;
        }
        int perSegment = maxSegmentBytes / patternBytes;
        if (perSegment < 1) {
            throw new IllegalArgumentException(String.format(
                    "Pattern of %d bytes exceeds segment size %d", patternBytes, maxSegmentBytes));
        }
        return perSegment;
    }

    /**
     * Byte sizes of the segments needed for the given layout.
     */
    static int[] segmentSizes(PatternDataType dataType, int numPatterns, ImageExtent extent, int maxSegmentBytes) {
        int bytes = patternBytes(dataType, extent);
        if (numPatterns == 0 || bytes == 0) {
            return new int[0];
        }
        int perSegment = patternsPerSegment(bytes, maxSegmentBytes);
        int numSegments = (int) ((numPatterns + (long) perSegment - 1) / perSegment);
        int[] sizes = new int[numSegments];
        for (int i = 0; i < numSegments; i++) {
            int patternsInSegment = Math.min(perSegment, numPatterns - i * perSegment);
            sizes[i] = patternsInSegment * bytes;
        }
        return sizes;
    }

    @Override
    public PatternDataType getDataType() {
        return dataType;
    }

    @Override
    public int getNumPatterns() {
        return numPatterns;
    }

    @Override
    public ImageExtent getPatternExtent() {
        return patternExtent;
    }

    @Override
    public long getSizeInBytes() {
        return (long) numPatterns * patternBytes;
    }

    int getNumSegments() {
        return segments.size();
    }

    @Override
    public void writePatterns(int offset, DiffractionPatterns patterns) {
        Objects.requireNonNull(patterns, "Patterns must not be null");
        if (patterns.getDataType() != dataType) {
            throw new IllegalArgumentException(String.format("Cannot write %s patterns into %s buffer",
                    patterns.getDataType().getTypeName(), dataType.getTypeName()));
        }
        if (!patterns.getExtent().equals(patternExtent)) {
            throw new InvalidShapeException(String.format("Pattern extent %s does not match buffer extent %s",
                    patterns.getExtent(), patternExtent));
        }
        int count = patterns.getNumPatterns();
        Objects.checkFromIndexSize(offset, count, numPatterns);
        claim(offset, count);
        for (int i = 0; i < count; i++) {
            copyInto(offset + i, patterns.getPatternBytes(i));
        }
    }

    @Override
    public void writePattern(int index, ByteBuffer bytes) {
        Objects.checkIndex(index, numPatterns);
        if (bytes.remaining() != patternBytes) {
            throw new IllegalArgumentException(String.format("Expected %d bytes but got %d",
                    patternBytes, bytes.remaining()));
        }
        claim(index, 1);
        copyInto(index, bytes.duplicate());
    }

    // Seals the range first so a concurrent duplicate write fails instead of racing
    private void claim(int offset, int count) {
        checkOpen();
        synchronized (sealed) {
            int next = sealed.nextSetBit(offset);
            if (next >= 0 && next < offset + count) {
                throw new IllegalStateException("Pattern slot " + next + " has already been written");
            }
            sealed.set(offset, offset + count);
        }
    }

    private void copyInto(int index, ByteBuffer source) {
        if (patternBytes == 0) {
            return;
        }
        ByteBuffer target = segments.get(index / patternsPerSegment).duplicate();
        target.position((index % patternsPerSegment) * patternBytes);
        target.put(source);
    }

    @Override
    public boolean isSealed(int index) {
        synchronized (sealed) {
            return sealed.get(index);
        }
    }

    @Override
    public ByteBuffer getPatternBytes(int index) {
        checkOpen();
        Objects.checkIndex(index, numPatterns);
        if (patternBytes == 0) {
            return ByteBuffer.allocate(0).order(ByteOrder.LITTLE_ENDIAN);
        }
        ByteBuffer view = segments.get(index / patternsPerSegment).asReadOnlyBuffer();
        int start = (index % patternsPerSegment) * patternBytes;
        view.position(start);
        view.limit(start + patternBytes);
        return view.slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public DiffractionPatterns readPatterns(int offset, int count) {
        Objects.checkFromIndexSize(offset, count, numPatterns);
        ByteBuffer target = ByteBuffer.allocate(Math.multiplyExact(count, patternBytes)).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < count; i++) {
            target.put(getPatternBytes(offset + i));
        }
        return DiffractionPatterns.wrap(dataType, count, patternExtent.heightPx(), patternExtent.widthPx(), target);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    protected void markClosed() {
        closed = true;
    }

    protected void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Pattern buffer is closed");
        }
    }

    @Override
    public String toString() {
        return String.format("%s{%d x %s %s, %d segments}", getClass().getSimpleName(),
                numPatterns, patternExtent, dataType.getTypeName(), segments.size());
    }
}
