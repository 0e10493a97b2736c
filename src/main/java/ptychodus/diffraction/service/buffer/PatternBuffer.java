package ptychodus.diffraction.service.buffer;

import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.PatternDataType;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Fixed-size store for the processed patterns of a whole dataset.
 * <p>
 * Each pattern slot can be written at most once; a write seals the slots it covers.
 * Writers of disjoint slot ranges need no coordination. Reads are safe from any thread
 * but may observe slots that are not yet written (all zeros).
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public interface PatternBuffer extends Closeable {

    PatternDataType getDataType();

    int getNumPatterns();

    ImageExtent getPatternExtent();

    long getSizeInBytes();

    /**
     * Whether the buffer lives in a scratch file rather than on the heap.
     */
    boolean isFileBacked();

    /**
     * Copies a batch into slots {@code [offset, offset + n)} and seals them.
     *
     * @throws IllegalArgumentException if the batch type or extent does not match
     * @throws IllegalStateException    if any target slot is already sealed, or the buffer is closed
     * @throws IndexOutOfBoundsException if the range exceeds the buffer
     */
    void writePatterns(int offset, DiffractionPatterns patterns);

    /**
     * Copies the raw little-endian bytes of one pattern into a slot and seals it.
     */
    void writePattern(int index, ByteBuffer bytes);

    boolean isSealed(int index);

    /**
     * Returns a read-only view of one slot's bytes. The view is backed by the buffer.
     */
    ByteBuffer getPatternBytes(int index);

    /**
     * Copies slots {@code [offset, offset + count)} into a new heap batch.
     */
    DiffractionPatterns readPatterns(int offset, int count);

    boolean isClosed();

    @Override
    void close() throws IOException;
}
