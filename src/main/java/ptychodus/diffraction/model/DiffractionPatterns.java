package ptychodus.diffraction.model;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * A batch of diffraction patterns with shape (n, height, width).
 * <p>
 * Elements are stored row-major in a little-endian {@link ByteBuffer} in their
 * native {@link PatternDataType}. All access is absolute, so a batch can be read
 * from several threads at once; writes are expected to happen before the batch is
 * shared.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public final class DiffractionPatterns {

    private final PatternDataType dataType;
    private final int numPatterns;
    private final int height;
    private final int width;
    private final ByteBuffer data;

    private DiffractionPatterns(PatternDataType dataType, int numPatterns, int height, int width,
                                ByteBuffer data) {
        this.dataType = dataType;
        this.numPatterns = numPatterns;
        this.height = height;
        this.width = width;
        this.data = data;
    }

    /**
     * Allocates a zero-filled batch.
     */
    public static DiffractionPatterns allocate(PatternDataType dataType, int numPatterns,
                                               int height, int width) {
        Objects.requireNonNull(dataType, "Data type must not be null");
        int size = byteSize(dataType, numPatterns, height, width);
        return new DiffractionPatterns(dataType, numPatterns, height, width,
                ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN));
    }

    /**
     * Wraps an existing buffer. The buffer's content from position zero is used
     * and must hold at least {@code n * height * width} elements.
     */
    public static DiffractionPatterns wrap(PatternDataType dataType, int numPatterns,
                                           int height, int width, ByteBuffer buffer) {
        Objects.requireNonNull(dataType, "Data type must not be null");
        Objects.requireNonNull(buffer, "Buffer must not be null");
        int size = byteSize(dataType, numPatterns, height, width);
        if (buffer.capacity() < size) {
            throw new InvalidShapeException(String.format(
                    "Buffer of %d bytes is too small for %d x %d x %d %s",
                    buffer.capacity(), numPatterns, height, width, dataType.getTypeName()));
        }
        ByteBuffer view = buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        view.clear();
        return new DiffractionPatterns(dataType, numPatterns, height, width, view);
    }

    /**
     * Wraps a single 2-D pattern as a batch of one.
     */
    public static DiffractionPatterns of2D(PatternDataType dataType, int height, int width,
                                           ByteBuffer buffer) {
        return wrap(dataType, 1, height, width, buffer);
    }

    /**
     * Wraps a buffer with an arbitrary shape. Rank-2 shapes are promoted to a batch of
     * one; any rank other than 2 or 3 is rejected.
     *
     * @throws InvalidShapeException if the rank is unsupported
     */
    public static DiffractionPatterns fromShape(PatternDataType dataType, int[] shape,
                                                ByteBuffer buffer) {
        Objects.requireNonNull(shape, "Shape must not be null");
        return switch (shape.length) {
            case 2 -> of2D(dataType, shape[0], shape[1], buffer);
            case 3 -> wrap(dataType, shape[0], shape[1], shape[2], buffer);
            default -> throw new InvalidShapeException(
                    "Invalid diffraction pattern dimensions! Got " + Arrays.toString(shape));
        };
    }

    /**
     * Builds an integer batch from nested values, mainly for readers and tests.
     */
    public static DiffractionPatterns ofValues(PatternDataType dataType, long[][][] values) {
        int n = values.length;
        int h = n > 0 ? values[0].length : 0;
        int w = h > 0 ? values[0][0].length : 0;
        DiffractionPatterns patterns = allocate(dataType, n, h, w);
        for (int p = 0; p < n; p++) {
            for (int y = 0; y < h; y++) {
                if (values[p][y].length != w) {
                    throw new InvalidShapeException("Ragged pattern rows are not supported");
                }
                for (int x = 0; x < w; x++) {
                    patterns.setLong(p, y, x, values[p][y][x]);
                }
            }
        }
        return patterns;
    }

    private static int byteSize(PatternDataType dataType, int numPatterns, int height, int width) {
        if (numPatterns < 0 || height < 0 || width < 0) {
            throw new InvalidShapeException(String.format(
                    "Pattern shape must be non-negative: %d x %d x %d", numPatterns, height, width));
        }
        long size = (long) numPatterns * height * width * dataType.getByteSize();
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Pattern batch too large for a single buffer: "
                    + size + " bytes");
        }
        return (int) size;
    }

    public PatternDataType getDataType() {
        return dataType;
    }

    public int getNumPatterns() {
        return numPatterns;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public ImageExtent getExtent() {
        return new ImageExtent(width, height);
    }

    /**
     * Number of bytes in one pattern.
     */
    public int getPatternSizeInBytes() {
        return height * width * dataType.getByteSize();
    }

    public int getSizeInBytes() {
        return numPatterns * getPatternSizeInBytes();
    }

    public int byteIndex(int pattern, int y, int x) {
        return ((pattern * height + y) * width + x) * dataType.getByteSize();
    }

    public long getLong(int pattern, int y, int x) {
        return dataType.getLong(data, byteIndex(pattern, y, x));
    }

    public double getDouble(int pattern, int y, int x) {
        return dataType.getDouble(data, byteIndex(pattern, y, x));
    }

    public void setLong(int pattern, int y, int x, long value) {
        dataType.putLong(data, byteIndex(pattern, y, x), value);
    }

    public void setDouble(int pattern, int y, int x, double value) {
        dataType.putDouble(data, byteIndex(pattern, y, x), value);
    }

    /**
     * Returns a read-only little-endian view of the bytes of one pattern.
     */
    public ByteBuffer getPatternBytes(int pattern) {
        Objects.checkIndex(pattern, Math.max(numPatterns, 0));
        return slice(pattern * getPatternSizeInBytes(), getPatternSizeInBytes());
    }

    /**
     * Returns a read-only little-endian view of all bytes.
     */
    public ByteBuffer asReadOnlyBuffer() {
        return slice(0, getSizeInBytes());
    }

    private ByteBuffer slice(int offset, int length) {
        ByteBuffer view = data.asReadOnlyBuffer();
        view.clear();
        view.position(offset);
        view.limit(offset + length);
        return view.slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Returns a deep copy backed by a fresh heap buffer.
     */
    public DiffractionPatterns copy() {
        DiffractionPatterns copy = allocate(dataType, numPatterns, height, width);
        copy.data.put(0, asReadOnlyBuffer(), 0, getSizeInBytes());
        return copy;
    }

    /**
     * Sums every element of a pattern as a double.
     */
    public double sumPattern(int pattern) {
        double sum = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                sum += getDouble(pattern, y, x);
            }
        }
        return sum;
    }

    public double sum() {
        double sum = 0;
        for (int p = 0; p < numPatterns; p++) {
            sum += sumPattern(p);
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DiffractionPatterns that = (DiffractionPatterns) o;
        return dataType == that.dataType
                && numPatterns == that.numPatterns
                && height == that.height
                && width == that.width
                && asReadOnlyBuffer().equals(that.asReadOnlyBuffer());
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, numPatterns, height, width);
    }

    @Override
    public String toString() {
        return String.format("DiffractionPatterns{%d x %d x %d %s}",
                numPatterns, height, width, dataType.getTypeName());
    }
}
