package ptychodus.diffraction.model;

import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * Native element types for diffraction pattern data.
 * <p>
 * All element access is absolute and assumes a little-endian buffer. Integer
 * arithmetic is carried out in {@code long} and narrowed back to the native type
 * with two's-complement wrap-around, so sums overflow the way the detector's own
 * type would rather than being silently widened.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public enum PatternDataType {
    /** Unsigned 8-bit integer */
    UINT8("uint8", 1, true),
    /** Unsigned 16-bit integer */
    UINT16("uint16", 2, true),
    /** Unsigned 32-bit integer */
    UINT32("uint32", 4, true),
    /** Signed 16-bit integer */
    INT16("int16", 2, true),
    /** Signed 32-bit integer */
    INT32("int32", 4, true),
    /** 32-bit IEEE float */
    FLOAT32("float32", 4, false);

    private final String typeName;
    private final int byteSize;
    private final boolean integer;

    PatternDataType(String typeName, int byteSize, boolean integer) {
        this.typeName = typeName;
        this.byteSize = byteSize;
        this.integer = integer;
    }

    /**
     * Returns the lowercase type name (numpy style, e.g. "uint16").
     */
    public String getTypeName() {
        return typeName;
    }

    public int getByteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return integer;
    }

    /**
     * Reads one element as a long. Float values are truncated.
     *
     * @param buffer    little-endian buffer
     * @param byteIndex absolute byte index of the element
     */
    public long getLong(ByteBuffer buffer, int byteIndex) {
        return switch (this) {
            case UINT8 -> buffer.get(byteIndex) & 0xFFL;
            case UINT16 -> buffer.getShort(byteIndex) & 0xFFFFL;
            case UINT32 -> buffer.getInt(byteIndex) & 0xFFFFFFFFL;
            case INT16 -> buffer.getShort(byteIndex);
            case INT32 -> buffer.getInt(byteIndex);
            case FLOAT32 -> (long) buffer.getFloat(byteIndex);
        };
    }

    /**
     * Reads one element as a double.
     */
    public double getDouble(ByteBuffer buffer, int byteIndex) {
        if (this == FLOAT32) {
            return buffer.getFloat(byteIndex);
        }
        return getLong(buffer, byteIndex);
    }

    /**
     * Writes one element, narrowing the value to this type.
     */
    public void putLong(ByteBuffer buffer, int byteIndex, long value) {
        switch (this) {
            case UINT8 -> buffer.put(byteIndex, (byte) value);
            case UINT16, INT16 -> buffer.putShort(byteIndex, (short) value);
            case UINT32, INT32 -> buffer.putInt(byteIndex, (int) value);
            case FLOAT32 -> buffer.putFloat(byteIndex, (float) value);
        }
    }

    /**
     * Writes one element from a double. Integer types truncate toward zero
     * and then wrap.
     */
    public void putDouble(ByteBuffer buffer, int byteIndex, double value) {
        if (this == FLOAT32) {
            buffer.putFloat(byteIndex, (float) value);
        } else {
            putLong(buffer, byteIndex, (long) value);
        }
    }

    /**
     * Narrows a long to the range of this type with two's-complement wrap-around.
     */
    public long narrow(long value) {
        return switch (this) {
            case UINT8 -> value & 0xFFL;
            case UINT16 -> value & 0xFFFFL;
            case UINT32 -> value & 0xFFFFFFFFL;
            case INT16 -> (short) value;
            case INT32 -> (int) value;
            case FLOAT32 -> (long) (float) value;
        };
    }

    /**
     * Looks up a type by name (case-insensitive).
     *
     * @param name type name such as "uint16"
     * @return the matching type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static PatternDataType fromTypeName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (PatternDataType type : values()) {
                if (type.typeName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported pattern data type: " + name);
    }
}
