package ptychodus.diffraction.model;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PatternDataTypeTest {

    @Test
    void narrowWrapsUnsignedTypes() {
        assertEquals(0, PatternDataType.UINT8.narrow(256));
        assertEquals(44, PatternDataType.UINT8.narrow(300));
        assertEquals(1, PatternDataType.UINT16.narrow(65537));
        assertEquals(0xFFFFFFFFL, PatternDataType.UINT32.narrow(-1));
    }

    @Test
    void narrowWrapsSignedTypes() {
        assertEquals(-32768, PatternDataType.INT16.narrow(32768));
        assertEquals(Integer.MIN_VALUE, PatternDataType.INT32.narrow(1L << 31));
    }

    @Test
    void elementsAreLittleEndian() {
        ByteBuffer buffer = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        PatternDataType.UINT16.putLong(buffer, 0, 0x0201);
        assertEquals(1, buffer.get(0));
        assertEquals(2, buffer.get(1));

        PatternDataType.UINT16.putLong(buffer, 2, 65535);
        assertEquals(65535, PatternDataType.UINT16.getLong(buffer, 2));
        assertEquals(-1, PatternDataType.INT16.getLong(buffer, 2));
    }

    @Test
    void floatKeepsFraction() {
        ByteBuffer buffer = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        PatternDataType.FLOAT32.putDouble(buffer, 0, 2.5);
        assertEquals(2.5, PatternDataType.FLOAT32.getDouble(buffer, 0));
        assertEquals(2, PatternDataType.FLOAT32.getLong(buffer, 0));
    }

    @Test
    void lookupByNameIgnoresCase() {
        assertEquals(PatternDataType.UINT16, PatternDataType.fromTypeName("UInt16"));
        assertEquals(PatternDataType.FLOAT32, PatternDataType.fromTypeName(" float32 "));
        assertThrows(IllegalArgumentException.class, () -> PatternDataType.fromTypeName("complex64"));
        assertThrows(IllegalArgumentException.class, () -> PatternDataType.fromTypeName(null));
    }
}
