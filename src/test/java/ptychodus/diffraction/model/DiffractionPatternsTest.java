package ptychodus.diffraction.model;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DiffractionPatternsTest {

    @Test
    void twoDimensionalShapeIsPromotedToBatchOfOne() {
        DiffractionPatterns patterns = DiffractionPatterns.fromShape(PatternDataType.UINT8,
                new int[]{2, 3}, ByteBuffer.wrap(new byte[]{1, 2, 3, 4, 5, 6}));

        assertEquals(1, patterns.getNumPatterns());
        assertEquals(2, patterns.getHeight());
        assertEquals(3, patterns.getWidth());
        assertEquals(6, patterns.getLong(0, 1, 2));
    }

    @Test
    void unsupportedRankIsRejected() {
        ByteBuffer data = ByteBuffer.allocate(16);
        assertThrows(InvalidShapeException.class,
                () -> DiffractionPatterns.fromShape(PatternDataType.UINT8, new int[]{16}, data));
        assertThrows(InvalidShapeException.class,
                () -> DiffractionPatterns.fromShape(PatternDataType.UINT8, new int[]{1, 2, 2, 4}, data));
    }

    @Test
    void wrapRejectsShortBuffer() {
        assertThrows(InvalidShapeException.class,
                () -> DiffractionPatterns.wrap(PatternDataType.UINT16, 1, 2, 2, ByteBuffer.allocate(6)));
    }

    @Test
    void wrappedBytesAreReadLittleEndian() {
        DiffractionPatterns patterns = DiffractionPatterns.wrap(PatternDataType.UINT16, 1, 1, 1,
                ByteBuffer.wrap(new byte[]{0x01, 0x02}));
        assertEquals(0x0201, patterns.getLong(0, 0, 0));
    }

    @Test
    void copyIsIndependent() {
        DiffractionPatterns original = DiffractionPatterns.ofValues(PatternDataType.INT32,
                new long[][][]{{{1, 2}, {3, 4}}});
        DiffractionPatterns copy = original.copy();
        assertEquals(original, copy);

        copy.setLong(0, 0, 0, 100);
        assertEquals(1, original.getLong(0, 0, 0));
        assertNotEquals(original, copy);
    }

    @Test
    void sumsAllElements() {
        DiffractionPatterns patterns = DiffractionPatterns.ofValues(PatternDataType.UINT16,
                new long[][][]{{{1, 2}, {3, 4}}, {{10, 20}, {30, 40}}});
        assertEquals(10.0, patterns.sumPattern(0));
        assertEquals(110.0, patterns.sum());
    }
}
