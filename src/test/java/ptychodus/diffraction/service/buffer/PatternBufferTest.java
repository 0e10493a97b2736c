package ptychodus.diffraction.service.buffer;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ptychodus.diffraction.PatternFixtures;
import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.InvalidShapeException;
import ptychodus.diffraction.model.PatternDataType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternBufferTest {

    private static final ImageExtent EXTENT = new ImageExtent(2, 2);

    private static void assertWriteAndRead(PatternBuffer buffer) {
        DiffractionPatterns patterns = PatternFixtures.constantPatterns(PatternDataType.UINT16, 2, 2, 2, 7);
        buffer.writePatterns(1, patterns);

        assertFalse(buffer.isSealed(0));
        assertTrue(buffer.isSealed(1));
        assertTrue(buffer.isSealed(2));
        assertEquals(patterns, buffer.readPatterns(1, 2));
        // Unwritten slots read as zeros
        assertEquals(0.0, buffer.readPatterns(3, 1).sum());
    }

    @Nested
    class Heap {

        @Test
        void writesAndReadsPatterns() {
            assertWriteAndRead(new HeapPatternBuffer(PatternDataType.UINT16, 4, EXTENT));
        }

        @Test
        void slotsAreWrittenAtMostOnce() {
            PatternBuffer buffer = new HeapPatternBuffer(PatternDataType.UINT16, 4, EXTENT);
            buffer.writePatterns(1, PatternFixtures.constantPatterns(PatternDataType.UINT16, 2, 2, 2, 1));

            assertThrows(IllegalStateException.class,
                    () -> buffer.writePatterns(2, PatternFixtures.constantPatterns(PatternDataType.UINT16, 2, 2, 2, 9)));
            // The rejected write left slot 3 unsealed
            assertFalse(buffer.isSealed(3));
            buffer.writePatterns(3, PatternFixtures.constantPatterns(PatternDataType.UINT16, 1, 2, 2, 9));
        }

        @Test
        void rejectsMismatchedPatterns() {
            PatternBuffer buffer = new HeapPatternBuffer(PatternDataType.UINT16, 4, EXTENT);
            assertThrows(InvalidShapeException.class,
                    () -> buffer.writePatterns(0, PatternFixtures.constantPatterns(PatternDataType.UINT16, 1, 3, 2, 1)));
            assertThrows(IllegalArgumentException.class,
                    () -> buffer.writePatterns(0, PatternFixtures.constantPatterns(PatternDataType.UINT8, 1, 2, 2, 1)));
            assertThrows(IndexOutOfBoundsException.class,
                    () -> buffer.writePatterns(3, PatternFixtures.constantPatterns(PatternDataType.UINT16, 2, 2, 2, 1)));
        }

        @Test
        void spansSegments() {
            // 4-byte patterns, two per segment
            HeapPatternBuffer buffer = new HeapPatternBuffer(PatternDataType.UINT8, 5, EXTENT, 8);
            assertEquals(3, buffer.getNumSegments());

            DiffractionPatterns patterns = PatternFixtures.constantPatterns(PatternDataType.UINT8, 5, 2, 2, 1);
            buffer.writePatterns(0, patterns);
            assertEquals(patterns, buffer.readPatterns(0, 5));
            assertEquals(5, buffer.readPatterns(4, 1).getLong(0, 1, 1));
        }

        @Test
        void closedBufferRejectsAccess() {
            HeapPatternBuffer buffer = new HeapPatternBuffer(PatternDataType.UINT16, 1, EXTENT);
            buffer.close();
            assertTrue(buffer.isClosed());
            assertThrows(IllegalStateException.class, () -> buffer.readPatterns(0, 1));
        }

        @Test
        void emptyBufferHasNoSlots() {
            PatternBuffer buffer = PatternBufferFactory.createNullBuffer();
            assertEquals(0, buffer.getNumPatterns());
            assertEquals(0, buffer.getSizeInBytes());
            assertEquals(0, buffer.readPatterns(0, 0).getNumPatterns());
        }
    }

    @Nested
    class MappedFile {

        @TempDir
        Path scratch;

        @Test
        void writesAndReadsPatterns() throws IOException {
            try (MappedFilePatternBuffer buffer = MappedFilePatternBuffer.create(scratch.resolve("data"),
                    PatternDataType.UINT16, 4, EXTENT)) {
                assertTrue(buffer.isFileBacked());
                assertTrue(Files.isDirectory(scratch.resolve("data")));
                assertWriteAndRead(buffer);
            }
        }

        @Test
        void spansSegments() throws IOException {
            try (MappedFilePatternBuffer buffer = MappedFilePatternBuffer.create(scratch,
                    PatternDataType.UINT8, 5, EXTENT, 8)) {
                assertEquals(3, buffer.getNumSegments());
                DiffractionPatterns patterns = PatternFixtures.constantPatterns(PatternDataType.UINT8, 5, 2, 2, 10);
                buffer.writePatterns(0, patterns);
                assertEquals(patterns, buffer.readPatterns(0, 5));
            }
        }

        @Test
        void closeRemovesScratchFile() throws IOException {
            MappedFilePatternBuffer buffer = MappedFilePatternBuffer.create(scratch, PatternDataType.UINT16, 2, EXTENT);
            Path file = buffer.getFilePath();
            buffer.close();

            assertFalse(Files.exists(file));
            assertThrows(IllegalStateException.class, () -> buffer.getPatternBytes(0));
        }

        @Test
        void unopenableScratchFileIsDeleted() throws IOException {
            // A directory cannot be opened for writing
            Path notAFile = Files.createDirectory(scratch.resolve("patterns-0.bin"));

            assertThrows(IOException.class, () -> MappedFilePatternBuffer.openScratchChannel(notAFile));
            assertFalse(Files.exists(notAFile));
        }
    }
}
