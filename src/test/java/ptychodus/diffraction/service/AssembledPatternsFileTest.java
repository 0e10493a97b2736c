package ptychodus.diffraction.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ptychodus.diffraction.PatternFixtures;
import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.PatternDataType;
import ptychodus.diffraction.service.buffer.HeapPatternBuffer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssembledPatternsFileTest {

    private static final ImageExtent EXTENT = new ImageExtent(3, 2);

    @TempDir
    Path tempDir;

    // Slots 0 and 2 filled with values 1 and 3
    private static HeapPatternBuffer partiallyFilledBuffer() {
        HeapPatternBuffer buffer = new HeapPatternBuffer(PatternDataType.UINT16, 3, EXTENT);
        buffer.writePatterns(0, PatternFixtures.constantPatterns(PatternDataType.UINT16, 1, 2, 3, 1));
        buffer.writePatterns(2, PatternFixtures.constantPatterns(PatternDataType.UINT16, 1, 2, 3, 3));
        return buffer;
    }

    private static BadPixels mask() {
        return BadPixels.of(new boolean[][]{{false, false, true}, {false, false, false}});
    }

    @Test
    void onlyFilledSlotsAreWritten() throws IOException {
        Path file = tempDir.resolve("snapshot.zip");
        try (HeapPatternBuffer buffer = partiallyFilledBuffer()) {
            int written = AssembledPatternsFile.write(file, AssembledPatternsFile.Compression.DEFLATE, buffer,
                    new long[]{10, -1, 12}, mask());
            assertEquals(2, written);
        }

        AssembledPatternsFile.Contents contents = AssembledPatternsFile.read(file, HeapPatternBuffer::new);
        try (HeapPatternBuffer buffer = (HeapPatternBuffer) contents.buffer()) {
            assertArrayEquals(new long[]{10, 12}, contents.indexes());
            assertEquals(PatternDataType.UINT16, buffer.getDataType());
            assertEquals(EXTENT, buffer.getPatternExtent());
            assertEquals(2, buffer.getNumPatterns());
            assertEquals(1, buffer.readPatterns(0, 1).getLong(0, 1, 2));
            assertEquals(3, buffer.readPatterns(1, 1).getLong(0, 0, 0));
            assertEquals(mask(), contents.badPixels());
        }
    }

    @Test
    void uncompressedEntriesAreStored() throws IOException {
        Path file = tempDir.resolve("stored.zip");
        try (HeapPatternBuffer buffer = partiallyFilledBuffer()) {
            AssembledPatternsFile.write(file, AssembledPatternsFile.Compression.NONE, buffer,
                    new long[]{0, -1, 2}, mask());
        }

        try (ZipFile zipFile = new ZipFile(file.toFile())) {
            assertEquals(ZipEntry.DEFLATED, zipFile.getEntry(AssembledPatternsFile.MANIFEST_ENTRY).getMethod());
            ZipEntry patterns = zipFile.getEntry(AssembledPatternsFile.PATTERNS_ENTRY);
            assertEquals(ZipEntry.STORED, patterns.getMethod());
            assertEquals(2L * 6 * 2, patterns.getSize());
            assertEquals(ZipEntry.STORED, zipFile.getEntry(AssembledPatternsFile.INDEXES_ENTRY).getMethod());
        }
        AssembledPatternsFile.Contents contents = AssembledPatternsFile.read(file, HeapPatternBuffer::new);
        assertArrayEquals(new long[]{0, 2}, contents.indexes());
    }

    @Test
    void compressionNames() {
        assertEquals(AssembledPatternsFile.Compression.DEFLATE, AssembledPatternsFile.Compression.fromName("Deflate"));
        assertEquals(AssembledPatternsFile.Compression.NONE, AssembledPatternsFile.Compression.fromName("none"));
        assertThrows(IllegalArgumentException.class, () -> AssembledPatternsFile.Compression.fromName("lzf"));
        assertThrows(IllegalArgumentException.class, () -> AssembledPatternsFile.Compression.fromName(null));
    }

    @Test
    void nonZipFileIsRejected() throws IOException {
        Path file = Files.writeString(tempDir.resolve("notes.zip"), "not a snapshot");

        assertThrows(IOException.class, () -> AssembledPatternsFile.read(file, HeapPatternBuffer::new));
    }

    @Test
    void oversizedIndexCountIsRejected() throws IOException {
        Path file = tempDir.resolve("huge.zip");
        String manifest = "{\"formatVersion\": 1, \"datasets\": ["
                + "{\"name\": \"patterns\", \"dtype\": \"uint8\", \"shape\": [300000000, 1, 1]},"
                + "{\"name\": \"indexes\", \"dtype\": \"int64\", \"shape\": [300000000]}]}";
        try (OutputStream out = Files.newOutputStream(file);
             ZipOutputStream zipOut = new ZipOutputStream(out)) {
            zipOut.putNextEntry(new ZipEntry(AssembledPatternsFile.MANIFEST_ENTRY));
            zipOut.write(manifest.getBytes(StandardCharsets.UTF_8));
            zipOut.closeEntry();
        }

        assertThrows(IOException.class, () -> AssembledPatternsFile.read(file, HeapPatternBuffer::new));
    }

    @Test
    void missingManifestIsRejected() throws IOException {
        Path file = tempDir.resolve("bare.zip");
        try (OutputStream out = Files.newOutputStream(file);
             ZipOutputStream zipOut = new ZipOutputStream(out)) {
            zipOut.putNextEntry(new ZipEntry(AssembledPatternsFile.PATTERNS_ENTRY));
            zipOut.write("data".getBytes(StandardCharsets.UTF_8));
            zipOut.closeEntry();
        }

        IOException e = assertThrows(IOException.class,
                () -> AssembledPatternsFile.read(file, HeapPatternBuffer::new));
        assertTrue(e.getMessage().contains(AssembledPatternsFile.MANIFEST_ENTRY));
    }
}
