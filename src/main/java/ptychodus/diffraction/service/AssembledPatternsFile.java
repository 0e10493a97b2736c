package ptychodus.diffraction.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.PatternDataType;
import ptychodus.diffraction.service.buffer.PatternBuffer;

import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Reads and writes assembled-pattern snapshots.
 * <p>
 * A snapshot is a ZIP container holding a JSON manifest and three raw little-endian
 * datasets:
 * <ul>
 *   <li>{@code patterns}: (n, H, W) in the native element type</li>
 *   <li>{@code indexes}: (n) int64</li>
 *   <li>{@code bad_pixels}: (H, W) bool, one byte per pixel; optional on read</li>
 * </ul>
 * The manifest records each dataset's name, element type, shape and compression.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public final class AssembledPatternsFile {

    private static final Logger logger = LoggerFactory.getLogger(AssembledPatternsFile.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static final int FORMAT_VERSION = 1;
    public static final String MANIFEST_ENTRY = "manifest.json";
    public static final String PATTERNS_ENTRY = "patterns";
    public static final String INDEXES_ENTRY = "indexes";
    public static final String BAD_PIXELS_ENTRY = "bad_pixels";

    private static final String INT64 = "int64";
    private static final String BOOL = "bool";

    /**
     * Entry compression applied to every dataset in the container.
     */
    public enum Compression {
        NONE("none"),
        DEFLATE("deflate");

        private final String name;

        Compression(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        /**
         * @throws IllegalArgumentException if the name is not "none" or "deflate"
         */
        public static Compression fromName(String name) {
            if (name != null) {
                String normalized = name.trim().toLowerCase(Locale.ROOT);
                for (Compression compression : values()) {
                    if (compression.name.equals(normalized)) {
                        return compression;
                    }
                }
            }
            throw new IllegalArgumentException("Unsupported snapshot compression: " + name);
        }
    }

    /**
     * Allocates the buffer that an import streams patterns into.
     */
    @FunctionalInterface
    public interface BufferAllocator {
        PatternBuffer allocate(PatternDataType dataType, int numPatterns, ImageExtent extent) throws IOException;
    }

    /**
     * Contents of a snapshot. Every buffer slot is written and sealed.
     *
     * @param buffer    patterns
     * @param indexes   one index per pattern
     * @param badPixels processed bad-pixel mask, or null if absent
     */
    public record Contents(PatternBuffer buffer, long[] indexes, BadPixels badPixels) {
    }

    private AssembledPatternsFile() {
        // Utility class - no instantiation
    }

    // ==================== Write ====================

    /**
     * Writes the filled slots of a buffer.
     *
     * @param filePath    destination, overwritten if present
     * @param compression entry compression
     * @param buffer      dataset buffer
     * @param slotIndexes index per buffer slot, -1 for unfilled slots
     * @param badPixels   processed bad-pixel mask
     * @return number of patterns written
     * @throws IOException if the file cannot be written
     */
    public static int write(Path filePath, Compression compression, PatternBuffer buffer,
                            long[] slotIndexes, BadPixels badPixels) throws IOException {
        int[] slots = Arrays.stream(rangeOf(slotIndexes.length)).filter(i -> slotIndexes[i] >= 0).toArray();
        ImageExtent extent = buffer.getPatternExtent();

        ByteBuffer indexBytes = ByteBuffer.allocate(slots.length * Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int slot : slots) {
            indexBytes.putLong(slotIndexes[slot]);
        }
        indexBytes.flip();

        boolean[] mask = badPixels.toArray();
        ByteBuffer maskBytes = ByteBuffer.allocate(mask.length);
        for (boolean bad : mask) {
            maskBytes.put((byte) (bad ? 1 : 0));
        }
        maskBytes.flip();

        Manifest manifest = new Manifest();
        manifest.formatVersion = FORMAT_VERSION;
        manifest.datasets.add(new DatasetEntry(PATTERNS_ENTRY, buffer.getDataType().getTypeName(),
                new long[]{slots.length, extent.heightPx(), extent.widthPx()}, compression.getName()));
        manifest.datasets.add(new DatasetEntry(INDEXES_ENTRY, INT64,
                new long[]{slots.length}, compression.getName()));
        manifest.datasets.add(new DatasetEntry(BAD_PIXELS_ENTRY, BOOL,
                new long[]{badPixels.getHeight(), badPixels.getWidth()}, compression.getName()));

        try (OutputStream fileOut = new BufferedOutputStream(Files.newOutputStream(filePath));
             ZipOutputStream zipOut = new ZipOutputStream(fileOut)) {
            WritableByteChannel channel = Channels.newChannel(zipOut);

            writeEntry(zipOut, MANIFEST_ENTRY, Compression.DEFLATE,
                    List.of(ByteBuffer.wrap(GSON.toJson(manifest).getBytes(StandardCharsets.UTF_8))), channel);

            List<ByteBuffer> patternBytes = new ArrayList<>(slots.length);
            for (int slot : slots) {
                patternBytes.add(buffer.getPatternBytes(slot));
            }
            writeEntry(zipOut, PATTERNS_ENTRY, compression, patternBytes, channel);
            writeEntry(zipOut, INDEXES_ENTRY, compression, List.of(indexBytes), channel);
            writeEntry(zipOut, BAD_PIXELS_ENTRY, compression, List.of(maskBytes), channel);
        }

        logger.info("Exported {} assembled patterns to {} ({})", slots.length, filePath, compression.getName());
        return slots.length;
    }

    private static void writeEntry(ZipOutputStream zipOut, String name, Compression compression,
                                   List<ByteBuffer> chunks, WritableByteChannel channel) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        if (compression == Compression.NONE) {
            // Stored entries need size and CRC up front
            CRC32 crc = new CRC32();
            long size = 0;
            for (ByteBuffer chunk : chunks) {
                size += chunk.remaining();
                crc.update(chunk.duplicate());
            }
            entry.setMethod(ZipEntry.STORED);
            entry.setSize(size);
            entry.setCompressedSize(size);
            entry.setCrc(crc.getValue());
        } else {
            entry.setMethod(ZipEntry.DEFLATED);
        }
        zipOut.putNextEntry(entry);
        for (ByteBuffer chunk : chunks) {
            ByteBuffer data = chunk.duplicate();
            while (data.hasRemaining()) {
                channel.write(data);
            }
        }
        zipOut.closeEntry();
    }

    private static int[] rangeOf(int n) {
        int[] range = new int[n];
        Arrays.setAll(range, i -> i);
        return range;
    }

    // ==================== Read ====================

    /**
     * Reads a snapshot, streaming patterns into a newly allocated buffer.
     *
     * @throws IOException if the file is unreadable or malformed
     */
    public static Contents read(Path filePath, BufferAllocator allocator) throws IOException {
        try (ZipFile zipFile = new ZipFile(filePath.toFile())) {
            Manifest manifest = readManifest(zipFile);
            DatasetEntry patternsEntry = manifest.find(PATTERNS_ENTRY);
            DatasetEntry indexesEntry = manifest.find(INDEXES_ENTRY);
            if (patternsEntry == null || indexesEntry == null) {
                throw new IOException("Snapshot is missing patterns or indexes: " + filePath);
            }

            PatternDataType dataType;
            try {
                dataType = PatternDataType.fromTypeName(patternsEntry.dtype);
            } catch (IllegalArgumentException e) {
                throw new IOException("Snapshot has unsupported pattern type: " + patternsEntry.dtype, e);
            }
            long[] shape = patternsEntry.shape;
            if (shape == null || shape.length != 3) {
                throw new IOException("Snapshot patterns must have rank 3: " + Arrays.toString(shape));
            }
            int numPatterns = toInt(shape[0], "pattern count");
            ImageExtent extent = new ImageExtent(toInt(shape[2], "width"), toInt(shape[1], "height"));

            if (indexesEntry.shape == null || indexesEntry.shape.length != 1 || indexesEntry.shape[0] != numPatterns) {
                throw new IOException("Snapshot indexes do not match pattern count " + numPatterns);
            }
            long[] indexes = readIndexes(zipFile, numPatterns);
            BadPixels badPixels = readBadPixels(zipFile, manifest.find(BAD_PIXELS_ENTRY), extent);

            PatternBuffer buffer = allocator.allocate(dataType, numPatterns, extent);
            try {
                readPatterns(zipFile, buffer);
            } catch (IOException | RuntimeException e) {
                buffer.close();
                throw e;
            }
            logger.info("Imported {} assembled patterns from {}", numPatterns, filePath);
            return new Contents(buffer, indexes, badPixels);
        }
    }

    private static Manifest readManifest(ZipFile zipFile) throws IOException {
        try (Reader reader = new InputStreamReader(openEntry(zipFile, MANIFEST_ENTRY), StandardCharsets.UTF_8)) {
            Manifest manifest = GSON.fromJson(reader, Manifest.class);
            if (manifest == null || manifest.datasets == null) {
                throw new IOException("Snapshot manifest is empty");
            }
            if (manifest.formatVersion > FORMAT_VERSION) {
                throw new IOException("Unsupported snapshot format version: " + manifest.formatVersion);
            }
            return manifest;
        } catch (JsonParseException e) {
            throw new IOException("Malformed snapshot manifest", e);
        }
    }

    private static long[] readIndexes(ZipFile zipFile, int numPatterns) throws IOException {
        byte[] bytes;
        try {
            bytes = new byte[Math.multiplyExact(numPatterns, Long.BYTES)];
        } catch (ArithmeticException e) {
            throw new IOException("Snapshot index count out of range: " + numPatterns, e);
        }
        try (DataInputStream in = new DataInputStream(openEntry(zipFile, INDEXES_ENTRY))) {
            in.readFully(bytes);
        }
        long[] indexes = new long[numPatterns];
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asLongBuffer().get(indexes);
        return indexes;
    }

    private static BadPixels readBadPixels(ZipFile zipFile, DatasetEntry entry, ImageExtent extent) throws IOException {
        if (entry == null || zipFile.getEntry(BAD_PIXELS_ENTRY) == null) {
            logger.debug("Snapshot has no bad pixels");
            return null;
        }
        if (entry.shape == null || entry.shape.length != 2
                || entry.shape[0] != extent.heightPx() || entry.shape[1] != extent.widthPx()) {
            throw new IOException("Snapshot bad pixels do not match pattern extent " + extent);
        }
        byte[] bytes = new byte[extent.getNumPixels()];
        try (DataInputStream in = new DataInputStream(openEntry(zipFile, BAD_PIXELS_ENTRY))) {
            in.readFully(bytes);
        }
        boolean[] mask = new boolean[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            mask[i] = bytes[i] != 0;
        }
        return BadPixels.of(extent.heightPx(), extent.widthPx(), mask);
    }

    private static void readPatterns(ZipFile zipFile, PatternBuffer buffer) throws IOException {
        ImageExtent extent = buffer.getPatternExtent();
        byte[] patternBytes = new byte[extent.getNumPixels() * buffer.getDataType().getByteSize()];
        try (DataInputStream in = new DataInputStream(openEntry(zipFile, PATTERNS_ENTRY))) {
            for (int i = 0; i < buffer.getNumPatterns(); i++) {
                in.readFully(patternBytes);
                buffer.writePattern(i, ByteBuffer.wrap(patternBytes));
            }
        }
    }

    private static InputStream openEntry(ZipFile zipFile, String name) throws IOException {
        ZipEntry entry = zipFile.getEntry(name);
        if (entry == null) {
            throw new IOException("Snapshot is missing entry: " + name);
        }
        return zipFile.getInputStream(entry);
    }

    private static int toInt(long value, String what) throws IOException {
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new IOException("Snapshot " + what + " out of range: " + value);
        }
        return (int) value;
    }

    // ==================== Manifest ====================

    private static final class Manifest {
        int formatVersion;
        List<DatasetEntry> datasets = new ArrayList<>();

        DatasetEntry find(String name) {
            for (DatasetEntry entry : datasets) {
                if (entry != null && name.equals(entry.name)) {
                    return entry;
                }
            }
            return null;
        }
    }

    private static final class DatasetEntry {
        String name;
        String dtype;
        long[] shape;
        String compression;

        DatasetEntry() {
        }

        DatasetEntry(String name, String dtype, long[] shape, String compression) {
            this.name = name;
            this.dtype = dtype;
            this.shape = shape;
            this.compression = compression;
        }
    }
}
