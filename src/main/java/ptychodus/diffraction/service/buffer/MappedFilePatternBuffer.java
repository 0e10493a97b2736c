package ptychodus.diffraction.service.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.PatternDataType;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Pattern buffer memory-mapped from a scratch file.
 * <p>
 * The scratch file is created in the given directory and deleted when the buffer is
 * closed. Mapped regions are released by the garbage collector; reads after
 * {@link #close()} are rejected.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class MappedFilePatternBuffer extends SegmentedPatternBuffer {

    private static final Logger logger = LoggerFactory.getLogger(MappedFilePatternBuffer.class);

    private final Path filePath;
    private final FileChannel channel;

    private MappedFilePatternBuffer(PatternDataType dataType, int numPatterns, ImageExtent patternExtent,
                                    int maxSegmentBytes, List<ByteBuffer> segments,
                                    Path filePath, FileChannel channel) {
        super(dataType, numPatterns, patternExtent, maxSegmentBytes, segments);
        this.filePath = filePath;
        this.channel = channel;
    }

    /**
     * Creates a zero-filled buffer backed by a new scratch file.
     *
     * @param scratchDirectory directory for the scratch file; created if missing
     * @throws IOException if the file cannot be created or mapped
     */
    public static MappedFilePatternBuffer create(Path scratchDirectory, PatternDataType dataType,
                                                 int numPatterns, ImageExtent patternExtent) throws IOException {
        return create(scratchDirectory, dataType, numPatterns, patternExtent, DEFAULT_MAX_SEGMENT_BYTES);
    }

    static MappedFilePatternBuffer create(Path scratchDirectory, PatternDataType dataType, int numPatterns,
                                          ImageExtent patternExtent, int maxSegmentBytes) throws IOException {
        Files.createDirectories(scratchDirectory);
        Path filePath = Files.createTempFile(scratchDirectory, "patterns-", ".bin");
        FileChannel channel = openScratchChannel(filePath);
        try {
            int[] sizes = segmentSizes(dataType, numPatterns, patternExtent, maxSegmentBytes);
            long totalBytes = 0;
            for (int size : sizes) {
                totalBytes += size;
            }
            if (totalBytes > 0) {
                // Extend the file; new regions read as zeros
                channel.write(ByteBuffer.allocate(1), totalBytes - 1);
            }
            List<ByteBuffer> segments = new ArrayList<>();
            long position = 0;
            for (int size : sizes) {
                segments.add(channel.map(FileChannel.MapMode.READ_WRITE, position, size)
                        .order(ByteOrder.LITTLE_ENDIAN));
                position += size;
            }
            logger.info("Scratch data file {} is {} bytes", filePath, totalBytes);
            return new MappedFilePatternBuffer(dataType, numPatterns, patternExtent, maxSegmentBytes,
                    segments, filePath, channel);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    /**
     * Opens the scratch file for reading and writing. The file is deleted when the
     * channel closes, or at once if it cannot be opened.
     */
    static FileChannel openScratchChannel(Path filePath) throws IOException {
        try {
            return FileChannel.open(filePath, StandardOpenOption.READ,
                    StandardOpenOption.WRITE, StandardOpenOption.DELETE_ON_CLOSE);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(filePath);
            } catch (IOException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public boolean isFileBacked() {
        return true;
    }

    @Override
    public void close() throws IOException {
        if (isClosed()) {
            return;
        }
        markClosed();
        channel.close();
        logger.debug("Closed scratch data file {}", filePath);
    }
}
