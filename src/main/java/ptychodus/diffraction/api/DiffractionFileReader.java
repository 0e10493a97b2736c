package ptychodus.diffraction.api;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a diffraction dataset from a file.
 * <p>
 * Implementations are registered by file type in a
 * {@link ptychodus.diffraction.service.FileReaderRegistry}.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
@FunctionalInterface
public interface DiffractionFileReader {

    /**
     * Opens the file and returns its dataset. Pattern data may be read lazily.
     *
     * @param filePath file to read
     * @throws IOException if the file cannot be read
     */
    DiffractionDataset read(Path filePath) throws IOException;
}
