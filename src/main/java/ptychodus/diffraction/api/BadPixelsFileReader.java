package ptychodus.diffraction.api;

import ptychodus.diffraction.model.BadPixels;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a bad-pixel map from a file.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
@FunctionalInterface
public interface BadPixelsFileReader {

    BadPixels read(Path filePath) throws IOException;
}
