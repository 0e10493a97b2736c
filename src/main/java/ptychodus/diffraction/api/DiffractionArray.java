package ptychodus.diffraction.api;

import ptychodus.diffraction.model.DiffractionPatterns;

import java.io.IOException;

/**
 * One raw array of diffraction patterns, typically a chunk of a detector file.
 * <p>
 * Pattern data may be read lazily; {@link #getPatterns()} is called on a loader
 * thread and may fail with an {@link IOException}. A
 * {@link java.io.FileNotFoundException} marks a chunk that does not exist yet and is
 * skipped by the loader.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public interface DiffractionArray {

    /**
     * Human-readable label for this array.
     */
    String getLabel();

    /**
     * Per-pattern indexes, one for each pattern returned by {@link #getPatterns()}.
     */
    long[] getIndexes();

    /**
     * Reads the raw patterns.
     *
     * @throws IOException if the data cannot be read
     */
    DiffractionPatterns getPatterns() throws IOException;
}
