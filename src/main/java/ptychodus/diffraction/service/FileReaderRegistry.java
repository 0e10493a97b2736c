package ptychodus.diffraction.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of file readers keyed by file type.
 * <p>
 * File types are matched case-insensitively. Registering a type again replaces the
 * previous reader.
 *
 * @param <T> reader type
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class FileReaderRegistry<T> {

    private static final Logger logger = LoggerFactory.getLogger(FileReaderRegistry.class);

    private final Map<String, T> readers = new ConcurrentHashMap<>();

    /**
     * Registers a reader for a file type.
     *
     * @param fileType file type, e.g. "HDF5"
     * @param reader   the reader
     */
    public void register(String fileType, T reader) {
        if (fileType == null || fileType.isBlank()) {
            throw new IllegalArgumentException("File type must not be blank");
        }
        if (reader == null) {
            throw new IllegalArgumentException("Reader must not be null");
        }
        String key = normalize(fileType);
        T previous = readers.put(key, reader);
        if (previous != null) {
            logger.info("Replaced reader for file type: {}", key);
        } else {
            logger.info("Registered reader for file type: {}", key);
        }
    }

    public Optional<T> getReader(String fileType) {
        if (fileType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(readers.get(normalize(fileType)));
    }

    public boolean hasReader(String fileType) {
        return getReader(fileType).isPresent();
    }

    public boolean unregister(String fileType) {
        if (fileType == null) {
            return false;
        }
        T removed = readers.remove(normalize(fileType));
        if (removed != null) {
            logger.info("Unregistered reader for file type: {}", fileType);
            return true;
        }
        return false;
    }

    /**
     * Registered file types, sorted.
     */
    public Set<String> getFileTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(readers.keySet()));
    }

    private static String normalize(String fileType) {
        return fileType.trim().toUpperCase(Locale.ROOT);
    }
}
