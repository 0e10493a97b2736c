package ptychodus.diffraction.preferences;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Settings for diffraction pattern assembly.
 * <p>
 * Settings are persisted as JSON. Keys missing from a settings file keep their
 * defaults, so files written by older versions still load.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public final class DiffractionSettings {

    private static final Logger logger = LoggerFactory.getLogger(DiffractionSettings.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /** Compression values accepted for snapshot export */
    public static final String COMPRESSION_DEFLATE = "deflate";
    public static final String COMPRESSION_NONE = "none";

    private static final int MAX_DATA_THREADS = 64;

    // Detector
    private int detectorWidthPx = 1024;
    private int detectorHeightPx = 1024;

    // Memory
    private boolean memmapEnabled = false;
    private long memmapThresholdMB = 0;
    private String scratchDirectory = Paths.get(System.getProperty("user.home"), ".ptychodus").toString();
    private int numDataThreads = clampThreads(Runtime.getRuntime().availableProcessors());

    // Crop
    private boolean cropEnabled = true;
    private int cropCenterXPx = 32;
    private int cropCenterYPx = 32;
    private int cropWidthPx = 64;
    private int cropHeightPx = 64;

    // Binning and padding
    private boolean binningEnabled = false;
    private int binSizeX = 1;
    private int binSizeY = 1;
    private boolean paddingEnabled = false;
    private int padX = 0;
    private int padY = 0;

    // Orientation
    private boolean flipHorizontal = false;
    private boolean flipVertical = false;
    private boolean transpose = false;

    // Intensity filter
    private boolean valueLowerBoundEnabled = false;
    private long valueLowerBound = 0;
    private boolean valueUpperBoundEnabled = false;
    private long valueUpperBound = 65535;

    // Bad pixels and snapshots
    private boolean badPixelsRequired = false;
    private String snapshotCompression = COMPRESSION_DEFLATE;

    public DiffractionSettings() {
        // Defaults set by field initializers
    }

    // ==================== Persistence ====================

    /**
     * Loads settings from a JSON file. A missing file yields defaults.
     *
     * @param path settings file
     * @return loaded settings
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static DiffractionSettings load(Path path) throws IOException {
        if (!Files.exists(path)) {
            logger.info("Settings file {} not found, using defaults", path);
            return new DiffractionSettings();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DiffractionSettings settings = GSON.fromJson(reader, DiffractionSettings.class);
            if (settings == null) {
                logger.warn("Settings file {} is empty, using defaults", path);
                return new DiffractionSettings();
            }
            settings.numDataThreads = clampThreads(settings.numDataThreads);
            logger.info("Loaded settings from {}", path);
            return settings;
        } catch (JsonParseException e) {
            throw new IOException("Malformed settings file: " + path, e);
        }
    }

    /**
     * Saves settings as pretty-printed JSON, creating parent directories as needed.
     */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(this, writer);
        }
        logger.info("Saved settings to {}", path);
    }

    private static int clampThreads(int value) {
        return Math.max(1, Math.min(MAX_DATA_THREADS, value));
    }

    // ==================== Detector ====================

    public int getDetectorWidthPx() {
        return detectorWidthPx;
    }

    public void setDetectorWidthPx(int detectorWidthPx) {
        this.detectorWidthPx = Math.max(1, detectorWidthPx);
    }

    public int getDetectorHeightPx() {
        return detectorHeightPx;
    }

    public void setDetectorHeightPx(int detectorHeightPx) {
        this.detectorHeightPx = Math.max(1, detectorHeightPx);
    }

    // ==================== Memory ====================

    public boolean isMemmapEnabled() {
        return memmapEnabled;
    }

    public void setMemmapEnabled(boolean memmapEnabled) {
        this.memmapEnabled = memmapEnabled;
    }

    /**
     * Buffers at least this large are file-backed. Zero disables the size rule.
     */
    public long getMemmapThresholdMB() {
        return memmapThresholdMB;
    }

    public void setMemmapThresholdMB(long memmapThresholdMB) {
        this.memmapThresholdMB = Math.max(0, memmapThresholdMB);
    }

    public Path getScratchDirectory() {
        return Paths.get(scratchDirectory);
    }

    public void setScratchDirectory(Path scratchDirectory) {
        this.scratchDirectory = scratchDirectory.toString();
    }

    public int getNumDataThreads() {
        return numDataThreads;
    }

    public void setNumDataThreads(int numDataThreads) {
        this.numDataThreads = clampThreads(numDataThreads);
    }

    // ==================== Crop ====================

    public boolean isCropEnabled() {
        return cropEnabled;
    }

    public void setCropEnabled(boolean cropEnabled) {
        this.cropEnabled = cropEnabled;
    }

    public int getCropCenterXPx() {
        return cropCenterXPx;
    }

    public void setCropCenterXPx(int cropCenterXPx) {
        this.cropCenterXPx = cropCenterXPx;
    }

    public int getCropCenterYPx() {
        return cropCenterYPx;
    }

    public void setCropCenterYPx(int cropCenterYPx) {
        this.cropCenterYPx = cropCenterYPx;
    }

    public int getCropWidthPx() {
        return cropWidthPx;
    }

    public void setCropWidthPx(int cropWidthPx) {
        this.cropWidthPx = cropWidthPx;
    }

    public int getCropHeightPx() {
        return cropHeightPx;
    }

    public void setCropHeightPx(int cropHeightPx) {
        this.cropHeightPx = cropHeightPx;
    }

    // ==================== Binning and padding ====================

    public boolean isBinningEnabled() {
        return binningEnabled;
    }

    public void setBinningEnabled(boolean binningEnabled) {
        this.binningEnabled = binningEnabled;
    }

    public int getBinSizeX() {
        return binSizeX;
    }

    public void setBinSizeX(int binSizeX) {
        this.binSizeX = binSizeX;
    }

    public int getBinSizeY() {
        return binSizeY;
    }

    public void setBinSizeY(int binSizeY) {
        this.binSizeY = binSizeY;
    }

    public boolean isPaddingEnabled() {
        return paddingEnabled;
    }

    public void setPaddingEnabled(boolean paddingEnabled) {
        this.paddingEnabled = paddingEnabled;
    }

    public int getPadX() {
        return padX;
    }

    public void setPadX(int padX) {
        this.padX = Math.max(0, padX);
    }

    public int getPadY() {
        return padY;
    }

    public void setPadY(int padY) {
        this.padY = Math.max(0, padY);
    }

    // ==================== Orientation ====================

    public boolean isFlipHorizontal() {
        return flipHorizontal;
    }

    public void setFlipHorizontal(boolean flipHorizontal) {
        this.flipHorizontal = flipHorizontal;
    }

    public boolean isFlipVertical() {
        return flipVertical;
    }

    public void setFlipVertical(boolean flipVertical) {
        this.flipVertical = flipVertical;
    }

    public boolean isTranspose() {
        return transpose;
    }

    public void setTranspose(boolean transpose) {
        this.transpose = transpose;
    }

    // ==================== Intensity filter ====================

    public boolean isValueLowerBoundEnabled() {
        return valueLowerBoundEnabled;
    }

    public void setValueLowerBoundEnabled(boolean valueLowerBoundEnabled) {
        this.valueLowerBoundEnabled = valueLowerBoundEnabled;
    }

    public long getValueLowerBound() {
        return valueLowerBound;
    }

    public void setValueLowerBound(long valueLowerBound) {
        this.valueLowerBound = valueLowerBound;
    }

    public boolean isValueUpperBoundEnabled() {
        return valueUpperBoundEnabled;
    }

    public void setValueUpperBoundEnabled(boolean valueUpperBoundEnabled) {
        this.valueUpperBoundEnabled = valueUpperBoundEnabled;
    }

    public long getValueUpperBound() {
        return valueUpperBound;
    }

    public void setValueUpperBound(long valueUpperBound) {
        this.valueUpperBound = valueUpperBound;
    }

    // ==================== Bad pixels and snapshots ====================

    public boolean isBadPixelsRequired() {
        return badPixelsRequired;
    }

    public void setBadPixelsRequired(boolean badPixelsRequired) {
        this.badPixelsRequired = badPixelsRequired;
    }

    public String getSnapshotCompression() {
        return snapshotCompression;
    }

    /**
     * Sets the snapshot compression, either "deflate" or "none".
     *
     * @throws IllegalArgumentException for any other value
     */
    public void setSnapshotCompression(String snapshotCompression) {
        String normalized = snapshotCompression == null ? ""
                : snapshotCompression.trim().toLowerCase(Locale.ROOT);
        if (!COMPRESSION_DEFLATE.equals(normalized) && !COMPRESSION_NONE.equals(normalized)) {
            throw new IllegalArgumentException("Unsupported snapshot compression: " + snapshotCompression);
        }
        this.snapshotCompression = normalized;
    }
}
