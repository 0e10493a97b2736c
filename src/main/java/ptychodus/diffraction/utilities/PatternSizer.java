package ptychodus.diffraction.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.InvalidBinningException;
import ptychodus.diffraction.model.ProcessorConfig;
import ptychodus.diffraction.preferences.DiffractionSettings;

import java.util.Objects;

/**
 * Turns {@link DiffractionSettings} into a valid {@link ProcessorConfig}.
 * <p>
 * User-entered crop and binning values are clamped against the detector: the crop
 * size to {@code [1, detector]}, the crop center so the window stays on the detector,
 * and the bin size to {@code [1, crop]}. A crop size that is not a multiple of the bin
 * size is rejected.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class PatternSizer {

    private static final Logger logger = LoggerFactory.getLogger(PatternSizer.class);

    private final DiffractionSettings settings;

    public PatternSizer(DiffractionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Settings must not be null");
    }

    /**
     * Detector extent from settings.
     */
    public ImageExtent getDetectorExtent() {
        return new ImageExtent(settings.getDetectorWidthPx(), settings.getDetectorHeightPx());
    }

    public int getCropWidthPx(ImageExtent detectorExtent) {
        return cropSize(settings.isCropEnabled(), settings.getCropWidthPx(), detectorExtent.widthPx());
    }

    public int getCropHeightPx(ImageExtent detectorExtent) {
        return cropSize(settings.isCropEnabled(), settings.getCropHeightPx(), detectorExtent.heightPx());
    }

    public int getCropCenterXPx(ImageExtent detectorExtent) {
        return cropCenter(settings.getCropCenterXPx(), getCropWidthPx(detectorExtent), detectorExtent.widthPx());
    }

    public int getCropCenterYPx(ImageExtent detectorExtent) {
        return cropCenter(settings.getCropCenterYPx(), getCropHeightPx(detectorExtent), detectorExtent.heightPx());
    }

    public int getBinSizeX(ImageExtent detectorExtent) {
        return binSize(settings.getBinSizeX(), getCropWidthPx(detectorExtent));
    }

    public int getBinSizeY(ImageExtent detectorExtent) {
        return binSize(settings.getBinSizeY(), getCropHeightPx(detectorExtent));
    }

    /**
     * Builds a processor for the detector extent in settings.
     */
    public PatternProcessor createProcessor() {
        return createProcessor(getDetectorExtent());
    }

    /**
     * Builds a processor for the given detector extent.
     *
     * @throws InvalidBinningException if the crop size is not divisible by the bin size
     */
    public PatternProcessor createProcessor(ImageExtent detectorExtent) {
        ProcessorConfig.Builder builder = ProcessorConfig.builder();

        if (settings.isValueLowerBoundEnabled()) {
            builder.lowerBound(settings.getValueLowerBound());
        }
        if (settings.isValueUpperBoundEnabled()) {
            builder.upperBound(settings.getValueUpperBound());
        }

        int cropWidth = getCropWidthPx(detectorExtent);
        int cropHeight = getCropHeightPx(detectorExtent);
        if (settings.isCropEnabled() && detectorExtent.getNumPixels() > 0) {
            builder.crop(getCropCenterXPx(detectorExtent), getCropCenterYPx(detectorExtent), cropWidth, cropHeight);
        }

        if (settings.isBinningEnabled()) {
            int binX = getBinSizeX(detectorExtent);
            int binY = getBinSizeY(detectorExtent);
            if (cropWidth % binX != 0 || cropHeight % binY != 0) {
                throw new InvalidBinningException(String.format(
                        "Crop size %dx%d is not divisible by bin size %dx%d",
                        cropWidth, cropHeight, binX, binY));
            }
            builder.binning(binX, binY);
        }

        if (settings.isPaddingEnabled()) {
            builder.padding(settings.getPadX(), settings.getPadY());
        }

        ProcessorConfig config = builder
                .flipHorizontal(settings.isFlipHorizontal())
                .flipVertical(settings.isFlipVertical())
                .transpose(settings.isTranspose())
                .build();
        logger.debug("Created processor for detector {}: {}", detectorExtent, config);
        return new PatternProcessor(config);
    }

    /**
     * Extent of processed patterns for the given detector.
     */
    public ImageExtent getProcessedExtent(ImageExtent detectorExtent) {
        return createProcessor(detectorExtent).getProcessedExtent(detectorExtent);
    }

    // ==================== Clamping ====================

    private static int cropSize(boolean enabled, int requested, int detectorSize) {
        if (!enabled) {
            return detectorSize;
        }
        return clamp(requested, Math.min(1, detectorSize), detectorSize);
    }

    private static int cropCenter(int requested, int cropSize, int detectorSize) {
        int lower = cropSize / 2;
        int upper = detectorSize - (cropSize - cropSize / 2);
        return clamp(requested, lower, Math.max(lower, upper));
    }

    private static int binSize(int requested, int cropSize) {
        return clamp(requested, 1, Math.max(1, cropSize));
    }

    private static int clamp(int value, int lower, int upper) {
        return Math.max(lower, Math.min(upper, value));
    }
}
