package ptychodus.diffraction.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.InvalidBinningException;
import ptychodus.diffraction.model.InvalidShapeException;
import ptychodus.diffraction.model.PatternDataType;
import ptychodus.diffraction.model.ProcessorConfig;

import java.util.Objects;

/**
 * Applies a {@link ProcessorConfig} to raw diffraction patterns and bad-pixel masks.
 * <p>
 * Steps run in a fixed order:
 * <ol>
 *   <li>intensity filter (patterns only): values below the lower bound or at/above
 *       the upper bound become zero</li>
 *   <li>crop to the configured window</li>
 *   <li>binning: block sums for patterns, logical AND for the mask</li>
 *   <li>zero padding</li>
 *   <li>horizontal flip, then vertical flip</li>
 *   <li>transpose of the last two axes</li>
 * </ol>
 * Instances are immutable and can be shared across loader threads. Inputs are never
 * modified.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class PatternProcessor {

    private static final Logger logger = LoggerFactory.getLogger(PatternProcessor.class);

    /**
     * Maps an output pixel to a flat source index, or -1 for a zero-filled pixel.
     */
    @FunctionalInterface
    private interface PixelMap {
        int sourceIndex(int y, int x);
    }

    private final ProcessorConfig config;

    public PatternProcessor(ProcessorConfig config) {
        this.config = Objects.requireNonNull(config, "Processor config must not be null");
    }

    /**
     * A processor that returns its input unchanged.
     */
    public static PatternProcessor identity() {
        return new PatternProcessor(ProcessorConfig.identity());
    }

    public ProcessorConfig getConfig() {
        return config;
    }

    /**
     * Processes a batch of raw patterns.
     *
     * @param raw batch with shape (n, H, W)
     * @return a new processed batch of the same data type
     * @throws InvalidShapeException   if the crop window lies outside the image
     * @throws InvalidBinningException if the extent is not divisible by the bin size
     */
    public DiffractionPatterns process(DiffractionPatterns raw) {
        DiffractionPatterns patterns = filter(raw);

        if (config.getCrop().isPresent()) {
            ProcessorConfig.Crop crop = config.getCrop().get();
            int x0 = cropStart(crop.center().positionXPx(), crop.extent().widthPx(), patterns.getWidth(), "x");
            int y0 = cropStart(crop.center().positionYPx(), crop.extent().heightPx(), patterns.getHeight(), "y");
            int w = patterns.getWidth();
            patterns = remap(patterns, crop.extent().heightPx(), crop.extent().widthPx(),
                    (y, x) -> (y + y0) * w + (x + x0));
        }

        if (config.getBinning().isPresent()) {
            patterns = bin(patterns, config.getBinning().get());
        }

        if (config.getPadding().isPresent()) {
            ProcessorConfig.Padding padding = config.getPadding().get();
            patterns = remap(patterns, patterns.getHeight() + 2 * padding.padY(),
                    patterns.getWidth() + 2 * padding.padX(),
                    padMap(patterns.getExtent(), padding));
        }

        if (config.isFlipHorizontal()) {
            int w = patterns.getWidth();
            patterns = remap(patterns, patterns.getHeight(), w, (y, x) -> y * w + (w - 1 - x));
        }

        if (config.isFlipVertical()) {
            int h = patterns.getHeight();
            int w = patterns.getWidth();
            patterns = remap(patterns, h, w, (y, x) -> (h - 1 - y) * w + x);
        }

        if (config.isTranspose()) {
            int w = patterns.getWidth();
            patterns = remap(patterns, patterns.getWidth(), patterns.getHeight(), (y, x) -> x * w + y);
        }

        if (patterns == raw) {
            // Never hand back the caller's batch
            patterns = raw.copy();
        }
        return patterns;
    }

    /**
     * Applies the geometric steps to a bad-pixel mask. The intensity filter does not
     * apply to masks.
     *
     * @param badPixels raw mask with the detector extent
     * @return processed mask with the processed extent
     */
    public BadPixels processBadPixels(BadPixels badPixels) {
        int h = badPixels.getHeight();
        int w = badPixels.getWidth();
        boolean[] mask = badPixels.toArray();

        if (config.getCrop().isPresent()) {
            ProcessorConfig.Crop crop = config.getCrop().get();
            int x0 = cropStart(crop.center().positionXPx(), crop.extent().widthPx(), w, "x");
            int y0 = cropStart(crop.center().positionYPx(), crop.extent().heightPx(), h, "y");
            int srcW = w;
            mask = remap(mask, crop.extent().heightPx(), crop.extent().widthPx(),
                    (y, x) -> (y + y0) * srcW + (x + x0));
            h = crop.extent().heightPx();
            w = crop.extent().widthPx();
        }

        if (config.getBinning().isPresent()) {
            ProcessorConfig.Binning binning = config.getBinning().get();
            checkBinning(new ImageExtent(w, h), binning);
            int outH = h / binning.binSizeY();
            int outW = w / binning.binSizeX();
            boolean[] binned = new boolean[outH * outW];
            for (int y = 0; y < outH; y++) {
                for (int x = 0; x < outW; x++) {
                    boolean all = true;
                    for (int dy = 0; dy < binning.binSizeY() && all; dy++) {
                        for (int dx = 0; dx < binning.binSizeX() && all; dx++) {
                            all = mask[(y * binning.binSizeY() + dy) * w + x * binning.binSizeX() + dx];
                        }
                    }
                    binned[y * outW + x] = all;
                }
            }
            mask = binned;
            h = outH;
            w = outW;
        }

        if (config.getPadding().isPresent()) {
            ProcessorConfig.Padding padding = config.getPadding().get();
            PixelMap map = padMap(new ImageExtent(w, h), padding);
            h += 2 * padding.padY();
            w += 2 * padding.padX();
            mask = remap(mask, h, w, map);
        }

        if (config.isFlipHorizontal()) {
            int srcW = w;
            mask = remap(mask, h, w, (y, x) -> y * srcW + (srcW - 1 - x));
        }

        if (config.isFlipVertical()) {
            int srcH = h;
            int srcW = w;
            mask = remap(mask, h, w, (y, x) -> (srcH - 1 - y) * srcW + x);
        }

        if (config.isTranspose()) {
            int srcW = w;
            mask = remap(mask, w, h, (y, x) -> x * srcW + y);
            int tmp = h;
            h = w;
            w = tmp;
        }

        return BadPixels.of(h, w, mask);
    }

    /**
     * Computes the extent patterns from the given detector will have after processing.
     */
    public ImageExtent getProcessedExtent(ImageExtent detectorExtent) {
        return processBadPixels(BadPixels.none(detectorExtent)).getExtent();
    }

    // ==================== Steps ====================

    private DiffractionPatterns filter(DiffractionPatterns raw) {
        if (config.getLowerBound().isEmpty() && config.getUpperBound().isEmpty()) {
            return raw;
        }
        double lower = config.getLowerBound().map(Long::doubleValue).orElse(Double.NEGATIVE_INFINITY);
        double upper = config.getUpperBound().map(Long::doubleValue).orElse(Double.POSITIVE_INFINITY);
        DiffractionPatterns filtered = raw.copy();
        int zeroed = 0;
        for (int p = 0; p < filtered.getNumPatterns(); p++) {
            for (int y = 0; y < filtered.getHeight(); y++) {
                for (int x = 0; x < filtered.getWidth(); x++) {
                    double value = filtered.getDouble(p, y, x);
                    if (value < lower || value >= upper) {
                        filtered.setLong(p, y, x, 0);
                        zeroed++;
                    }
                }
            }
        }
        logger.trace("Intensity filter zeroed {} values", zeroed);
        return filtered;
    }

    private static DiffractionPatterns bin(DiffractionPatterns patterns, ProcessorConfig.Binning binning) {
        checkBinning(patterns.getExtent(), binning);
        int by = binning.binSizeY();
        int bx = binning.binSizeX();
        int outH = patterns.getHeight() / by;
        int outW = patterns.getWidth() / bx;
        PatternDataType dataType = patterns.getDataType();
        DiffractionPatterns binned = DiffractionPatterns.allocate(dataType, patterns.getNumPatterns(), outH, outW);

        for (int p = 0; p < patterns.getNumPatterns(); p++) {
            for (int y = 0; y < outH; y++) {
                for (int x = 0; x < outW; x++) {
                    if (dataType.isInteger()) {
                        long sum = 0;
                        for (int dy = 0; dy < by; dy++) {
                            for (int dx = 0; dx < bx; dx++) {
                                sum += patterns.getLong(p, y * by + dy, x * bx + dx);
                            }
                        }
                        binned.setLong(p, y, x, sum);
                    } else {
                        double sum = 0;
                        for (int dy = 0; dy < by; dy++) {
                            for (int dx = 0; dx < bx; dx++) {
                                sum += patterns.getDouble(p, y * by + dy, x * bx + dx);
                            }
                        }
                        binned.setDouble(p, y, x, sum);
                    }
                }
            }
        }
        return binned;
    }

    private static void checkBinning(ImageExtent extent, ProcessorConfig.Binning binning) {
        if (extent.widthPx() % binning.binSizeX() != 0 || extent.heightPx() % binning.binSizeY() != 0) {
            throw new InvalidBinningException(String.format(
                    "Extent %s is not divisible by bin size %dx%d",
                    extent, binning.binSizeX(), binning.binSizeY()));
        }
    }

    private static int cropStart(int center, int size, int imageSize, String axis) {
        int start = center - size / 2;
        if (start < 0 || start + size > imageSize) {
            throw new InvalidShapeException(String.format(
                    "Crop window [%d, %d) along %s lies outside image of size %d",
                    start, start + size, axis, imageSize));
        }
        return start;
    }

    private static PixelMap padMap(ImageExtent extent, ProcessorConfig.Padding padding) {
        int w = extent.widthPx();
        int h = extent.heightPx();
        int px = padding.padX();
        int py = padding.padY();
        return (y, x) -> {
            int sy = y - py;
            int sx = x - px;
            return (sy >= 0 && sy < h && sx >= 0 && sx < w) ? sy * w + sx : -1;
        };
    }

    private static DiffractionPatterns remap(DiffractionPatterns src, int outH, int outW, PixelMap map) {
        DiffractionPatterns out = DiffractionPatterns.allocate(src.getDataType(), src.getNumPatterns(), outH, outW);
        int srcW = src.getWidth();
        for (int y = 0; y < outH; y++) {
            for (int x = 0; x < outW; x++) {
                int index = map.sourceIndex(y, x);
                if (index < 0) {
                    continue;
                }
                int sy = index / srcW;
                int sx = index % srcW;
                for (int p = 0; p < src.getNumPatterns(); p++) {
                    out.setDouble(p, y, x, src.getDouble(p, sy, sx));
                }
            }
        }
        return out;
    }

    private static boolean[] remap(boolean[] src, int outH, int outW, PixelMap map) {
        boolean[] out = new boolean[outH * outW];
        for (int y = 0; y < outH; y++) {
            for (int x = 0; x < outW; x++) {
                int index = map.sourceIndex(y, x);
                out[y * outW + x] = index >= 0 && src[index];
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "PatternProcessor{" + config + "}";
    }
}
