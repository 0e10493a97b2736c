package ptychodus.diffraction.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of processing steps applied to each raw pattern batch.
 * <p>
 * Every step is optional. Steps run in a fixed order: intensity filter, crop,
 * binning, padding, horizontal flip, vertical flip, transpose.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class ProcessorConfig {

    /**
     * Crop window; rows and columns {@code [c - e/2, c - e/2 + e)} are kept.
     */
    public record Crop(CropCenter center, ImageExtent extent) {
        public Crop {
            Objects.requireNonNull(center, "Crop center must not be null");
            Objects.requireNonNull(extent, "Crop extent must not be null");
        }
    }

    /**
     * Block sizes for summation binning.
     */
    public record Binning(int binSizeX, int binSizeY) {
    }

    /**
     * Zero padding added on each side.
     */
    public record Padding(int padX, int padY) {
    }

    // Intensity filter (lower inclusive kept, upper exclusive kept)
    private final Long lowerBound;
    private final Long upperBound;

    // Geometry
    private final Crop crop;
    private final Binning binning;
    private final Padding padding;

    // Orientation
    private final boolean flipHorizontal;
    private final boolean flipVertical;
    private final boolean transpose;

    private ProcessorConfig(Builder builder) {
        this.lowerBound = builder.lowerBound;
        this.upperBound = builder.upperBound;
        this.crop = builder.crop;
        this.binning = builder.binning;
        this.padding = builder.padding;
        this.flipHorizontal = builder.flipHorizontal;
        this.flipVertical = builder.flipVertical;
        this.transpose = builder.transpose;
    }

    /**
     * A configuration with no steps.
     */
    public static ProcessorConfig identity() {
        return builder().build();
    }

    public Optional<Long> getLowerBound() {
        return Optional.ofNullable(lowerBound);
    }

    public Optional<Long> getUpperBound() {
        return Optional.ofNullable(upperBound);
    }

    public Optional<Crop> getCrop() {
        return Optional.ofNullable(crop);
    }

    public Optional<Binning> getBinning() {
        return Optional.ofNullable(binning);
    }

    public Optional<Padding> getPadding() {
        return Optional.ofNullable(padding);
    }

    public boolean isFlipHorizontal() {
        return flipHorizontal;
    }

    public boolean isFlipVertical() {
        return flipVertical;
    }

    public boolean isTranspose() {
        return transpose;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessorConfig that = (ProcessorConfig) o;
        return flipHorizontal == that.flipHorizontal &&
                flipVertical == that.flipVertical &&
                transpose == that.transpose &&
                Objects.equals(lowerBound, that.lowerBound) &&
                Objects.equals(upperBound, that.upperBound) &&
                Objects.equals(crop, that.crop) &&
                Objects.equals(binning, that.binning) &&
                Objects.equals(padding, that.padding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerBound, upperBound, crop, binning, padding,
                flipHorizontal, flipVertical, transpose);
    }

    @Override
    public String toString() {
        return String.format("ProcessorConfig{bounds=[%s, %s), crop=%s, binning=%s, padding=%s, hflip=%s, vflip=%s, transpose=%s}",
                lowerBound, upperBound, crop, binning, padding, flipHorizontal, flipVertical, transpose);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ProcessorConfig.
     */
    public static class Builder {
        private Long lowerBound;
        private Long upperBound;
        private Crop crop;
        private Binning binning;
        private Padding padding;
        private boolean flipHorizontal = false;
        private boolean flipVertical = false;
        private boolean transpose = false;

        private Builder() {
        }

        /**
         * Values below this bound are zeroed.
         */
        public Builder lowerBound(long lowerBound) {
            this.lowerBound = lowerBound;
            return this;
        }

        /**
         * Values at or above this bound are zeroed.
         */
        public Builder upperBound(long upperBound) {
            this.upperBound = upperBound;
            return this;
        }

        public Builder crop(int centerX, int centerY, int width, int height) {
            this.crop = new Crop(new CropCenter(centerX, centerY), new ImageExtent(width, height));
            return this;
        }

        public Builder binning(int binSizeX, int binSizeY) {
            this.binning = new Binning(binSizeX, binSizeY);
            return this;
        }

        public Builder padding(int padX, int padY) {
            this.padding = new Padding(padX, padY);
            return this;
        }

        public Builder flipHorizontal(boolean flipHorizontal) {
            this.flipHorizontal = flipHorizontal;
            return this;
        }

        public Builder flipVertical(boolean flipVertical) {
            this.flipVertical = flipVertical;
            return this;
        }

        public Builder transpose(boolean transpose) {
            this.transpose = transpose;
            return this;
        }

        public ProcessorConfig build() {
            if (crop != null && (crop.extent().widthPx() < 1 || crop.extent().heightPx() < 1)) {
                throw new IllegalStateException("Crop extent must be at least 1x1: " + crop.extent());
            }
            if (binning != null && (binning.binSizeX() < 1 || binning.binSizeY() < 1)) {
                throw new IllegalStateException("Bin size must be positive: " + binning);
            }
            if (padding != null && (padding.padX() < 0 || padding.padY() < 0)) {
                throw new IllegalStateException("Padding must be non-negative: " + padding);
            }
            return new ProcessorConfig(this);
        }
    }
}
