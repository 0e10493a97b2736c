package ptychodus.diffraction.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes a diffraction dataset before it is loaded: how many patterns each
 * array will contribute, their element type, and optionally the detector extent
 * and the file the dataset came from.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public final class DiffractionMetadata {

    private final List<Integer> numPatternsPerArray;
    private final PatternDataType patternDataType;
    private final ImageExtent detectorExtent;
    private final Path filePath;

    private DiffractionMetadata(Builder builder) {
        this.numPatternsPerArray = List.copyOf(builder.numPatternsPerArray);
        this.patternDataType = builder.patternDataType;
        this.detectorExtent = builder.detectorExtent;
        this.filePath = builder.filePath;
    }

    /**
     * Metadata of the empty dataset.
     */
    public static DiffractionMetadata createNull() {
        return builder().numPatternsPerArray(List.of()).patternDataType(PatternDataType.UINT8).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Integer> getNumPatternsPerArray() {
        return numPatternsPerArray;
    }

    public long getNumPatternsTotal() {
        long total = 0;
        for (int count : numPatternsPerArray) {
            total += count;
        }
        return total;
    }

    public PatternDataType getPatternDataType() {
        return patternDataType;
    }

    public Optional<ImageExtent> getDetectorExtent() {
        return Optional.ofNullable(detectorExtent);
    }

    public Optional<Path> getFilePath() {
        return Optional.ofNullable(filePath);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DiffractionMetadata that = (DiffractionMetadata) o;
        return numPatternsPerArray.equals(that.numPatternsPerArray)
                && patternDataType == that.patternDataType
                && Objects.equals(detectorExtent, that.detectorExtent)
                && Objects.equals(filePath, that.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numPatternsPerArray, patternDataType, detectorExtent, filePath);
    }

    @Override
    public String toString() {
        return String.format("DiffractionMetadata{arrays=%d, patterns=%d, type=%s, detector=%s, file=%s}",
                numPatternsPerArray.size(), getNumPatternsTotal(), patternDataType.getTypeName(),
                detectorExtent, filePath);
    }

    /**
     * Builder for DiffractionMetadata.
     */
    public static class Builder {
        private List<Integer> numPatternsPerArray = List.of();
        private PatternDataType patternDataType = PatternDataType.UINT16;
        private ImageExtent detectorExtent;
        private Path filePath;

        private Builder() {
        }

        public Builder numPatternsPerArray(List<Integer> numPatternsPerArray) {
            this.numPatternsPerArray = numPatternsPerArray;
            return this;
        }

        public Builder patternDataType(PatternDataType patternDataType) {
            this.patternDataType = patternDataType;
            return this;
        }

        public Builder detectorExtent(ImageExtent detectorExtent) {
            this.detectorExtent = detectorExtent;
            return this;
        }

        public Builder filePath(Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public DiffractionMetadata build() {
            if (numPatternsPerArray == null) {
                throw new IllegalStateException("Patterns per array must be set");
            }
            for (Integer count : numPatternsPerArray) {
                if (count == null || count < 0) {
                    throw new IllegalStateException("Patterns per array must be non-negative: "
                            + numPatternsPerArray);
                }
            }
            if (patternDataType == null) {
                throw new IllegalStateException("Pattern data type must be set");
            }
            return new DiffractionMetadata(this);
        }
    }
}
