package ptychodus.diffraction;

import ptychodus.diffraction.api.DiffractionArray;
import ptychodus.diffraction.api.SimpleDiffractionArray;
import ptychodus.diffraction.model.DiffractionMetadata;
import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.PatternDataType;
import ptychodus.diffraction.preferences.DiffractionSettings;

import java.io.FileNotFoundException;
import java.util.List;

/**
 * Shared builders for test patterns, arrays and settings.
 */
public final class PatternFixtures {

    private PatternFixtures() {
    }

    /**
     * Batch where pattern p has every pixel equal to {@code firstValue + p}.
     */
    public static DiffractionPatterns constantPatterns(PatternDataType dataType, int n, int height, int width,
                                                       long firstValue) {
        DiffractionPatterns patterns = DiffractionPatterns.allocate(dataType, n, height, width);
        for (int p = 0; p < n; p++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    patterns.setLong(p, y, x, firstValue + p);
                }
            }
        }
        return patterns;
    }

    /**
     * Batch of one pattern whose pixel (y, x) holds {@code y * width + x}.
     */
    public static DiffractionPatterns rampPattern(PatternDataType dataType, int height, int width) {
        DiffractionPatterns patterns = DiffractionPatterns.allocate(dataType, 1, height, width);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                patterns.setLong(0, y, x, (long) y * width + x);
            }
        }
        return patterns;
    }

    /**
     * uint16 array with indexes {@code firstIndex..firstIndex+n-1}; pattern values are
     * {@code index + 1} everywhere.
     */
    public static DiffractionArray array(String label, long firstIndex, int n, int height, int width) {
        long[] indexes = new long[n];
        for (int i = 0; i < n; i++) {
            indexes[i] = firstIndex + i;
        }
        return new SimpleDiffractionArray(label, indexes,
                constantPatterns(PatternDataType.UINT16, n, height, width, firstIndex + 1));
    }

    /**
     * Array whose data file does not exist.
     */
    public static DiffractionArray missingArray(String label) {
        return new DiffractionArray() {
            @Override
            public String getLabel() {
                return label;
            }

            @Override
            public long[] getIndexes() {
                return new long[0];
            }

            @Override
            public DiffractionPatterns getPatterns() throws FileNotFoundException {
                throw new FileNotFoundException(label + ".h5");
            }
        };
    }

    public static DiffractionMetadata metadata(List<Integer> numPatternsPerArray, int height, int width) {
        return DiffractionMetadata.builder()
                .numPatternsPerArray(numPatternsPerArray)
                .patternDataType(PatternDataType.UINT16)
                .detectorExtent(new ImageExtent(width, height))
                .build();
    }

    /**
     * Settings with every processing step disabled.
     */
    public static DiffractionSettings plainSettings() {
        DiffractionSettings settings = new DiffractionSettings();
        settings.setCropEnabled(false);
        settings.setNumDataThreads(4);
        return settings;
    }
}
