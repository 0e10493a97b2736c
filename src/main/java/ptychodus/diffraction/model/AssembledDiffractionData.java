package ptychodus.diffraction.model;

import java.util.Objects;

/**
 * Result of processing one raw array: per-pattern indexes, processed patterns and
 * per-pattern good-pixel counts, all of length n.
 *
 * @param indexes       pattern indexes
 * @param patterns      processed patterns
 * @param patternCounts sum of good pixels per pattern
 * @author Ptychodus Team
 * @since 0.1.0
 */
public record AssembledDiffractionData(long[] indexes, DiffractionPatterns patterns, double[] patternCounts) {

    public AssembledDiffractionData {
        Objects.requireNonNull(indexes, "Indexes must not be null");
        Objects.requireNonNull(patterns, "Patterns must not be null");
        Objects.requireNonNull(patternCounts, "Pattern counts must not be null");
        int n = patterns.getNumPatterns();
        if (indexes.length != n || patternCounts.length != n) {
            throw new InvalidShapeException(String.format(
                    "Length mismatch: %d indexes, %d patterns, %d counts",
                    indexes.length, n, patternCounts.length));
        }
    }

    /**
     * Builds assembled data, computing each pattern's sum over good pixels.
     *
     * @throws InvalidShapeException if the mask extent differs from the pattern extent
     */
    public static AssembledDiffractionData create(long[] indexes, DiffractionPatterns patterns,
                                                  BadPixels badPixels) {
        return new AssembledDiffractionData(indexes, patterns, computePatternCounts(patterns, badPixels));
    }

    public static double[] computePatternCounts(DiffractionPatterns patterns, BadPixels badPixels) {
        if (!patterns.getExtent().equals(badPixels.getExtent())) {
            throw new InvalidShapeException(String.format(
                    "Bad pixel extent %s does not match pattern extent %s",
                    badPixels.getExtent(), patterns.getExtent()));
        }
        double[] counts = new double[patterns.getNumPatterns()];
        for (int p = 0; p < counts.length; p++) {
            double sum = 0;
            for (int y = 0; y < patterns.getHeight(); y++) {
                for (int x = 0; x < patterns.getWidth(); x++) {
                    if (!badPixels.isBad(y, x)) {
                        sum += patterns.getDouble(p, y, x);
                    }
                }
            }
            counts[p] = sum;
        }
        return counts;
    }

    public int getNumPatterns() {
        return indexes.length;
    }
}
