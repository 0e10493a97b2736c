package ptychodus.diffraction.service;

import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.service.buffer.PatternBuffer;

import java.nio.ByteBuffer;
import java.util.function.BooleanSupplier;

/**
 * Read-only view of one assembled array's slots in the dataset buffer.
 * <p>
 * Pattern data is not copied; reads go to the shared buffer. A view belongs to the
 * dataset generation that created it and fails with {@link IllegalStateException}
 * once the dataset is cleared, reloaded or re-imported.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class AssembledDiffractionPatternArray {

    private final String label;
    private final int arrayIndex;
    private final PatternBuffer buffer;
    private final int offset;
    private final long[] indexes;
    private final double[] patternCounts;
    private final BadPixels badPixels;
    private final BooleanSupplier valid;

    AssembledDiffractionPatternArray(String label, int arrayIndex, PatternBuffer buffer, int offset,
                                     long[] indexes, double[] patternCounts, BadPixels badPixels,
                                     BooleanSupplier valid) {
        this.label = label;
        this.arrayIndex = arrayIndex;
        this.buffer = buffer;
        this.offset = offset;
        this.indexes = indexes;
        this.patternCounts = patternCounts;
        this.badPixels = badPixels;
        this.valid = valid;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Submission index; views are ordered by this value.
     */
    public int getArrayIndex() {
        return arrayIndex;
    }

    /**
     * First buffer slot owned by this array.
     */
    public int getOffset() {
        return offset;
    }

    public int getNumPatterns() {
        return indexes.length;
    }

    public ImageExtent getPatternExtent() {
        return buffer.getPatternExtent();
    }

    public boolean isValid() {
        return valid.getAsBoolean();
    }

    public long[] getIndexes() {
        return indexes.clone();
    }

    public double[] getPatternCounts() {
        return patternCounts.clone();
    }

    public double getPatternCounts(int index) {
        return patternCounts[index];
    }

    /**
     * Copies one pattern as a batch of one.
     */
    public DiffractionPatterns getPattern(int index) {
        checkValid();
        return buffer.readPatterns(offset + checkIndex(index), 1);
    }

    /**
     * Copies all patterns of this array.
     */
    public DiffractionPatterns getPatterns() {
        checkValid();
        return buffer.readPatterns(offset, indexes.length);
    }

    /**
     * Read-only view of one pattern's bytes in the shared buffer.
     */
    public ByteBuffer getPatternBytes(int index) {
        checkValid();
        return buffer.getPatternBytes(offset + checkIndex(index));
    }

    /**
     * Per-pixel mean over this array's patterns, with bad pixels set to zero.
     *
     * @return row-major values of shape [height][width]
     */
    public double[][] getAveragePattern() {
        checkValid();
        ImageExtent extent = buffer.getPatternExtent();
        double[][] average = new double[extent.heightPx()][extent.widthPx()];
        int n = indexes.length;
        if (n == 0) {
            return average;
        }
        for (int i = 0; i < n; i++) {
            DiffractionPatterns pattern = buffer.readPatterns(offset + i, 1);
            for (int y = 0; y < extent.heightPx(); y++) {
                for (int x = 0; x < extent.widthPx(); x++) {
                    if (!badPixels.isBad(y, x)) {
                        average[y][x] += pattern.getDouble(0, y, x);
                    }
                }
            }
        }
        for (double[] row : average) {
            for (int x = 0; x < row.length; x++) {
                row[x] /= n;
            }
        }
        return average;
    }

    public double getMeanPatternCounts() {
        if (patternCounts.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double counts : patternCounts) {
            sum += counts;
        }
        return sum / patternCounts.length;
    }

    public double getMaxPatternCounts() {
        double max = 0.0;
        for (double counts : patternCounts) {
            max = Math.max(max, counts);
        }
        return max;
    }

    private int checkIndex(int index) {
        if (index < 0 || index >= indexes.length) {
            throw new IndexOutOfBoundsException("Pattern " + index + " out of range for array of "
                    + indexes.length);
        }
        return index;
    }

    private void checkValid() {
        if (!valid.getAsBoolean()) {
            throw new IllegalStateException("Array view \"" + label + "\" belongs to a previous dataset");
        }
    }

    @Override
    public String toString() {
        return String.format("AssembledDiffractionPatternArray{%d, %s, %d patterns}",
                arrayIndex, label, indexes.length);
    }
}
