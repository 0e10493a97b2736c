package ptychodus.diffraction.api;

import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.InvalidShapeException;

import java.util.Objects;

/**
 * In-memory {@link DiffractionArray}.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class SimpleDiffractionArray implements DiffractionArray {

    private final String label;
    private final long[] indexes;
    private final DiffractionPatterns patterns;

    public SimpleDiffractionArray(String label, long[] indexes, DiffractionPatterns patterns) {
        this.label = Objects.requireNonNull(label, "Label must not be null");
        this.indexes = Objects.requireNonNull(indexes, "Indexes must not be null").clone();
        this.patterns = Objects.requireNonNull(patterns, "Patterns must not be null");
        if (indexes.length != patterns.getNumPatterns()) {
            throw new InvalidShapeException(String.format("Array %s has %d indexes but %d patterns",
                    label, indexes.length, patterns.getNumPatterns()));
        }
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public long[] getIndexes() {
        return indexes.clone();
    }

    @Override
    public DiffractionPatterns getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return "SimpleDiffractionArray{" + label + ", " + patterns + "}";
    }
}
