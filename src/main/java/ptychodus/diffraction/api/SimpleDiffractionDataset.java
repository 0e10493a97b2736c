package ptychodus.diffraction.api;

import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionMetadata;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link DiffractionDataset}.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class SimpleDiffractionDataset implements DiffractionDataset {

    private final DiffractionMetadata metadata;
    private final List<DiffractionArray> arrays;
    private final BadPixels badPixels;

    public SimpleDiffractionDataset(DiffractionMetadata metadata, List<DiffractionArray> arrays) {
        this(metadata, arrays, null);
    }

    public SimpleDiffractionDataset(DiffractionMetadata metadata, List<DiffractionArray> arrays,
                                    BadPixels badPixels) {
        this.metadata = Objects.requireNonNull(metadata, "Metadata must not be null");
        this.arrays = List.copyOf(arrays);
        this.badPixels = badPixels;
    }

    public static SimpleDiffractionDataset createNull() {
        return new SimpleDiffractionDataset(DiffractionMetadata.createNull(), List.of());
    }

    @Override
    public DiffractionMetadata getMetadata() {
        return metadata;
    }

    @Override
    public List<DiffractionArray> getArrays() {
        return arrays;
    }

    @Override
    public Optional<BadPixels> getBadPixels() {
        return Optional.ofNullable(badPixels);
    }
}
