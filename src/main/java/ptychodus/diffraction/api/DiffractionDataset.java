package ptychodus.diffraction.api;

import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionMetadata;

import java.util.List;
import java.util.Optional;

/**
 * A raw diffraction dataset: metadata plus the arrays that make it up.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public interface DiffractionDataset {

    DiffractionMetadata getMetadata();

    /**
     * Raw arrays in file order.
     */
    List<DiffractionArray> getArrays();

    /**
     * Bad-pixel map shipped with the dataset, if any.
     */
    default Optional<BadPixels> getBadPixels() {
        return Optional.empty();
    }
}
