package ptychodus.diffraction.service;

import ptychodus.diffraction.model.AssembledDiffractionData;

/**
 * Destination for a processed array. Called on the consumer thread.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
@FunctionalInterface
public interface ArrayAssembler {

    /**
     * Writes a processed array into its slot range and publishes its view.
     *
     * @param arrayIndex submission index of the array
     * @param label      array label
     * @param data       processed data
     */
    void assembleArray(int arrayIndex, String label, AssembledDiffractionData data);
}
