package ptychodus.diffraction.api;

/**
 * Receives change notifications from an assembled diffraction dataset.
 * <p>
 * All callbacks run on the thread that drains foreground tasks, or on the thread
 * that called the mutating operation.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public interface DiffractionDatasetObserver {

    /**
     * An array view was inserted at the given position.
     */
    void handleArrayInserted(int index);

    /**
     * The array view at the given position changed in place.
     */
    default void handleArrayChanged(int index) {
    }

    /**
     * The dataset was cleared, reloaded or imported.
     */
    void handleDatasetReloaded();

    /**
     * The raw bad-pixel map was replaced.
     *
     * @param numBadPixels number of bad pixels in the new map
     */
    default void handleBadPixelsChanged(int numBadPixels) {
    }
}
