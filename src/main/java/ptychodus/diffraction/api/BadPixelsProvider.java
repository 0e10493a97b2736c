package ptychodus.diffraction.api;

import ptychodus.diffraction.model.BadPixels;

import java.util.Optional;

/**
 * Holds the current raw bad-pixel map.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public interface BadPixelsProvider {

    Optional<BadPixels> getBadPixels();

    /**
     * Replaces the bad-pixel map. Passing {@code null} clears it.
     */
    void setBadPixels(BadPixels badPixels);
}
