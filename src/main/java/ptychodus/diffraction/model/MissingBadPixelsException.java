package ptychodus.diffraction.model;

/**
 * Thrown when a dataset is loaded with bad pixels required but no bad-pixel map set.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class MissingBadPixelsException extends IllegalStateException {

    public MissingBadPixelsException(String message) {
        super(message);
    }
}
