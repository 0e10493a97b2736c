package ptychodus.diffraction.model;

/**
 * Thrown when an image extent is not divisible by the configured bin size.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class InvalidBinningException extends IllegalArgumentException {

    public InvalidBinningException(String message) {
        super(message);
    }
}
