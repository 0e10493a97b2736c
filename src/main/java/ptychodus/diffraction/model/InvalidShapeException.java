package ptychodus.diffraction.model;

/**
 * Thrown when an array does not have the shape an operation requires, such as a
 * pattern batch whose rank is neither 2 nor 3, or a mask whose extent does not match
 * the detector.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class InvalidShapeException extends IllegalArgumentException {

    public InvalidShapeException(String message) {
        super(message);
    }
}
