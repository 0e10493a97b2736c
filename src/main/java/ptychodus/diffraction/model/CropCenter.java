package ptychodus.diffraction.model;

/**
 * Pixel position of the crop window center on the detector.
 *
 * @param positionXPx column of the center
 * @param positionYPx row of the center
 * @author Ptychodus Team
 * @since 0.1.0
 */
public record CropCenter(int positionXPx, int positionYPx) {
}
