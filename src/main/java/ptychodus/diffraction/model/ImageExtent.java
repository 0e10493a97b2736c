package ptychodus.diffraction.model;

/**
 * Width and height of an image in pixels.
 *
 * @param widthPx  width in pixels
 * @param heightPx height in pixels
 * @author Ptychodus Team
 * @since 0.1.0
 */
public record ImageExtent(int widthPx, int heightPx) {

    public ImageExtent {
        if (widthPx < 0 || heightPx < 0) {
            throw new IllegalArgumentException("Image extent must be non-negative: "
                    + widthPx + "x" + heightPx);
        }
    }

    /**
     * Returns the number of pixels covered by this extent.
     */
    public int getNumPixels() {
        return Math.multiplyExact(widthPx, heightPx);
    }

    /**
     * Returns the extent with width and height swapped.
     */
    public ImageExtent transposed() {
        return new ImageExtent(heightPx, widthPx);
    }

    @Override
    public String toString() {
        return widthPx + "W x " + heightPx + "H";
    }
}
