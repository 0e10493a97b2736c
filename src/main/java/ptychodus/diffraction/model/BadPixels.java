package ptychodus.diffraction.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable boolean mask over a detector image; {@code true} marks a bad pixel.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public final class BadPixels {

    private final int height;
    private final int width;
    private final boolean[] mask;

    private BadPixels(int height, int width, boolean[] mask) {
        this.height = height;
        this.width = width;
        this.mask = mask;
    }

    /**
     * Creates a mask with no bad pixels.
     */
    public static BadPixels none(ImageExtent extent) {
        return new BadPixels(extent.heightPx(), extent.widthPx(), new boolean[extent.getNumPixels()]);
    }

    /**
     * Creates a mask from row-major values. The array is copied.
     */
    public static BadPixels of(int height, int width, boolean[] values) {
        Objects.requireNonNull(values, "Mask values must not be null");
        if (height < 0 || width < 0 || (long) height * width != values.length) {
            throw new InvalidShapeException(String.format(
                    "Mask of %d values does not match extent %d x %d", values.length, height, width));
        }
        return new BadPixels(height, width, values.clone());
    }

    /**
     * Creates a mask with an arbitrary shape. Only rank-2 shapes are accepted.
     *
     * @throws InvalidShapeException if the rank is not 2
     */
    public static BadPixels fromShape(int[] shape, boolean[] values) {
        if (shape == null || shape.length != 2) {
            throw new InvalidShapeException("Invalid bad pixel dimensions! Got "
                    + Arrays.toString(shape));
        }
        return of(shape[0], shape[1], values);
    }

    public static BadPixels of(boolean[][] rows) {
        int h = rows.length;
        int w = h > 0 ? rows[0].length : 0;
        boolean[] values = new boolean[h * w];
        for (int y = 0; y < h; y++) {
            if (rows[y].length != w) {
                throw new InvalidShapeException("Ragged mask rows are not supported");
            }
            System.arraycopy(rows[y], 0, values, y * w, w);
        }
        return new BadPixels(h, w, values);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public ImageExtent getExtent() {
        return new ImageExtent(width, height);
    }

    public boolean isBad(int y, int x) {
        return mask[y * width + x];
    }

    public int countBadPixels() {
        int count = 0;
        for (boolean bad : mask) {
            if (bad) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a row-major copy of the mask.
     */
    public boolean[] toArray() {
        return mask.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BadPixels that = (BadPixels) o;
        return height == that.height && width == that.width && Arrays.equals(mask, that.mask);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(height, width) + Arrays.hashCode(mask);
    }

    @Override
    public String toString() {
        return String.format("BadPixels{%d x %d, bad=%d}", height, width, countBadPixels());
    }
}
