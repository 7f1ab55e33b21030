package com.project.raster.segmentation.tiling;

/**
 * Which image borders a (clipped) tile window touches.
 */
public record EdgeFlags(boolean top, boolean bottom, boolean left, boolean right) {

    public static final EdgeFlags NONE = new EdgeFlags(false, false, false, false);

    /**
     * Classifies a boundary-clipped window against the true image size.
     */
    public static EdgeFlags of(Window clipped, int imageHeight, int imageWidth) {
        return new EdgeFlags(
                clipped.rowOff() == 0,
                clipped.rowEnd() >= imageHeight,
                clipped.colOff() == 0,
                clipped.colEnd() >= imageWidth
        );
    }

    /** Bitmask in the order top, bottom, left, right; used to index cached kernels. */
    int mask() {
        return (top ? 1 : 0) | (bottom ? 2 : 0) | (left ? 4 : 0) | (right ? 8 : 0);
    }
}
