package com.project.raster.segmentation.tiling;

import java.util.Optional;

/**
 * Rectangular region of a raster in full-image pixel coordinates.
 * Offsets are measured from the top-left corner of the image.
 */
public record Window(int rowOff, int colOff, int height, int width) {

    public Window {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("Window size must not be negative: " + height + "x" + width);
        }
    }

    public int rowEnd() {
        return rowOff + height;
    }

    public int colEnd() {
        return colOff + width;
    }

    public boolean isEmpty() {
        return height == 0 || width == 0;
    }

    /**
     * Clips this window to an image of the given size.
     *
     * @return the clipped window, or empty when no pixel of this window lies inside the image
     */
    public Optional<Window> clipTo(int imageHeight, int imageWidth) {
        int clippedHeight = Math.max(0, Math.min(height, imageHeight - rowOff));
        int clippedWidth = Math.max(0, Math.min(width, imageWidth - colOff));
        if (clippedHeight <= 0 || clippedWidth <= 0 || rowOff >= imageHeight || colOff >= imageWidth) {
            return Optional.empty();
        }
        return Optional.of(new Window(rowOff, colOff, clippedHeight, clippedWidth));
    }

    @Override
    public String toString() {
        return "Window[row=" + rowOff + ", col=" + colOff + ", " + height + "x" + width + "]";
    }
}
