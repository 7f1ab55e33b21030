package com.project.raster.segmentation.service;

/**
 * Neighbourhood filter over a block of labels.
 */
public interface LabelFilter {

    /**
     * Number of pixels beyond a block border that can influence the filtered value of a pixel.
     * Zero means the filter is a no-op.
     */
    int reach();

    byte[][] apply(byte[][] labels);
}
