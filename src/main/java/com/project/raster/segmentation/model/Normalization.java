package com.project.raster.segmentation.model;

/**
 * Input normalization applied after pixels have been divided by the max pixel value.
 */
public enum Normalization {
    /** Values are only scaled by the max pixel value. */
    NONE,
    /** {@code (x - mean[c]) / std[c]} per channel. */
    STANDARD,
    /** Min-max over the whole tile. */
    MIN_MAX,
    /** Min-max over each channel of a tile. */
    MIN_MAX_PER_CHANNEL
}
