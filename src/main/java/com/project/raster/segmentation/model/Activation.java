package com.project.raster.segmentation.model;

/** Final activation applied to summed model outputs before labels are decoded. */
public enum Activation {
    NONE,
    SIGMOID,
    SOFTMAX
}
