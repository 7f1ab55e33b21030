package com.project.raster.segmentation.model;

public enum DecoderType {
    ARGMAX,
    PRESENCE_SPECIES
}
