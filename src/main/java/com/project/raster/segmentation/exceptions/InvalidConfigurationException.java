package com.project.raster.segmentation.exceptions;

/** Invalid tile size, kernel size, band order, data type or model selection. */
public class InvalidConfigurationException extends SegmentationException {
    public InvalidConfigurationException(String message) { super(message); }
    public InvalidConfigurationException(String message, Throwable cause) { super(message, cause); }
}
