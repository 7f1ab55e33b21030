package com.project.raster.segmentation.exceptions;

/** Domain-specific exception for processing errors. Every segmentation failure is fatal for its run. */
public class SegmentationException extends RuntimeException {
    public SegmentationException(String message) { super(message); }
    public SegmentationException(String message, Throwable cause) { super(message, cause); }
}
