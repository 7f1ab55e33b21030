package com.project.raster.segmentation.exceptions;

/** Inference backend failure or a model output that does not match the expected shape. */
public class ModelException extends SegmentationException {
    public ModelException(String message) { super(message); }
    public ModelException(String message, Throwable cause) { super(message, cause); }
}
