package com.project.raster.segmentation.exceptions;

/** Unreadable source, unwritable destination or a failed window read/write. */
public class RasterIOException extends SegmentationException {
    public RasterIOException(String message) { super(message); }
    public RasterIOException(String message, Throwable cause) { super(message, cause); }
}
