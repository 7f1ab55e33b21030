package com.project.raster.segmentation.io;

import com.project.raster.segmentation.tiling.Window;

import java.io.Closeable;

/**
 * Single-band uint8 label raster written window by window.
 * Writes are independent; a failed run keeps whatever was written before the failure.
 */
public interface ImageWriter extends Closeable {

    int height();

    int width();

    /**
     * Writes labels shaped {@code [window.height][window.width]} at {@code window}.
     */
    void write(byte[][] labels, Window window);

    /**
     * Reads back previously written labels; used by the post-processing pass.
     */
    byte[][] read(Window window);

    @Override
    void close();
}
