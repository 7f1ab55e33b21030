package com.project.raster.segmentation.io;

import com.project.raster.segmentation.tiling.Window;

import java.io.Closeable;
import java.util.Optional;

/**
 * Windowed access to a source raster. Handles serve one window read at a time.
 */
public interface ImageReader extends Closeable {

    int height();

    int width();

    int bandCount();

    RasterDataType dataType();

    /** Georeferencing tags to pass through to the output, if the source carries any. */
    Optional<GeoReference> geoReference();

    /**
     * Reads a window without bounds restrictions: pixels outside the raster take {@code fillValue}.
     *
     * @param window    window in image coordinates, may extend past the right and bottom edges
     * @param bandOrder 1-based source band indices in output order, or {@code null} for all bands
     * @param fillValue value for pixels outside the raster
     * @return samples shaped {@code [bands][window.height][window.width]}
     */
    float[][][] readWindow(Window window, int[] bandOrder, float fillValue);

    @Override
    void close();
}
