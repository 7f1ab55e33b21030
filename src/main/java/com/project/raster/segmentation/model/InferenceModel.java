package com.project.raster.segmentation.model;

import com.project.raster.segmentation.io.RasterDataType;

import java.util.OptionalInt;

/**
 * Per-tile classifier used by the tiled pipeline.
 * <p>
 * Scores returned by {@link #predict} are summed across overlapping tiles before
 * {@link #postprocess} turns them into labels, so implementations must not assume
 * {@code postprocess} sees raw outputs of a single tile.
 */
public interface InferenceModel {

    String name();

    int inputChannels();

    /** Number of score channels produced per pixel. */
    int numClasses();

    OptionalInt preferredTileSize();

    /**
     * Returns a model bound to the data type of the image about to be processed, so the
     * preprocessing step can scale raw pixel values.
     */
    default InferenceModel forDataType(RasterDataType dataType) {
        return this;
    }

    /**
     * @param batch tiles shaped {@code [B][C][S][S]}
     * @return class scores shaped {@code [B][K][S][S]}
     */
    float[][][][] predict(float[][][][] batch);

    /**
     * @param scores summed scores shaped {@code [K][h][w]}
     * @return labels shaped {@code [h][w]}
     */
    byte[][] postprocess(float[][][] scores);

    /**
     * Scores used in place of inference for a constant tile. They decode to the model's
     * default output value.
     */
    float[][][] shortcut(int tileSize);
}
