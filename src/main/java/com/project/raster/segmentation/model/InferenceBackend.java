package com.project.raster.segmentation.model;

/**
 * Opaque inference handle: raw preprocessed tiles in, raw scores out.
 */
public interface InferenceBackend extends AutoCloseable {

    /**
     * @param input preprocessed tiles shaped {@code [B][C][S][S]}
     * @return raw outputs shaped {@code [B][K][S][S]}
     */
    float[][][][] run(float[][][][] input);

    @Override
    default void close() {
    }
}
