package com.project.raster.segmentation.model;

/**
 * Creates ready-to-run models from catalogue entries.
 */
public interface ModelLoader {

    InferenceModel load(ModelConfig config);
}
