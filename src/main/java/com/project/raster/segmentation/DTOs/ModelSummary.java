package com.project.raster.segmentation.DTOs;

import com.project.raster.segmentation.model.ModelConfig;

public record ModelSummary(String name, String revision, String description, int inputChannels,
                           int numClasses, Integer tileSize) {

    public static ModelSummary of(ModelConfig config) {
        return new ModelSummary(config.name(), config.revision(), config.description(),
                config.inputChannels(), config.numClasses(), config.tileSize());
    }
}
