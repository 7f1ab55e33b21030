package com.project.raster.segmentation.config;

import com.project.raster.segmentation.model.ModelConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Model catalogue bound from {@code app.models[i].*}.
 */
@ConfigurationProperties("app")
public record ModelProperties(List<ModelConfig> models) {

    public ModelProperties {
        models = models == null ? List.of() : List.copyOf(models);
    }
}
