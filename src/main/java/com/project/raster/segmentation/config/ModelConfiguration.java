package com.project.raster.segmentation.config;

import com.project.raster.segmentation.model.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ModelProperties.class)
public class ModelConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ModelConfiguration.class);

    @Bean
    public ModelRegistry modelRegistry(ModelProperties properties) {
        ModelRegistry registry = new ModelRegistry(properties.models());
        if (registry.isEmpty()) {
            log.warn("No models configured; add entries under app.models");
        } else {
            registry.all().forEach(model -> log.info("Registered model {}", model.id()));
        }
        return registry;
    }
}
