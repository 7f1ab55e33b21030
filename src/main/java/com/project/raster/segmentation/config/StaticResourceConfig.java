package com.project.raster.segmentation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Maps {@code /results/**} to {@code app.results.dir} (same default as StorageService), so result
 * links work regardless of the working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    @Value("${app.results.dir:results}")
    private String resultsDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        Path abs = Paths.get(resultsDir).toAbsolutePath().normalize();
        registry.addResourceHandler("/results/**")
                .addResourceLocations("file:" + abs + "/");
    }
}
