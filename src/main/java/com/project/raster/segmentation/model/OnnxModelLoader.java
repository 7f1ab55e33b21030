package com.project.raster.segmentation.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads ONNX models through {@link ModelCache} and {@link OpenCvDnnBackend}. Each revision is
 * loaded once and kept for the lifetime of the application.
 */
@Component
public class OnnxModelLoader implements ModelLoader {
    private static final Logger log = LoggerFactory.getLogger(OnnxModelLoader.class);

    private final ModelCache cache;
    private final Map<String, SegmentationModel> loaded = new ConcurrentHashMap<>();

    public OnnxModelLoader(ModelCache cache) {
        this.cache = cache;
    }

    @Override
    public InferenceModel load(ModelConfig config) {
        return loaded.computeIfAbsent(config.id(), id -> {
            log.info("Loading model {}", id);
            return new SegmentationModel(config, new OpenCvDnnBackend(cache.resolve(config)));
        });
    }
}
