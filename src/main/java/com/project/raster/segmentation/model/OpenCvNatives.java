package com.project.raster.segmentation.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact, once per JVM.
 */
public final class OpenCvNatives {
    private static final Logger log = LoggerFactory.getLogger(OpenCvNatives.class);

    private static volatile boolean loaded;

    private OpenCvNatives() {
    }

    public static synchronized void load() {
        if (loaded) {
            return;
        }
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        log.info("OpenCV {} loaded", org.opencv.core.Core.VERSION);
    }
}
