package com.project.raster.segmentation.DTOs;

import java.nio.file.Path;
import java.util.List;

public record SegmentationResult(
        String modelId,
        int width,
        int height,
        int tileSize,
        int stride,
        int tileCount,
        int shortcutTileCount,
        List<ClassCount> classCounts,
        long elapsedMillis,
        Path output,
        byte[] previewPng     // colour-coded labels, downscaled for the result page
) {
    /** Pixels carrying {@code label} in the output raster. */
    public record ClassCount(int label, long pixels, double percent) {
    }
}
