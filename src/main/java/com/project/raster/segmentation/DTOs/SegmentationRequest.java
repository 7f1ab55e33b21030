package com.project.raster.segmentation.DTOs;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a segmentation request from the web form or the command line.
 * {@code null} means "use the default".
 */
public record SegmentationRequest(
        String model,
        String revision,
        Integer tileSize,
        Integer batchSize,
        Integer blurKernelSize,
        Integer morphKernelSize,
        List<Integer> bandOrder
) {
    public static SegmentationRequest forModel(String model) {
        return new SegmentationRequest(model, null, null, null, null, null, null);
    }

    /**
     * Parses a comma separated, 1-based band list such as {@code "3,2,1"}.
     *
     * @return {@code null} for a blank value
     */
    public static List<Integer> parseBandOrder(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        List<Integer> bands = new ArrayList<>();
        for (String part : value.split(",")) {
            try {
                bands.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("Band order must be a comma separated list of band numbers: " + value, e);
            }
        }
        return bands;
    }
}
