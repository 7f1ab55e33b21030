package com.project.raster.segmentation.service;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.tiling.KernelType;

import java.util.List;

/**
 * Parameters of one tiled segmentation run, validated on construction.
 *
 * @param tileSize        tile edge length {@code S}, positive and even
 * @param batchSize       tiles per inference call
 * @param blurKernelSize  median blur kernel, odd or 0 (disabled when not above 1)
 * @param morphKernelSize opening/closing kernel, odd or 0 (disabled when not above 1)
 * @param bandOrder       1-based source bands fed to the model, in model channel order
 * @param kernelType      weighting kernel family
 */
public record ProcessingConfig(
        int tileSize,
        int batchSize,
        int blurKernelSize,
        int morphKernelSize,
        List<Integer> bandOrder,
        KernelType kernelType
) {
    public static final int DEFAULT_BATCH_SIZE = 1;
    public static final int DEFAULT_BLUR_KERNEL_SIZE = 5;
    public static final int DEFAULT_MORPH_KERNEL_SIZE = 0;

    public ProcessingConfig {
        if (tileSize <= 0 || tileSize % 2 != 0) {
            throw new InvalidConfigurationException("Tile size must be a positive even number: " + tileSize);
        }
        if (batchSize < 1) {
            throw new InvalidConfigurationException("Batch size must be at least 1: " + batchSize);
        }
        checkOddOrZero("Blur kernel size", blurKernelSize);
        checkOddOrZero("Morphology kernel size", morphKernelSize);
        if (bandOrder == null || bandOrder.isEmpty()) {
            throw new InvalidConfigurationException("Band order must name at least one band");
        }
        if (bandOrder.stream().anyMatch(b -> b == null || b < 1)) {
            throw new InvalidConfigurationException("Band indices are 1-based: " + bandOrder);
        }
        bandOrder = List.copyOf(bandOrder);
        kernelType = kernelType == null ? KernelType.BARTLETT_HANN : kernelType;
    }

    public ProcessingConfig(int tileSize, int batchSize, int blurKernelSize, int morphKernelSize, List<Integer> bandOrder) {
        this(tileSize, batchSize, blurKernelSize, morphKernelSize, bandOrder, KernelType.BARTLETT_HANN);
    }

    /** Tiles overlap by half. */
    public int stride() {
        return tileSize / 2;
    }

    public boolean applyMedianBlur() {
        return blurKernelSize > 1;
    }

    public boolean applyMorphology() {
        return morphKernelSize > 1;
    }

    public int[] bandOrderArray() {
        return bandOrder.stream().mapToInt(Integer::intValue).toArray();
    }

    private static void checkOddOrZero(String what, int value) {
        if (value < 0 || (value != 0 && value % 2 == 0)) {
            throw new InvalidConfigurationException(what + " must be odd or 0: " + value);
        }
    }
}
