package com.project.raster.segmentation.tiling;

import java.util.function.IntFunction;

/**
 * Selectable weighting kernel families.
 */
public enum KernelType {
    BARTLETT_HANN(BartlettHannKernel::new),
    HANN(HannKernel::new),
    TRIANGULAR(TriangularKernel::new),
    BLACKMAN(BlackmanKernel::new);

    private final IntFunction<WeightKernel> factory;

    KernelType(IntFunction<WeightKernel> factory) {
        this.factory = factory;
    }

    public WeightKernel create(int size) {
        return factory.apply(size);
    }
}
