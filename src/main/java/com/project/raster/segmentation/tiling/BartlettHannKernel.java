package com.project.raster.segmentation.tiling;

/**
 * Bartlett-Hann window (Ha and Pearce, 1989). Default kernel for stitching, since
 * {@code w(i) + w(i + size/2) == 1} holds exactly for even sizes.
 */
public class BartlettHannKernel extends WeightKernel {

    public BartlettHannKernel(int size) {
        super(size);
    }

    @Override
    protected double[] profile(int size) {
        double[] w = new double[size];
        for (int i = 0; i < size; i++) {
            double d = Math.abs((double) i / size - 0.5);
            w[i] = 0.62 - 0.48 * d + 0.38 * Math.cos(2 * Math.PI * d);
        }
        return w;
    }
}
