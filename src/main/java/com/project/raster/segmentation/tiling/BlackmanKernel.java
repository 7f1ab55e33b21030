package com.project.raster.segmentation.tiling;

public class BlackmanKernel extends WeightKernel {

    public BlackmanKernel(int size) {
        super(size);
    }

    @Override
    protected double[] profile(int size) {
        double[] w = new double[size];
        for (int i = 0; i < size; i++) {
            w[i] = 0.42 - 0.5 * Math.cos(2 * Math.PI * i / size) + 0.08 * Math.cos(4 * Math.PI * i / size);
        }
        return w;
    }
}
