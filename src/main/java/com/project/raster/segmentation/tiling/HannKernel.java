package com.project.raster.segmentation.tiling;

public class HannKernel extends WeightKernel {

    public HannKernel(int size) {
        super(size);
    }

    @Override
    protected double[] profile(int size) {
        double[] w = new double[size];
        if (size == 1) {
            w[0] = 1.0;
            return w;
        }
        for (int i = 0; i < size; i++) {
            w[i] = (1 - Math.cos(2 * Math.PI * i / (size - 1))) / 2;
        }
        return w;
    }
}
