package com.project.raster.segmentation.tiling;

public class TriangularKernel extends WeightKernel {

    public TriangularKernel(int size) {
        super(size);
    }

    @Override
    protected double[] profile(int size) {
        double[] w = new double[size];
        for (int i = 0; i < size; i++) {
            w[i] = 1 - Math.abs(2.0 * i / size - 1);
        }
        return w;
    }
}
