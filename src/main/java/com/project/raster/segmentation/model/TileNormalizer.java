package com.project.raster.segmentation.model;

import java.util.List;

/**
 * Scales raw pixel values by the max pixel value and applies the configured normalization.
 * Input arrays are left untouched.
 */
public class TileNormalizer {

    static final double EPSILON = 1e-8;

    private final Normalization normalization;
    private final float[] mean;
    private final float[] std;
    private final double maxPixelValue;

    public TileNormalizer(Normalization normalization, List<Double> mean, List<Double> std, double maxPixelValue) {
        if (maxPixelValue <= 0) {
            throw new IllegalArgumentException("Max pixel value must be positive: " + maxPixelValue);
        }
        this.normalization = normalization;
        this.mean = toFloats(mean);
        this.std = toFloats(std);
        this.maxPixelValue = maxPixelValue;
    }

    public float[][][][] apply(float[][][][] batch) {
        float[][][][] out = new float[batch.length][][][];
        for (int b = 0; b < batch.length; b++) {
            out[b] = apply(batch[b]);
        }
        return out;
    }

    public float[][][] apply(float[][][] tile) {
        int channels = tile.length;
        float[][][] out = new float[channels][][];
        float scale = (float) (1.0 / maxPixelValue);
        for (int c = 0; c < channels; c++) {
            out[c] = new float[tile[c].length][];
            for (int r = 0; r < tile[c].length; r++) {
                float[] src = tile[c][r];
                float[] dst = new float[src.length];
                for (int x = 0; x < src.length; x++) {
                    dst[x] = src[x] * scale;
                }
                out[c][r] = dst;
            }
        }

        switch (normalization) {
            case STANDARD -> standardize(out);
            case MIN_MAX -> {
                float[] range = range(out, 0, channels);
                rescale(out, 0, channels, range[0], range[1]);
            }
            case MIN_MAX_PER_CHANNEL -> {
                for (int c = 0; c < channels; c++) {
                    float[] range = range(out, c, c + 1);
                    rescale(out, c, c + 1, range[0], range[1]);
                }
            }
            case NONE -> {
            }
        }
        return out;
    }

    private void standardize(float[][][] tile) {
        if (tile.length != mean.length || tile.length != std.length) {
            throw new IllegalArgumentException("Standard normalization is configured for " + mean.length
                    + " channels, tile has " + tile.length);
        }
        for (int c = 0; c < tile.length; c++) {
            for (float[] row : tile[c]) {
                for (int x = 0; x < row.length; x++) {
                    row[x] = (row[x] - mean[c]) / std[c];
                }
            }
        }
    }

    private static float[] range(float[][][] tile, int from, int to) {
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (int c = from; c < to; c++) {
            for (float[] row : tile[c]) {
                for (float v : row) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }
        return new float[]{min, max};
    }

    private static void rescale(float[][][] tile, int from, int to, float min, float max) {
        double denominator = max - min + EPSILON;
        for (int c = from; c < to; c++) {
            for (float[] row : tile[c]) {
                for (int x = 0; x < row.length; x++) {
                    row[x] = (float) ((row[x] - min) / denominator);
                }
            }
        }
    }

    private static float[] toFloats(List<Double> values) {
        float[] out = new float[values == null ? 0 : values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i).floatValue();
        }
        return out;
    }
}
