package com.project.raster.segmentation.tiling;

import java.util.Arrays;

/**
 * Separable 2-D weighting kernel applied to per-tile class scores before stitching.
 * <p>
 * The kernel is the outer product of a 1-D profile with itself. When a tile touches an
 * image border, the half of the profile facing that border is forced to 1.0, because no
 * neighbouring tile exists there to share the weight.
 * <p>
 * With a stride of half the tile size, the weights of all tiles covering a pixel sum to 1,
 * which is what lets {@link StitchRegister} evict finished regions without normalising.
 *
 * @see BartlettHannKernel
 */
public abstract class WeightKernel {

    private final int size;
    private final double[] profile;
    private final float[][][] cache = new float[16][][];

    protected WeightKernel(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Kernel size must be positive: " + size);
        }
        this.size = size;
        this.profile = profile(size);
        if (profile.length != size) {
            throw new IllegalStateException("Profile length " + profile.length + " does not match kernel size " + size);
        }
    }

    /**
     * Computes the 1-D weighting profile for indices {@code 0..size-1}.
     */
    protected abstract double[] profile(int size);

    public int size() {
        return size;
    }

    /**
     * Returns the {@code size x size} weight matrix for a tile with the given border contacts.
     * The returned array is shared; callers must not modify it.
     */
    public float[][] kernel(EdgeFlags edges) {
        int mask = edges.mask();
        float[][] k = cache[mask];
        if (k == null) {
            k = build(edges);
            cache[mask] = k;
        }
        return k;
    }

    /**
     * Multiplies every channel of {@code scores} element-wise with the kernel.
     *
     * @param scores class scores shaped {@code [K][size][size]}
     * @return a new weighted array of the same shape
     */
    public float[][][] apply(float[][][] scores, EdgeFlags edges) {
        float[][] k = kernel(edges);
        float[][][] weighted = new float[scores.length][size][size];
        for (int c = 0; c < scores.length; c++) {
            float[][] channel = scores[c];
            if (channel.length != size || channel[0].length != size) {
                throw new IllegalArgumentException("Score map is " + channel.length + "x" + channel[0].length
                        + ", expected " + size + "x" + size);
            }
            for (int r = 0; r < size; r++) {
                float[] src = channel[r];
                float[] dst = weighted[c][r];
                float[] w = k[r];
                for (int x = 0; x < size; x++) {
                    dst[x] = src[x] * w[x];
                }
            }
        }
        return weighted;
    }

    private float[][] build(EdgeFlags edges) {
        int half = size / 2;
        double[] wi = Arrays.copyOf(profile, size);
        double[] wj = Arrays.copyOf(profile, size);

        if (edges.top()) {
            Arrays.fill(wi, 0, half, 1.0);
        }
        if (edges.bottom()) {
            Arrays.fill(wi, half, size, 1.0);
        }
        if (edges.left()) {
            Arrays.fill(wj, 0, half, 1.0);
        }
        if (edges.right()) {
            Arrays.fill(wj, half, size, 1.0);
        }

        float[][] k = new float[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                k[r][c] = (float) (wi[r] * wj[c]);
            }
        }
        return k;
    }
}
