package com.project.raster.segmentation.io;

import com.project.raster.segmentation.tiling.Window;

import java.util.Arrays;
import java.util.Optional;

/**
 * Array-backed {@link ImageReader} for tests. Counts window reads.
 */
public class InMemoryImageReader implements ImageReader {

    private final float[][][] bands;
    private final RasterDataType dataType;
    private int reads;

    public InMemoryImageReader(float[][][] bands, RasterDataType dataType) {
        this.bands = bands;
        this.dataType = dataType;
    }

    public static InMemoryImageReader constant(int bandCount, int height, int width, float value) {
        float[][][] bands = new float[bandCount][height][width];
        for (float[][] band : bands) {
            for (float[] row : band) {
                Arrays.fill(row, value);
            }
        }
        return new InMemoryImageReader(bands, RasterDataType.UINT8);
    }

    public int reads() {
        return reads;
    }

    @Override
    public int height() {
        return bands[0].length;
    }

    @Override
    public int width() {
        return bands[0][0].length;
    }

    @Override
    public int bandCount() {
        return bands.length;
    }

    @Override
    public RasterDataType dataType() {
        return dataType;
    }

    @Override
    public Optional<GeoReference> geoReference() {
        return Optional.empty();
    }

    @Override
    public float[][][] readWindow(Window window, int[] bandOrder, float fillValue) {
        reads++;
        int[] order = bandOrder;
        if (order == null) {
            order = new int[bands.length];
            for (int i = 0; i < order.length; i++) {
                order[i] = i + 1;
            }
        }
        float[][][] tile = new float[order.length][window.height()][window.width()];
        for (int b = 0; b < order.length; b++) {
            float[][] band = bands[order[b] - 1];
            for (int r = 0; r < window.height(); r++) {
                for (int c = 0; c < window.width(); c++) {
                    int row = window.rowOff() + r;
                    int col = window.colOff() + c;
                    tile[b][r][c] = row < height() && col < width() ? band[row][col] : fillValue;
                }
            }
        }
        return tile;
    }

    @Override
    public void close() {
    }
}
