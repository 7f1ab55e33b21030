package com.project.raster.segmentation.tiling;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans the tile grid used for tiled inference and post-processing.
 * <p>
 * Windows are emitted strictly row-major (every column of grid row 0, then row 1, ...).
 * {@link StitchRegister} relies on that order and never expects a revisit.
 */
public final class TileWindowPlanner {

    private TileWindowPlanner() {
    }

    /**
     * Number of tiles needed along one axis so that the last tile reaches the end of the axis.
     */
    public static int tileCount(int axisLength, int tileSize, int stride) {
        checkGrid(tileSize, stride);
        if (axisLength <= tileSize) {
            return 1;
        }
        return ceilDiv(axisLength - tileSize, stride) + 1;
    }

    /**
     * Smallest canvas, at least as large as the image, that is covered exactly by an integer
     * number of strided tiles.
     */
    public static CanvasSize extendedDimensions(int height, int width, int tileSize, int stride) {
        checkImage(height, width);
        int tilesY = tileCount(height, tileSize, stride);
        int tilesX = tileCount(width, tileSize, stride);
        int extendedHeight = (tilesY - 1) * stride + tileSize;
        int extendedWidth = (tilesX - 1) * stride + tileSize;
        return new CanvasSize(Math.max(extendedHeight, height), Math.max(extendedWidth, width));
    }

    /**
     * Generates full-size {@code tileSize x tileSize} windows at multiples of {@code stride},
     * starting at (0, 0), covering every pixel of {@code [0, height) x [0, width)}.
     * Windows may extend past the image; they are meant for boundless reads.
     */
    public static List<Window> generateWindows(int height, int width, int tileSize, int stride) {
        checkImage(height, width);
        int tilesY = tileCount(height, tileSize, stride);
        int tilesX = tileCount(width, tileSize, stride);

        List<Window> windows = new ArrayList<>(tilesY * tilesX);
        for (int y = 0; y < tilesY; y++) {
            for (int x = 0; x < tilesX; x++) {
                int rowStart = y * stride;
                int colStart = x * stride;
                if (rowStart >= height || colStart >= width) {
                    continue;
                }
                windows.add(new Window(rowStart, colStart, tileSize, tileSize));
            }
        }
        return windows;
    }

    /**
     * Same grid as {@link #generateWindows}, with every window clipped to the image bounds.
     */
    public static List<Window> generateClippedWindows(int height, int width, int tileSize, int stride) {
        List<Window> clipped = new ArrayList<>();
        for (Window window : generateWindows(height, width, tileSize, stride)) {
            window.clipTo(height, width).ifPresent(clipped::add);
        }
        return clipped;
    }

    /**
     * Checks that the union of {@code windows} covers every pixel of the image.
     * Builds a full coverage map, so use it for tests and one-off sanity checks only.
     */
    public static boolean validateFullCoverage(int height, int width, List<Window> windows) {
        boolean[][] coverage = new boolean[height][width];
        for (Window window : windows) {
            int rowStart = Math.max(0, window.rowOff());
            int rowEnd = Math.min(height, window.rowEnd());
            int colStart = Math.max(0, window.colOff());
            int colEnd = Math.min(width, window.colEnd());
            for (int r = rowStart; r < rowEnd; r++) {
                for (int c = colStart; c < colEnd; c++) {
                    coverage[r][c] = true;
                }
            }
        }
        for (boolean[] row : coverage) {
            for (boolean covered : row) {
                if (!covered) {
                    return false;
                }
            }
        }
        return true;
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }

    private static void checkGrid(int tileSize, int stride) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }
        if (stride <= 0 || stride > tileSize) {
            throw new IllegalArgumentException("Stride must be in (0, " + tileSize + "]: " + stride);
        }
    }

    private static void checkImage(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + height + "x" + width);
        }
    }

    /** Height and width of a (possibly extended) canvas. */
    public record CanvasSize(int height, int width) {
    }
}
