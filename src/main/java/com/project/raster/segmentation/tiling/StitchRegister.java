package com.project.raster.segmentation.tiling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Streaming accumulator that stitches weighted tile scores with bounded memory.
 * <p>
 * The register holds a single tile-row-high strip, {@code depth x S x RW} with
 * {@code RW = ceil(imageWidth / S) * S + S/2}. Tiles must arrive in the row-major order
 * produced by {@link TileWindowPlanner} with a stride of {@code S/2}. Each tile is split into
 * four quadrants:
 * <pre>
 *   |a|b|
 *   |c|d|
 * </pre>
 * After a tile has been added, every quadrant that no later tile can contribute to is
 * information-complete and is returned by {@link #step}; the rest of the strip is rolled so
 * that the next tile row finds its partial sums at the top of the buffer.
 *
 * <h3>Eviction rules</h3>
 * <ul>
 *   <li>no bottom/right edge: {@code a} is complete; {@code c} moves up, {@code b|d} stay</li>
 *   <li>right edge: {@code a|b} are complete; {@code c|d} move up</li>
 *   <li>bottom edge: {@code a} over {@code c} is complete; {@code b|d} stay for the next column</li>
 *   <li>bottom and right edge: the whole tile is complete</li>
 * </ul>
 * Emitted regions are clipped to the window passed in, which callers clip to the true image,
 * so canvas padding is never emitted.
 * <p>
 * Not thread-safe; one register serves one run.
 */
public class StitchRegister {

    private static final Logger log = LoggerFactory.getLogger(StitchRegister.class);

    private final int depth;
    private final int windowSize;
    private final int halfWindow;
    private final int width;
    private final float[][][] buffer;

    /**
     * @param imageWidth width of the true image in pixels
     * @param depth      number of score channels, normally the class count
     * @param windowSize tile size {@code S}
     */
    public StitchRegister(int imageWidth, int depth, int windowSize) {
        if (imageWidth <= 0 || depth <= 0 || windowSize <= 0) {
            throw new IllegalArgumentException("Invalid register shape: imageWidth=" + imageWidth
                    + ", depth=" + depth + ", windowSize=" + windowSize);
        }
        this.depth = depth;
        this.windowSize = windowSize;
        this.halfWindow = windowSize / 2;
        this.width = ((imageWidth + windowSize - 1) / windowSize) * windowSize + halfWindow;
        this.buffer = new float[depth][windowSize][width];

        log.debug("Stitch register allocated: {} x {} x {} ({} MB)",
                depth, windowSize, width, (long) depth * windowSize * width * Float.BYTES / (1024 * 1024));
    }

    /**
     * Adds one weighted tile and evicts the region that became information-complete.
     *
     * @param weighted weighted scores shaped {@code [depth][S][S]}
     * @param window   the tile window clipped to the true image bounds
     * @param edges    image borders touched by {@code window}
     * @return the evicted scores and the image window they belong to
     */
    public EmittedRegion step(float[][][] weighted, Window window, EdgeFlags edges) {
        checkShape(weighted);
        int col = window.colOff();
        if (col < 0 || col + windowSize > width) {
            throw new IllegalArgumentException(window + " does not fit a register of width " + width);
        }

        accumulate(weighted, col);

        Window emitted;
        if (edges.bottom() && edges.right()) {
            emitted = new Window(window.rowOff(), col,
                    Math.min(windowSize, window.height()), Math.min(windowSize, window.width()));
            return new EmittedRegion(copy(col, emitted), emitted);
        }

        float[][][] scores;
        if (edges.right()) {
            emitted = new Window(window.rowOff(), col,
                    Math.min(halfWindow, window.height()), Math.min(windowSize, window.width()));
            scores = copy(col, emitted);
            shiftUp(col, windowSize);
        } else if (edges.bottom()) {
            emitted = new Window(window.rowOff(), col,
                    Math.min(windowSize, window.height()), Math.min(halfWindow, window.width()));
            scores = copy(col, emitted);
            clear(col, halfWindow);
        } else {
            emitted = new Window(window.rowOff(), col,
                    Math.min(halfWindow, window.height()), Math.min(halfWindow, window.width()));
            scores = copy(col, emitted);
            shiftUp(col, halfWindow);
        }
        return new EmittedRegion(scores, emitted);
    }

    public int depth() {
        return depth;
    }

    public int windowSize() {
        return windowSize;
    }

    public int halfWindow() {
        return halfWindow;
    }

    public int width() {
        return width;
    }

    private void checkShape(float[][][] weighted) {
        if (weighted.length != depth) {
            throw new IllegalArgumentException("Expected " + depth + " score channels, got " + weighted.length);
        }
        for (float[][] channel : weighted) {
            if (channel.length != windowSize || channel[0].length != windowSize) {
                throw new IllegalArgumentException("Expected " + windowSize + "x" + windowSize
                        + " scores, got " + channel.length + "x" + channel[0].length);
            }
        }
    }

    private void accumulate(float[][][] weighted, int col) {
        for (int k = 0; k < depth; k++) {
            for (int r = 0; r < windowSize; r++) {
                float[] dst = buffer[k][r];
                float[] src = weighted[k][r];
                for (int c = 0; c < windowSize; c++) {
                    dst[col + c] += src[c];
                }
            }
        }
    }

    private float[][][] copy(int col, Window emitted) {
        float[][][] out = new float[depth][emitted.height()][];
        for (int k = 0; k < depth; k++) {
            for (int r = 0; r < emitted.height(); r++) {
                out[k][r] = Arrays.copyOfRange(buffer[k][r], col, col + emitted.width());
            }
        }
        return out;
    }

    // Moves rows [half, S) of the given columns to the top and zero-fills the rows beneath.
    private void shiftUp(int col, int columns) {
        int kept = windowSize - halfWindow;
        for (int k = 0; k < depth; k++) {
            float[][] strip = buffer[k];
            for (int r = 0; r < kept; r++) {
                System.arraycopy(strip[r + halfWindow], col, strip[r], col, columns);
            }
            for (int r = kept; r < windowSize; r++) {
                Arrays.fill(strip[r], col, col + columns, 0f);
            }
        }
    }

    private void clear(int col, int columns) {
        for (int k = 0; k < depth; k++) {
            for (int r = 0; r < windowSize; r++) {
                Arrays.fill(buffer[k][r], col, col + columns, 0f);
            }
        }
    }

    /**
     * Information-complete scores evicted from the register.
     *
     * @param scores summed weighted scores shaped {@code [depth][window.height][window.width]}
     * @param window image window the scores belong to
     */
    public record EmittedRegion(float[][][] scores, Window window) {
    }
}
