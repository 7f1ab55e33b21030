package com.project.raster.segmentation.tiling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class StitchRegisterTest {

    private static final Random RANDOM = new Random(0);

    @Test
    void initialization_sizesBufferFromImageWidth() {
        StitchRegister register = new StitchRegister(1000, 2, 256);
        assertThat(register.depth()).isEqualTo(2);
        assertThat(register.windowSize()).isEqualTo(256);
        assertThat(register.halfWindow()).isEqualTo(128);
        assertThat(register.width()).isEqualTo(4 * 256 + 128);
    }

    @Test
    void step_interiorTiles_emitTopLeftQuadrant() {
        StitchRegister register = new StitchRegister(1000, 2, 256);

        assertEmitted(register.step(random(2, 256), new Window(0, 0, 256, 256), EdgeFlags.NONE),
                new Window(0, 0, 128, 128));
        assertEmitted(register.step(random(2, 256), new Window(0, 768, 256, 232), EdgeFlags.NONE),
                new Window(0, 768, 128, 128));
    }

    @Test
    void step_rightEdge_isClippedToImageWidth() {
        StitchRegister register = new StitchRegister(1000, 2, 256);
        EdgeFlags right = new EdgeFlags(true, false, false, true);

        assertEmitted(register.step(random(2, 256), new Window(0, 896, 256, 104), right),
                new Window(0, 896, 128, 104));
    }

    @Test
    void step_smallImage_emitsClippedQuadrants() {
        StitchRegister register = new StitchRegister(200, 2, 256);

        assertEmitted(register.step(random(2, 256), new Window(0, 0, 200, 200), EdgeFlags.NONE),
                new Window(0, 0, 128, 128));
        assertEmitted(register.step(random(2, 256), new Window(0, 128, 200, 72), EdgeFlags.NONE),
                new Window(0, 128, 128, 72));
        assertEmitted(register.step(random(2, 256), new Window(128, 0, 72, 128), EdgeFlags.NONE),
                new Window(128, 0, 72, 128));
        assertEmitted(register.step(random(2, 256), new Window(128, 128, 72, 72), EdgeFlags.NONE),
                new Window(128, 128, 72, 72));
    }

    @Test
    void step_windowEqualToImage() {
        StitchRegister register = new StitchRegister(200, 2, 200);

        assertEmitted(register.step(random(2, 200), new Window(0, 0, 200, 200), EdgeFlags.NONE),
                new Window(0, 0, 100, 100));
        assertEmitted(register.step(random(2, 200), new Window(0, 100, 200, 100), EdgeFlags.NONE),
                new Window(0, 100, 100, 100));
    }

    @Test
    void step_oddWindowSize_usesFloorOfHalf() {
        StitchRegister register = new StitchRegister(200, 2, 125);
        assertThat(register.halfWindow()).isEqualTo(62);

        assertEmitted(register.step(random(2, 125), new Window(0, 0, 125, 125), EdgeFlags.NONE),
                new Window(0, 0, 62, 62));
        assertEmitted(register.step(random(2, 125), new Window(0, 62, 125, 63), EdgeFlags.NONE),
                new Window(0, 62, 62, 62));
        assertEmitted(register.step(random(2, 125), new Window(0, 124, 125, 1), EdgeFlags.NONE),
                new Window(0, 124, 62, 1));
        assertEmitted(register.step(random(2, 125), new Window(62, 0, 63, 125), EdgeFlags.NONE),
                new Window(62, 0, 62, 62));
        assertEmitted(register.step(random(2, 125), new Window(124, 0, 1, 125), EdgeFlags.NONE),
                new Window(124, 0, 1, 62));
    }

    @Test
    void step_singleTileLargerThanImage_emitsWholeImage() {
        StitchRegister register = new StitchRegister(50, 3, 512);
        EdgeFlags all = new EdgeFlags(true, true, true, true);

        StitchRegister.EmittedRegion region = register.step(random(3, 512), new Window(0, 0, 50, 50), all);

        assertEmitted(region, new Window(0, 0, 50, 50));
    }

    @Test
    void step_copiesScoresOutOfBuffer() {
        StitchRegister register = new StitchRegister(4, 1, 4);
        float[][][] first = ones(1, 4);
        StitchRegister.EmittedRegion region = register.step(first, new Window(0, 0, 4, 4),
                new EdgeFlags(true, false, true, true));
        float before = region.scores()[0][0][0];

        register.step(ones(1, 4), new Window(2, 0, 2, 4), new EdgeFlags(false, true, true, true));

        assertThat(region.scores()[0][0][0]).isEqualTo(before);
    }

    @Test
    void step_rejectsWindowBeyondRegister() {
        StitchRegister register = new StitchRegister(100, 1, 64);
        assertThatThrownBy(() -> register.step(ones(1, 64), new Window(0, 128, 64, 64), EdgeFlags.NONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> register.step(ones(2, 64), new Window(0, 0, 64, 64), EdgeFlags.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void movingWindow_countsOverlaps() {
        int h = 4, w = 4, s = 2;
        float[][] output = stitch(h, w, s, null);

        // Corners once, edges twice, interior four times.
        assertThat(output[0][0]).isEqualTo(1f);
        assertThat(output[0][w - 1]).isEqualTo(1f);
        assertThat(output[h - 1][0]).isEqualTo(1f);
        assertThat(output[h - 1][w - 1]).isEqualTo(1f);
        for (int i = 1; i < w - 1; i++) {
            assertThat(output[0][i]).isEqualTo(2f);
            assertThat(output[h - 1][i]).isEqualTo(2f);
            assertThat(output[i][0]).isEqualTo(2f);
            assertThat(output[i][w - 1]).isEqualTo(2f);
        }
        for (int r = 1; r < h - 1; r++) {
            for (int c = 1; c < w - 1; c++) {
                assertThat(output[r][c]).isEqualTo(4f);
            }
        }
    }

    @Test
    void bartlettHannWeights_sumToOneEverywhere() {
        float[][] output = stitch(600, 600, 20, new BartlettHannKernel(20));
        for (float[] row : output) {
            for (float v : row) {
                assertThat(v).isCloseTo(1f, within(1e-5f));
            }
        }
    }

    @ParameterizedTest(name = "{0}x{1}, tile {2}")
    @CsvSource({
            "300, 300, 256",
            "1000, 800, 256",
            "50, 50, 512",
            "333, 777, 224",
            "17, 101, 8",
            "64, 64, 64"
    })
    void plannedGrid_emitsEveryPixelOnceWithUnitWeight(int height, int width, int tileSize) {
        int stride = tileSize / 2;
        WeightKernel kernel = new BartlettHannKernel(tileSize);
        StitchRegister register = new StitchRegister(width, 1, tileSize);
        int[][] emitted = new int[height][width];
        float[][] sum = new float[height][width];

        TileWindowPlanner.CanvasSize canvas = TileWindowPlanner.extendedDimensions(height, width, tileSize, stride);
        for (Window window : TileWindowPlanner.generateWindows(canvas.height(), canvas.width(), tileSize, stride)) {
            Window clipped = window.clipTo(height, width).orElseThrow();
            EdgeFlags edges = EdgeFlags.of(clipped, height, width);
            StitchRegister.EmittedRegion region = register.step(kernel.apply(ones(1, tileSize), edges), clipped, edges);
            Window out = region.window();
            for (int r = 0; r < out.height(); r++) {
                for (int c = 0; c < out.width(); c++) {
                    emitted[out.rowOff() + r][out.colOff() + c]++;
                    sum[out.rowOff() + r][out.colOff() + c] += region.scores()[0][r][c];
                }
            }
        }

        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                assertThat(emitted[r][c]).as("emissions at (%d, %d)", r, c).isEqualTo(1);
                assertThat(sum[r][c]).as("weight at (%d, %d)", r, c).isCloseTo(1f, within(1e-5f));
            }
        }
    }

    // Sliding window over the image with stride s/2, accumulating every emitted region.
    private static float[][] stitch(int h, int w, int s, WeightKernel kernel) {
        StitchRegister register = new StitchRegister(w, 1, s);
        float[][] output = new float[h][w];
        int hs = s / 2;
        for (int rowOff = 0; rowOff < h - hs; rowOff += hs) {
            for (int colOff = 0; colOff < w - hs; colOff += hs) {
                Window window = new Window(rowOff, colOff, Math.min(s, h - rowOff), Math.min(s, w - colOff));
                boolean top = rowOff == 0;
                boolean left = colOff == 0;
                boolean bottom = rowOff == h - s;
                boolean right = colOff == w - s;
                EdgeFlags edges = new EdgeFlags(top, bottom, left, right);
                float[][][] scores = kernel == null ? ones(1, s) : kernel.apply(ones(1, s), edges);

                StitchRegister.EmittedRegion region = register.step(scores, window, edges);
                Window win = region.window();
                if (top) {
                    assertThat(win.rowOff()).isZero();
                    assertThat(win.height()).isEqualTo(hs);
                }
                if (left) {
                    assertThat(win.colOff()).isZero();
                    assertThat(win.width()).isEqualTo(hs);
                }
                if (bottom) {
                    assertThat(win.rowOff()).isEqualTo(h - s);
                    assertThat(win.height()).isEqualTo(s);
                }
                if (right) {
                    assertThat(win.colOff()).isEqualTo(w - s);
                    assertThat(win.width()).isEqualTo(s);
                }
                for (int r = 0; r < win.height(); r++) {
                    for (int c = 0; c < win.width(); c++) {
                        output[win.rowOff() + r][win.colOff() + c] += region.scores()[0][r][c];
                    }
                }
            }
        }
        return output;
    }

    private static void assertEmitted(StitchRegister.EmittedRegion region, Window expected) {
        assertThat(region.window()).isEqualTo(expected);
        for (float[][] channel : region.scores()) {
            assertThat(channel).hasNumberOfRows(expected.height());
            assertThat(channel[0]).hasSize(expected.width());
        }
    }

    private static float[][][] random(int depth, int size) {
        float[][][] scores = new float[depth][size][size];
        for (float[][] channel : scores) {
            for (float[] row : channel) {
                for (int i = 0; i < size; i++) {
                    row[i] = RANDOM.nextFloat();
                }
            }
        }
        return scores;
    }

    private static float[][][] ones(int depth, int size) {
        float[][][] scores = new float[depth][size][size];
        for (float[][] channel : scores) {
            for (float[] row : channel) {
                java.util.Arrays.fill(row, 1f);
            }
        }
        return scores;
    }
}
