package com.project.raster.segmentation.service;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.exceptions.ModelException;
import com.project.raster.segmentation.exceptions.SegmentationException;
import com.project.raster.segmentation.io.ImageReader;
import com.project.raster.segmentation.io.ImageWriter;
import com.project.raster.segmentation.model.InferenceModel;
import com.project.raster.segmentation.tiling.EdgeFlags;
import com.project.raster.segmentation.tiling.StitchRegister;
import com.project.raster.segmentation.tiling.TileWindowPlanner;
import com.project.raster.segmentation.tiling.WeightKernel;
import com.project.raster.segmentation.tiling.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs a model over a raster that is too large for one inference call.
 * <p>
 * Windows of {@code S x S} pixels with a stride of {@code S/2} are read in row-major order and
 * classified in batches. Each score map is weighted with the kernel for its border contacts and
 * fed to a {@link StitchRegister}; whatever the register evicts is decoded and written right
 * away. Tiles whose pixels are all identical skip inference and use the model's shortcut scores.
 * A tiled median/morphology pass over the written labels finishes the run.
 * <p>
 * Single-threaded. If the run fails, labels written so far stay written.
 */
@Service
public class TiledSegmentationPipeline {
    private static final Logger log = LoggerFactory.getLogger(TiledSegmentationPipeline.class);

    private final LabelPostProcessor postProcessor;

    public TiledSegmentationPipeline(LabelPostProcessor postProcessor) {
        this.postProcessor = postProcessor;
    }

    public RunSummary run(ImageReader reader, ImageWriter writer, InferenceModel model, ProcessingConfig config) {
        int height = reader.height();
        int width = reader.width();
        int tileSize = config.tileSize();
        int stride = config.stride();
        int[] bands = config.bandOrderArray();

        checkBands(reader, model, bands);
        if (writer.height() != height || writer.width() != width) {
            throw new InvalidConfigurationException("Output raster is " + writer.height() + "x" + writer.width()
                    + " but the input is " + height + "x" + width);
        }
        InferenceModel bound = model.forDataType(reader.dataType());

        TileWindowPlanner.CanvasSize canvas = TileWindowPlanner.extendedDimensions(height, width, tileSize, stride);
        List<Window> windows = TileWindowPlanner.generateWindows(canvas.height(), canvas.width(), tileSize, stride);

        log.info("Segmenting {}x{} image with {}: {} tiles of {} px (stride {}), batch size {}",
                height, width, bound.name(), windows.size(), tileSize, stride, config.batchSize());

        WeightKernel kernel = config.kernelType().create(tileSize);
        StitchRegister register = new StitchRegister(width, bound.numClasses(), tileSize);
        float[][][] shortcut = null;
        int shortcutTiles = 0;
        int done = 0;
        int nextReport = 10;

        for (int start = 0; start < windows.size(); start += config.batchSize()) {
            List<Window> batch = windows.subList(start, Math.min(start + config.batchSize(), windows.size()));

            float[][][][] tiles = new float[batch.size()][][][];
            boolean[] constant = new boolean[batch.size()];
            List<float[][][]> toPredict = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                tiles[i] = reader.readWindow(batch.get(i), bands, 0f);
                constant[i] = isConstant(tiles[i]);
                if (constant[i]) {
                    log.debug("Shortcut tile at {}", batch.get(i));
                } else {
                    toPredict.add(tiles[i]);
                }
            }

            float[][][][] predicted = new float[0][][][];
            if (!toPredict.isEmpty()) {
                predicted = bound.predict(toPredict.toArray(new float[0][][][]));
                checkScores(predicted, toPredict.size(), bound.numClasses(), tileSize);
            }
            log.debug("Batch of {} tiles at {}: {} inferred", batch.size(), batch.get(0), toPredict.size());

            int p = 0;
            for (int i = 0; i < batch.size(); i++) {
                float[][][] scores;
                if (constant[i]) {
                    if (shortcut == null) {
                        shortcut = bound.shortcut(tileSize);
                        checkScores(new float[][][][]{shortcut}, 1, bound.numClasses(), tileSize);
                    }
                    scores = shortcut;
                    shortcutTiles++;
                } else {
                    scores = predicted[p++];
                }
                stitch(batch.get(i), scores, height, width, kernel, register, bound, writer);
            }

            done += batch.size();
            int percent = (int) (100L * done / windows.size());
            if (percent >= nextReport) {
                log.info("Progress: {}% ({}/{} tiles)", percent, done, windows.size());
                nextReport = (percent / 10 + 1) * 10;
            }
        }

        postProcessor.process(writer, config);

        log.info("Segmentation finished: {} tiles, {} shortcut", windows.size(), shortcutTiles);
        return new RunSummary(windows.size(), shortcutTiles, tileSize, stride, canvas.height(), canvas.width());
    }

    private static void stitch(Window window, float[][][] scores, int height, int width, WeightKernel kernel,
                               StitchRegister register, InferenceModel model, ImageWriter writer) {
        Window clipped = window.clipTo(height, width)
                .orElseThrow(() -> new SegmentationException(window + " lies outside the " + height + "x" + width + " image"));
        EdgeFlags edges = EdgeFlags.of(clipped, height, width);

        StitchRegister.EmittedRegion region = register.step(kernel.apply(scores, edges), clipped, edges);
        Window target = region.window();
        byte[][] labels = model.postprocess(region.scores());
        if (labels.length != target.height() || (target.height() > 0 && labels[0].length != target.width())) {
            throw new ModelException("Model " + model.name() + " decoded " + labels.length + " label rows for "
                    + target + "; shapes must match");
        }
        writer.write(labels, target);
    }

    private static void checkBands(ImageReader reader, InferenceModel model, int[] bands) {
        if (bands.length != model.inputChannels()) {
            throw new InvalidConfigurationException("Band order " + Arrays.toString(bands) + " selects " + bands.length
                    + " band(s) but model " + model.name() + " expects " + model.inputChannels());
        }
        for (int band : bands) {
            if (band < 1 || band > reader.bandCount()) {
                throw new InvalidConfigurationException("Band order " + Arrays.toString(bands)
                        + " is invalid for an image with " + reader.bandCount() + " band(s)");
            }
        }
    }

    private static void checkScores(float[][][][] scores, int batch, int classes, int tileSize) {
        if (scores == null || scores.length != batch) {
            throw new ModelException("Model returned " + (scores == null ? 0 : scores.length)
                    + " score maps for " + batch + " tiles");
        }
        for (float[][][] map : scores) {
            if (map.length != classes || map[0].length != tileSize || map[0][0].length != tileSize) {
                throw new ModelException("Model returned scores shaped [" + map.length + ", " + map[0].length + ", "
                        + map[0][0].length + "], expected [" + classes + ", " + tileSize + ", " + tileSize + "]");
            }
        }
    }

    static boolean isConstant(float[][][] tile) {
        float first = tile[0][0][0];
        for (float[][] band : tile) {
            for (float[] row : band) {
                for (float v : row) {
                    if (Float.compare(v, first) != 0) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /**
     * Outcome of one run.
     *
     * @param tileCount         windows processed
     * @param shortcutTileCount windows that skipped inference
     * @param tileSize          tile size {@code S}
     * @param stride            tile stride
     * @param canvasHeight      extended canvas height
     * @param canvasWidth       extended canvas width
     */
    public record RunSummary(int tileCount, int shortcutTileCount, int tileSize, int stride,
                             int canvasHeight, int canvasWidth) {
    }
}
