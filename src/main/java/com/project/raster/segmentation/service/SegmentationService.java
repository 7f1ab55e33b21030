package com.project.raster.segmentation.service;

import com.project.raster.segmentation.DTOs.ModelSummary;
import com.project.raster.segmentation.DTOs.SegmentationRequest;
import com.project.raster.segmentation.DTOs.SegmentationResult;
import com.project.raster.segmentation.exceptions.SegmentationException;
import com.project.raster.segmentation.io.GeoTiffLabelWriter;
import com.project.raster.segmentation.io.ImageIoRasterReader;
import com.project.raster.segmentation.io.ImageWriter;
import com.project.raster.segmentation.model.InferenceModel;
import com.project.raster.segmentation.model.ModelConfig;
import com.project.raster.segmentation.model.ModelLoader;
import com.project.raster.segmentation.model.ModelRegistry;
import com.project.raster.segmentation.tiling.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.IntStream;
import javax.imageio.ImageIO;

/**
 * Entry point for a segmentation run: resolves the model and processing parameters, opens the
 * rasters, runs {@link TiledSegmentationPipeline} and summarizes the written labels.
 */
@Service
public class SegmentationService {
    private static final Logger log = LoggerFactory.getLogger(SegmentationService.class);

    private static final Color[] PALETTE = {
            new Color(0, 0, 0),
            new Color(0, 180, 255),
            new Color(255, 0, 0),
            new Color(60, 200, 60),
            new Color(255, 200, 0),
            new Color(180, 0, 255),
            new Color(255, 120, 180),
            new Color(0, 120, 120)
    };
    static final int PREVIEW_MAX_SIZE = 1024;
    static final int STATISTICS_STRIP_ROWS = 256;

    private final ModelRegistry registry;
    private final ModelLoader modelLoader;
    private final TiledSegmentationPipeline pipeline;
    private final int defaultTileSize;

    public SegmentationService(ModelRegistry registry, ModelLoader modelLoader, TiledSegmentationPipeline pipeline,
                               @Value("${app.segmentation.default-tile-size:1024}") int defaultTileSize) {
        this.registry = registry;
        this.modelLoader = modelLoader;
        this.pipeline = pipeline;
        this.defaultTileSize = defaultTileSize;
    }

    public List<ModelSummary> models() {
        return registry.all().stream().map(ModelSummary::of).toList();
    }

    public SegmentationResult segment(Path input, Path output, SegmentationRequest request) {
        long started = System.nanoTime();
        ModelConfig modelConfig = registry.resolve(request.model(), request.revision());
        InferenceModel model = modelLoader.load(modelConfig);

        ProcessingConfig config = new ProcessingConfig(
                resolveTileSize(model, request.tileSize()),
                valueOr(request.batchSize(), ProcessingConfig.DEFAULT_BATCH_SIZE),
                valueOr(request.blurKernelSize(), ProcessingConfig.DEFAULT_BLUR_KERNEL_SIZE),
                valueOr(request.morphKernelSize(), ProcessingConfig.DEFAULT_MORPH_KERNEL_SIZE),
                request.bandOrder() == null || request.bandOrder().isEmpty()
                        ? defaultBandOrder(model.inputChannels())
                        : request.bandOrder());

        log.info("Starting segmentation of {} with {} -> {}", input.getFileName(), modelConfig.id(), output);

        try (ImageIoRasterReader reader = ImageIoRasterReader.open(input)) {
            GeoTiffLabelWriter writer = new GeoTiffLabelWriter(output, reader.height(), reader.width(),
                    modelConfig.nodataValue(), reader.geoReference().orElse(null));
            try (writer) {
                TiledSegmentationPipeline.RunSummary summary = pipeline.run(reader, writer, model, config);
                LabelStatistics statistics = summarize(writer);
                long elapsed = (System.nanoTime() - started) / 1_000_000;
                log.info("Segmented {} in {} ms: {}", input.getFileName(), elapsed, statistics.classCounts());
                return new SegmentationResult(
                        modelConfig.id(),
                        reader.width(),
                        reader.height(),
                        summary.tileSize(),
                        summary.stride(),
                        summary.tileCount(),
                        summary.shortcutTileCount(),
                        statistics.classCounts(),
                        elapsed,
                        output,
                        statistics.previewPng()
                );
            }
        }
    }

    int resolveTileSize(InferenceModel model, Integer requested) {
        OptionalInt preferred = model.preferredTileSize();
        if (preferred.isPresent()) {
            if (requested != null && requested != preferred.getAsInt()) {
                log.warn("Model {} requires a tile size of {}; ignoring requested tile size {}",
                        model.name(), preferred.getAsInt(), requested);
            }
            return preferred.getAsInt();
        }
        return requested != null ? requested : defaultTileSize;
    }

    static List<Integer> defaultBandOrder(int channels) {
        return IntStream.rangeClosed(1, channels).boxed().toList();
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    // Single pass over the labels in strips: class histogram plus a nearest-neighbour preview.
    private LabelStatistics summarize(ImageWriter writer) {
        int height = writer.height();
        int width = writer.width();
        double scale = Math.min(1.0, (double) PREVIEW_MAX_SIZE / Math.max(height, width));
        int previewHeight = Math.max(1, (int) Math.round(height * scale));
        int previewWidth = Math.max(1, (int) Math.round(width * scale));
        BufferedImage preview = new BufferedImage(previewWidth, previewHeight, BufferedImage.TYPE_INT_RGB);

        long[] counts = new long[256];
        int py = 0;
        for (int rowStart = 0; rowStart < height; rowStart += STATISTICS_STRIP_ROWS) {
            int rows = Math.min(STATISTICS_STRIP_ROWS, height - rowStart);
            byte[][] strip = writer.read(new Window(rowStart, 0, rows, width));
            for (byte[] row : strip) {
                for (byte label : row) {
                    counts[label & 0xFF]++;
                }
            }
            for (; py < previewHeight; py++) {
                int sourceRow = (int) ((long) py * height / previewHeight);
                if (sourceRow >= rowStart + rows) {
                    break;
                }
                byte[] row = strip[sourceRow - rowStart];
                for (int px = 0; px < previewWidth; px++) {
                    int label = row[(int) ((long) px * width / previewWidth)] & 0xFF;
                    preview.setRGB(px, py, PALETTE[label % PALETTE.length].getRGB());
                }
            }
        }

        double total = (double) height * width;
        List<SegmentationResult.ClassCount> classCounts = new ArrayList<>();
        for (int label = 0; label < counts.length; label++) {
            if (counts[label] > 0) {
                classCounts.add(new SegmentationResult.ClassCount(label, counts[label], 100.0 * counts[label] / total));
            }
        }
        return new LabelStatistics(classCounts, toPng(preview));
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new SegmentationException("Failed to encode label preview", e);
        }
    }

    private record LabelStatistics(List<SegmentationResult.ClassCount> classCounts, byte[] previewPng) {
    }
}
