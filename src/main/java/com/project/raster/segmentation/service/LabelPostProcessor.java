package com.project.raster.segmentation.service;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.io.ImageWriter;
import com.project.raster.segmentation.tiling.EdgeFlags;
import com.project.raster.segmentation.tiling.TileWindowPlanner;
import com.project.raster.segmentation.tiling.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Filters a written label raster in place, tile by tile.
 * <p>
 * Tiles overlap by the filter's reach and only their interior is written back, except on sides
 * touching the image border. A result is held back until no later tile reads its rows, so every
 * filter input is an unfiltered label and the outcome equals filtering the whole raster at once.
 */
@Component
public class LabelPostProcessor {
    private static final Logger log = LoggerFactory.getLogger(LabelPostProcessor.class);

    static final int MAX_TILE_SIZE = 512;

    public void process(ImageWriter writer, ProcessingConfig config) {
        process(writer, config.tileSize(), OpenCvLabelFilter.of(config));
    }

    public void process(ImageWriter writer, int tileSize, LabelFilter filter) {
        int overlap = filter.reach();
        if (overlap == 0) {
            log.debug("Post-processing disabled");
            return;
        }
        int tile = Math.min(MAX_TILE_SIZE, tileSize);
        int stride = tile - 2 * overlap;
        if (stride <= 0) {
            throw new InvalidConfigurationException("Post-processing filters reach " + overlap
                    + " px, too far for " + tile + " px tiles; use smaller kernels or a larger tile size");
        }

        int height = writer.height();
        int width = writer.width();
        List<Window> windows = TileWindowPlanner.generateClippedWindows(height, width, tile, stride);
        log.info("Post-processing {}x{} labels: {} tiles of {} px, overlap {} px", height, width, windows.size(), tile, overlap);

        Deque<Pending> pending = new ArrayDeque<>();
        int currentRow = -1;
        for (Window window : windows) {
            if (window.rowOff() != currentRow) {
                // No tile from this row on reads above its first row.
                flush(writer, pending, window.rowOff());
                currentRow = window.rowOff();
            }
            byte[][] filtered = filter.apply(writer.read(window));
            Window interior = interior(window, EdgeFlags.of(window, height, width), overlap);
            if (!interior.isEmpty()) {
                pending.addLast(new Pending(crop(filtered, window, interior), interior));
            }
        }
        flush(writer, pending, Integer.MAX_VALUE);
    }

    private static void flush(ImageWriter writer, Deque<Pending> pending, int readFrom) {
        while (!pending.isEmpty() && pending.peekFirst().window().rowEnd() <= readFrom) {
            Pending next = pending.removeFirst();
            writer.write(next.labels(), next.window());
        }
    }

    static Window interior(Window window, EdgeFlags edges, int overlap) {
        int top = edges.top() ? 0 : overlap;
        int bottom = edges.bottom() ? 0 : overlap;
        int left = edges.left() ? 0 : overlap;
        int right = edges.right() ? 0 : overlap;
        int height = Math.max(0, window.height() - top - bottom);
        int width = Math.max(0, window.width() - left - right);
        return new Window(window.rowOff() + top, window.colOff() + left, height, width);
    }

    private static byte[][] crop(byte[][] labels, Window window, Window interior) {
        int rowShift = interior.rowOff() - window.rowOff();
        int colShift = interior.colOff() - window.colOff();
        byte[][] out = new byte[interior.height()][interior.width()];
        for (int r = 0; r < interior.height(); r++) {
            System.arraycopy(labels[r + rowShift], colShift, out[r], 0, interior.width());
        }
        return out;
    }

    private record Pending(byte[][] labels, Window window) {
    }
}
