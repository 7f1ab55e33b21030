package com.project.raster.segmentation.io;

import com.project.raster.segmentation.exceptions.RasterIOException;
import com.project.raster.segmentation.tiling.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Point;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.RenderedImage;
import java.awt.image.SampleModel;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.Vector;

/**
 * Single-band uint8 label raster stored as an uncompressed, stripped GeoTIFF.
 * <p>
 * The constructor lays out the whole file (header, georeferencing and GDAL nodata tags, zeroed
 * pixel strips). Windows are then written straight into the strips on disk, so labels survive an
 * aborted run, and read-backs come from the file as well. Classic TIFF offsets are 32-bit, which
 * caps the output at 4 GiB of pixels.
 */
public class GeoTiffLabelWriter implements ImageWriter {
    private static final Logger log = LoggerFactory.getLogger(GeoTiffLabelWriter.class);

    static final int TAG_GDAL_NODATA = 42113;
    static final long MAX_PIXELS = 0xFFFF_FFFFL - (1L << 24);

    private static final int BLANK_STRIP_BYTES = 1 << 20;

    private final Path path;
    private final int height;
    private final int width;
    private final long[] stripOffsets;
    private final int rowsPerStrip;
    private final FileChannel channel;
    private boolean closed;

    public GeoTiffLabelWriter(Path path, int height, int width, int nodata, GeoReference geoReference) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Output size must be positive: " + height + "x" + width);
        }
        if ((long) height * width > MAX_PIXELS) {
            throw new RasterIOException("Output raster " + height + "x" + width + " exceeds the 4 GiB TIFF limit");
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            throw new RasterIOException("Output directory does not exist: " + parent);
        }
        this.path = path;
        this.height = height;
        this.width = width;

        writeLayout(path, height, width, nodata, geoReference);
        TIFFDirectory layout = readLayout(path);
        TIFFField rows = layout.getTIFFField(BaselineTIFFTagSet.TAG_ROWS_PER_STRIP);
        this.rowsPerStrip = rows == null ? height : (int) Math.min(height, rows.getAsLong(0));
        this.stripOffsets = locateStrips(layout);

        try {
            this.channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RasterIOException("Cannot open label raster " + path + " for writing", e);
        }
        log.info("Created label raster {} ({}x{}, {} strip(s))", path, height, width, stripOffsets.length);
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public void write(byte[][] labels, Window window) {
        checkOpen();
        checkBounds(window);
        if (labels.length < window.height()) {
            throw new RasterIOException("Label block has " + labels.length + " rows, window needs " + window.height());
        }
        try {
            for (int r = 0; r < window.height(); r++) {
                ByteBuffer row = ByteBuffer.wrap(labels[r], 0, window.width());
                long position = offset(window.rowOff() + r, window.colOff());
                while (row.hasRemaining()) {
                    position += channel.write(row, position);
                }
            }
        } catch (IOException e) {
            throw new RasterIOException("Failed to write " + window + " to " + path, e);
        }
    }

    @Override
    public byte[][] read(Window window) {
        checkOpen();
        checkBounds(window);
        byte[][] out = new byte[window.height()][window.width()];
        try {
            for (int r = 0; r < window.height(); r++) {
                ByteBuffer row = ByteBuffer.wrap(out[r]);
                long position = offset(window.rowOff() + r, window.colOff());
                while (row.hasRemaining()) {
                    int read = channel.read(row, position);
                    if (read < 0) {
                        throw new RasterIOException("Label raster " + path + " is truncated");
                    }
                    position += read;
                }
            }
        } catch (IOException e) {
            throw new RasterIOException("Failed to read " + window + " from " + path, e);
        }
        return out;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.force(false);
            channel.close();
        } catch (IOException e) {
            throw new RasterIOException("Failed to close label raster " + path, e);
        }
        log.info("Wrote label raster {} ({}x{})", path, height, width);
    }

    private long offset(int row, int col) {
        return stripOffsets[row / rowsPerStrip] + (long) (row % rowsPerStrip) * width + col;
    }

    private static void writeLayout(Path path, int height, int width, int nodata, GeoReference geoReference) {
        Iterator<javax.imageio.ImageWriter> writers = ImageIO.getImageWritersByFormatName("tiff");
        if (!writers.hasNext()) {
            throw new RasterIOException("No TIFF writer available");
        }
        javax.imageio.ImageWriter writer = writers.next();
        try {
            Files.deleteIfExists(path);
            try (ImageOutputStream output = ImageIO.createImageOutputStream(path.toFile())) {
                if (output == null) {
                    throw new RasterIOException("Cannot create output raster: " + path);
                }
                ImageWriteParam param = writer.getDefaultWriteParam();
                param.setCompressionMode(ImageWriteParam.MODE_DISABLED);

                BlankImage blank = new BlankImage(height, width);
                writer.setOutput(output);
                writer.write(null, new IIOImage(blank, null, metadata(writer, param, nodata, geoReference)), param);
            }
        } catch (IOException e) {
            throw new RasterIOException("Failed to create label raster " + path, e);
        } finally {
            writer.dispose();
        }
    }

    private static IIOMetadata metadata(javax.imageio.ImageWriter writer, ImageWriteParam param, int nodata,
                                        GeoReference geoReference) throws IIOInvalidTreeException {
        IIOMetadata defaults = writer.getDefaultImageMetadata(BlankImage.TYPE, param);
        TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaults);
        if (geoReference != null) {
            geoReference.fields().forEach(directory::addTIFFField);
        }
        TIFFTag nodataTag = new TIFFTag("GDALNoData", TAG_GDAL_NODATA, 1 << TIFFTag.TIFF_ASCII);
        directory.addTIFFField(new TIFFField(nodataTag, TIFFTag.TIFF_ASCII, 1, new String[]{Integer.toString(nodata)}));
        return directory.getAsMetadata();
    }

    private static TIFFDirectory readLayout(Path path) {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            Iterator<javax.imageio.ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new RasterIOException("Cannot read back label raster " + path);
            }
            javax.imageio.ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                return TIFFDirectory.createFromMetadata(reader.getImageMetadata(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new RasterIOException("Cannot read back label raster " + path, e);
        }
    }

    private long[] locateStrips(TIFFDirectory layout) {
        TIFFField compression = layout.getTIFFField(BaselineTIFFTagSet.TAG_COMPRESSION);
        if (compression != null && compression.getAsInt(0) != BaselineTIFFTagSet.COMPRESSION_NONE) {
            throw new RasterIOException("Label raster " + path + " was written compressed");
        }
        TIFFField offsets = layout.getTIFFField(BaselineTIFFTagSet.TAG_STRIP_OFFSETS);
        TIFFField counts = layout.getTIFFField(BaselineTIFFTagSet.TAG_STRIP_BYTE_COUNTS);
        int strips = (height + rowsPerStrip - 1) / rowsPerStrip;
        if (offsets == null || counts == null || offsets.getCount() != strips || counts.getCount() != strips) {
            throw new RasterIOException("Label raster " + path + " does not have the expected strip layout");
        }
        long[] result = new long[strips];
        for (int i = 0; i < strips; i++) {
            long rowsInStrip = Math.min(rowsPerStrip, height - (long) i * rowsPerStrip);
            if (counts.getAsLong(i) < rowsInStrip * width) {
                throw new RasterIOException("Strip " + i + " of " + path + " holds " + counts.getAsLong(i)
                        + " bytes, expected " + rowsInStrip * width);
            }
            result[i] = offsets.getAsLong(i);
        }
        return result;
    }

    private void checkOpen() {
        if (closed) {
            throw new RasterIOException("Label raster " + path + " is already closed");
        }
    }

    private void checkBounds(Window window) {
        if (window.rowOff() < 0 || window.colOff() < 0 || window.rowEnd() > height || window.colEnd() > width) {
            throw new RasterIOException(window + " is outside the " + height + "x" + width + " output raster");
        }
    }

    /**
     * All-zero uint8 image that hands out one band of rows at a time, so the TIFF writer can lay
     * out an image of any size without a full canvas behind it.
     */
    static final class BlankImage implements RenderedImage {

        static final ImageTypeSpecifier TYPE = ImageTypeSpecifier.createFromBufferedImageType(BufferedImage.TYPE_BYTE_GRAY);

        private final int height;
        private final int width;
        private final int tileHeight;

        BlankImage(int height, int width) {
            this.height = height;
            this.width = width;
            this.tileHeight = Math.max(1, Math.min(height, BLANK_STRIP_BYTES / width));
        }

        @Override
        public Vector<RenderedImage> getSources() {
            return null;
        }

        @Override
        public Object getProperty(String name) {
            return java.awt.Image.UndefinedProperty;
        }

        @Override
        public String[] getPropertyNames() {
            return null;
        }

        @Override
        public ColorModel getColorModel() {
            return TYPE.getColorModel();
        }

        @Override
        public SampleModel getSampleModel() {
            return TYPE.getSampleModel(width, tileHeight);
        }

        @Override
        public int getWidth() {
            return width;
        }

        @Override
        public int getHeight() {
            return height;
        }

        @Override
        public int getMinX() {
            return 0;
        }

        @Override
        public int getMinY() {
            return 0;
        }

        @Override
        public int getNumXTiles() {
            return 1;
        }

        @Override
        public int getNumYTiles() {
            return (height + tileHeight - 1) / tileHeight;
        }

        @Override
        public int getMinTileX() {
            return 0;
        }

        @Override
        public int getMinTileY() {
            return 0;
        }

        @Override
        public int getTileWidth() {
            return width;
        }

        @Override
        public int getTileHeight() {
            return tileHeight;
        }

        @Override
        public int getTileGridXOffset() {
            return 0;
        }

        @Override
        public int getTileGridYOffset() {
            return 0;
        }

        @Override
        public Raster getTile(int tileX, int tileY) {
            return zeros(new Rectangle(0, tileY * tileHeight, width, tileHeight));
        }

        @Override
        public Raster getData() {
            return getData(new Rectangle(0, 0, width, height));
        }

        @Override
        public Raster getData(Rectangle rect) {
            return zeros(rect);
        }

        @Override
        public WritableRaster copyData(WritableRaster raster) {
            if (raster == null) {
                return zeros(new Rectangle(0, 0, width, height));
            }
            int[] zeroRow = new int[raster.getWidth()];
            for (int y = raster.getMinY(); y < raster.getMinY() + raster.getHeight(); y++) {
                raster.setSamples(raster.getMinX(), y, raster.getWidth(), 1, 0, zeroRow);
            }
            return raster;
        }

        private static WritableRaster zeros(Rectangle rect) {
            return Raster.createInterleavedRaster(DataBuffer.TYPE_BYTE, rect.width, rect.height, 1,
                    new Point(rect.x, rect.y));
        }
    }
}
