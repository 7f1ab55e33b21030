package com.project.raster.segmentation.io;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.exceptions.RasterIOException;
import com.project.raster.segmentation.tiling.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import java.awt.Rectangle;
import java.awt.image.Raster;
import java.awt.image.SampleModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Optional;

/**
 * {@link ImageReader} over any raster format ImageIO can decode (GeoTIFF through the JDK TIFF
 * plugin, PNG, ...). Only the requested region is decoded for each window.
 */
public class ImageIoRasterReader implements ImageReader {
    private static final Logger log = LoggerFactory.getLogger(ImageIoRasterReader.class);

    private final Path path;
    private final ImageInputStream input;
    private final javax.imageio.ImageReader reader;
    private final int height;
    private final int width;
    private final int bandCount;
    private final RasterDataType dataType;
    private final GeoReference geoReference;

    private ImageIoRasterReader(Path path, ImageInputStream input, javax.imageio.ImageReader reader) throws IOException {
        this.path = path;
        this.input = input;
        this.reader = reader;
        this.height = reader.getHeight(0);
        this.width = reader.getWidth(0);

        ImageTypeSpecifier type = reader.getRawImageType(0);
        if (type == null) {
            type = reader.getImageTypes(0).next();
        }
        SampleModel sampleModel = type.getSampleModel();
        this.bandCount = sampleModel.getNumBands();
        this.dataType = RasterDataType.fromDataBufferType(sampleModel.getDataType());
        this.geoReference = GeoReference.fromMetadata(reader.getImageMetadata(0)).orElse(null);
    }

    public static ImageIoRasterReader open(Path path) {
        if (!Files.isReadable(path)) {
            throw new RasterIOException("Cannot read raster: " + path);
        }
        ImageInputStream input = null;
        try {
            input = ImageIO.createImageInputStream(path.toFile());
            if (input == null) {
                throw new RasterIOException("Cannot open raster: " + path);
            }
            Iterator<javax.imageio.ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new RasterIOException("Unsupported raster format: " + path);
            }
            javax.imageio.ImageReader reader = readers.next();
            reader.setInput(input, true, false);
            ImageIoRasterReader raster = new ImageIoRasterReader(path, input, reader);
            log.info("Opened {} ({}x{}, {} band(s), {}, georeferenced={})", path.getFileName(),
                    raster.height, raster.width, raster.bandCount, raster.dataType, raster.geoReference != null);
            return raster;
        } catch (IOException | IllegalArgumentException e) {
            closeQuietly(input, e);
            throw new RasterIOException("Failed to open raster " + path + ": " + e.getMessage(), e);
        } catch (RasterIOException e) {
            closeQuietly(input, e);
            throw e;
        }
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
    public int bandCount() {
        return bandCount;
    }

    @Override
    public RasterDataType dataType() {
        return dataType;
    }

    @Override
    public Optional<GeoReference> geoReference() {
        return Optional.ofNullable(geoReference);
    }

    @Override
    public float[][][] readWindow(Window window, int[] bandOrder, float fillValue) {
        int[] bands = resolveBands(bandOrder);
        float[][][] tile = new float[bands.length][window.height()][window.width()];
        if (fillValue != 0f) {
            for (float[][] band : tile) {
                for (float[] row : band) {
                    Arrays.fill(row, fillValue);
                }
            }
        }

        Optional<Window> inside = window.clipTo(height, width);
        if (inside.isEmpty()) {
            return tile;
        }
        Window region = inside.get();
        int rowShift = region.rowOff() - window.rowOff();
        int colShift = region.colOff() - window.colOff();

        try {
            ImageReadParam param = reader.getDefaultReadParam();
            param.setSourceRegion(new Rectangle(region.colOff(), region.rowOff(), region.width(), region.height()));
            Raster raster = reader.canReadRaster() ? reader.readRaster(0, param) : reader.read(0, param).getRaster();

            float[] samples = new float[region.height() * region.width()];
            for (int b = 0; b < bands.length; b++) {
                raster.getSamples(raster.getMinX(), raster.getMinY(), region.width(), region.height(), bands[b] - 1, samples);
                for (int r = 0; r < region.height(); r++) {
                    System.arraycopy(samples, r * region.width(), tile[b][r + rowShift], colShift, region.width());
                }
            }
        } catch (IOException e) {
            throw new RasterIOException("Failed to read " + window + " from " + path, e);
        }
        return tile;
    }

    private int[] resolveBands(int[] bandOrder) {
        if (bandOrder == null) {
            int[] all = new int[bandCount];
            for (int i = 0; i < bandCount; i++) {
                all[i] = i + 1;
            }
            return all;
        }
        for (int band : bandOrder) {
            if (band < 1 || band > bandCount) {
                throw new InvalidConfigurationException("Band order " + Arrays.toString(bandOrder)
                        + " is invalid for an image with " + bandCount + " band(s)");
            }
        }
        return bandOrder;
    }

    @Override
    public void close() {
        reader.dispose();
        try {
            input.close();
        } catch (IOException e) {
            throw new RasterIOException("Failed to close " + path, e);
        }
    }

    private static void closeQuietly(ImageInputStream input, Exception cause) {
        if (input == null) {
            return;
        }
        try {
            input.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
