package com.project.raster.segmentation.io;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.exceptions.RasterIOException;
import com.project.raster.segmentation.tiling.Window;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterIoTest {

    @TempDir
    Path tempDir;

    @Test
    void reader_opensMultiBandTiff() throws IOException {
        Path tiff = writeRgbTiff(tempDir.resolve("rgb.tif"), 40, 30, null);

        try (ImageIoRasterReader reader = ImageIoRasterReader.open(tiff)) {
            assertThat(reader.height()).isEqualTo(40);
            assertThat(reader.width()).isEqualTo(30);
            assertThat(reader.bandCount()).isEqualTo(3);
            assertThat(reader.dataType()).isEqualTo(RasterDataType.UINT8);
            assertThat(reader.geoReference()).isEmpty();

            float[][][] tile = reader.readWindow(new Window(5, 7, 4, 3), null, 0f);
            assertThat(tile).hasNumberOfRows(3);
            assertThat(tile[0][0][0]).isEqualTo(sample(0, 5, 7));
            assertThat(tile[1][3][2]).isEqualTo(sample(1, 8, 9));
            assertThat(tile[2][1][1]).isEqualTo(sample(2, 6, 8));
        }
    }

    @Test
    void reader_fillsPixelsOutsideTheRaster() throws IOException {
        Path tiff = writeRgbTiff(tempDir.resolve("rgb.tif"), 10, 10, null);

        try (ImageIoRasterReader reader = ImageIoRasterReader.open(tiff)) {
            float[][][] tile = reader.readWindow(new Window(8, 6, 4, 8), new int[]{3, 1}, -1f);

            assertThat(tile).hasNumberOfRows(2);
            assertThat(tile[0][0][0]).isEqualTo(sample(2, 8, 6));
            assertThat(tile[1][1][3]).isEqualTo(sample(0, 9, 9));
            assertThat(tile[0][0][4]).isEqualTo(-1f);
            assertThat(tile[1][2][0]).isEqualTo(-1f);
            assertThat(tile[0][3][7]).isEqualTo(-1f);

            float[][][] outside = reader.readWindow(new Window(20, 20, 2, 2), new int[]{1}, 7f);
            assertThat(outside[0][1][1]).isEqualTo(7f);
        }
    }

    @Test
    void reader_rejectsBandOutsideRaster() throws IOException {
        Path tiff = writeRgbTiff(tempDir.resolve("rgb.tif"), 10, 10, null);

        try (ImageIoRasterReader reader = ImageIoRasterReader.open(tiff)) {
            assertThatThrownBy(() -> reader.readWindow(new Window(0, 0, 2, 2), new int[]{1, 4}, 0f))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("3 band(s)");
        }
    }

    @Test
    void reader_reportsSixteenBitData() throws IOException {
        BufferedImage image = new BufferedImage(8, 6, BufferedImage.TYPE_USHORT_GRAY);
        image.getRaster().setSample(2, 3, 0, 40000);
        Path png = tempDir.resolve("dem.png");
        ImageIO.write(image, "png", png.toFile());

        try (ImageIoRasterReader reader = ImageIoRasterReader.open(png)) {
            assertThat(reader.dataType()).isEqualTo(RasterDataType.UINT16);
            assertThat(reader.bandCount()).isEqualTo(1);
            assertThat(reader.readWindow(new Window(3, 2, 1, 1), null, 0f)[0][0][0]).isEqualTo(40000f);
        }
    }

    @Test
    void reader_rejectsMissingAndUnreadableFiles() throws IOException {
        assertThatThrownBy(() -> ImageIoRasterReader.open(tempDir.resolve("missing.tif")))
                .isInstanceOf(RasterIOException.class);

        Path text = Files.writeString(tempDir.resolve("notes.tif"), "not a raster");
        assertThatThrownBy(() -> ImageIoRasterReader.open(text))
                .isInstanceOf(RasterIOException.class)
                .hasMessageContaining("Unsupported raster format");
    }

    @Test
    void labelWriter_writesLabelsAndGeoreferencing() throws IOException {
        Path source = writeRgbTiff(tempDir.resolve("geo.tif"), 12, 16, new double[]{0.5, 0.5, 0.0});
        Path output = tempDir.resolve("labels.tif");

        try (ImageIoRasterReader reader = ImageIoRasterReader.open(source)) {
            assertThat(reader.geoReference()).isPresent();
            try (GeoTiffLabelWriter writer = new GeoTiffLabelWriter(output, 12, 16, 255,
                    reader.geoReference().orElseThrow())) {
                writer.write(new byte[][]{{1, 2, 3}, {4, 5, 6}}, new Window(10, 13, 2, 3));
                writer.write(new byte[][]{{(byte) 200}}, new Window(0, 0, 1, 1));
                assertThat(writer.read(new Window(11, 14, 1, 2))).isEqualTo(new byte[][]{{5, 6}});
            }
        }

        BufferedImage labels = ImageIO.read(output.toFile());
        assertThat(labels.getWidth()).isEqualTo(16);
        assertThat(labels.getHeight()).isEqualTo(12);
        assertThat(labels.getRaster().getNumBands()).isEqualTo(1);
        assertThat(labels.getRaster().getSample(0, 0, 0)).isEqualTo(200);
        assertThat(labels.getRaster().getSample(15, 11, 0)).isEqualTo(6);
        assertThat(labels.getRaster().getSample(5, 5, 0)).isZero();

        try (ImageIoRasterReader written = ImageIoRasterReader.open(output)) {
            TIFFField scale = written.geoReference()
                    .flatMap(g -> g.field(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE))
                    .orElseThrow();
            assertThat(scale.getAsDouble(0)).isEqualTo(0.5);
        }
        assertThat(containsNodataEntry(Files.readAllBytes(output))).isTrue();
    }

    @Test
    void labelWriter_rejectsWindowsOutsideTheRaster() {
        GeoTiffLabelWriter writer = new GeoTiffLabelWriter(tempDir.resolve("labels.tif"), 4, 4, 0, null);

        assertThatThrownBy(() -> writer.write(new byte[][]{{1, 1}}, new Window(3, 3, 1, 2)))
                .isInstanceOf(RasterIOException.class);
        assertThatThrownBy(() -> writer.read(new Window(0, 0, 5, 1)))
                .isInstanceOf(RasterIOException.class);

        writer.close();
        writer.close();
        assertThat(tempDir.resolve("labels.tif")).exists();
        assertThatThrownBy(() -> writer.write(new byte[][]{{1}}, new Window(0, 0, 1, 1)))
                .isInstanceOf(RasterIOException.class)
                .hasMessageContaining("already closed");
    }

    @Test
    void labelWriter_writesWindowsToDiskBeforeClose() throws IOException {
        Path output = tempDir.resolve("partial.tif");
        GeoTiffLabelWriter writer = new GeoTiffLabelWriter(output, 300, 5000, 0, null);
        try {
            writer.write(new byte[][]{{7, 8}, {9, 10}, {11, 12}}, new Window(150, 4000, 3, 2));
            writer.write(new byte[][]{{3}}, new Window(299, 4999, 1, 1));

            BufferedImage labels = ImageIO.read(output.toFile());
            assertThat(labels.getHeight()).isEqualTo(300);
            assertThat(labels.getWidth()).isEqualTo(5000);
            assertThat(labels.getRaster().getSample(4000, 150, 0)).isEqualTo(7);
            assertThat(labels.getRaster().getSample(4001, 152, 0)).isEqualTo(12);
            assertThat(labels.getRaster().getSample(4999, 299, 0)).isEqualTo(3);
            assertThat(labels.getRaster().getSample(3999, 150, 0)).isZero();
            assertThat(writer.read(new Window(151, 3999, 1, 3))).isEqualTo(new byte[][]{{0, 9, 10}});
        } finally {
            writer.close();
        }
    }

    @Test
    void labelWriter_rejectsRasterBeyondClassicTiffLimit() {
        Path output = tempDir.resolve("huge.tif");

        assertThatThrownBy(() -> new GeoTiffLabelWriter(output, 70_000, 70_000, 0, null))
                .isInstanceOf(RasterIOException.class)
                .hasMessageContaining("4 GiB");
        assertThat(output).doesNotExist();
    }

    @Test
    void labelWriter_requiresExistingOutputDirectory() {
        assertThatThrownBy(() -> new GeoTiffLabelWriter(tempDir.resolve("missing/labels.tif"), 4, 4, 0, null))
                .isInstanceOf(RasterIOException.class)
                .hasMessageContaining("does not exist");
    }

    private static float sample(int band, int row, int col) {
        return (band * 70 + row * 3 + col) % 256;
    }

    private static Path writeRgbTiff(Path path, int height, int width, double[] pixelScale) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        WritableRaster raster = image.getRaster();
        for (int b = 0; b < 3; b++) {
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    raster.setSample(c, r, b, sample(b, r, c));
                }
            }
        }

        ImageWriter writer = ImageIO.getImageWritersByFormatName("tiff").next();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(path.toFile())) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            if (pixelScale != null) {
                TIFFDirectory directory = TIFFDirectory.createFromMetadata(metadata);
                TIFFTag tag = GeoTIFFTagSet.getInstance().getTag(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE);
                directory.addTIFFField(new TIFFField(tag, TIFFTag.TIFF_DOUBLE, pixelScale.length, pixelScale));
                metadata = directory.getAsMetadata();
            }
            writer.setOutput(output);
            writer.write(null, new IIOImage(image, null, metadata), param);
        } finally {
            writer.dispose();
        }
        return path;
    }

    // IFD entry header: tag 42113 followed by field type ASCII, big-endian.
    private static boolean containsNodataEntry(byte[] tiff) {
        byte[] entry = {
                (byte) (GeoTiffLabelWriter.TAG_GDAL_NODATA >> 8), (byte) GeoTiffLabelWriter.TAG_GDAL_NODATA,
                0, (byte) TIFFTag.TIFF_ASCII
        };
        for (int i = 0; i + entry.length <= tiff.length; i++) {
            boolean match = true;
            for (int j = 0; j < entry.length && match; j++) {
                match = tiff[i + j] == entry[j];
            }
            if (match) {
                return true;
            }
        }
        return false;
    }
}
