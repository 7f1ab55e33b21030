package com.project.raster.segmentation.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * GeoTIFF georeferencing tags carried from the source raster to the label raster unchanged.
 * The coordinate reference system itself is never interpreted.
 */
public record GeoReference(List<TIFFField> fields) {

    private static final Logger log = LoggerFactory.getLogger(GeoReference.class);

    static final String TIFF_METADATA_FORMAT = "javax_imageio_tiff_image_1.0";

    private static final int[] GEO_TAGS = {
            GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE,
            GeoTIFFTagSet.TAG_MODEL_TIE_POINT,
            GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION,
            GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY,
            GeoTIFFTagSet.TAG_GEO_DOUBLE_PARAMS,
            GeoTIFFTagSet.TAG_GEO_ASCII_PARAMS
    };

    public GeoReference {
        fields = List.copyOf(fields);
    }

    /**
     * Extracts the GeoTIFF fields from TIFF image metadata.
     *
     * @return empty if the metadata is not TIFF metadata or carries no GeoTIFF field
     */
    public static Optional<GeoReference> fromMetadata(IIOMetadata metadata) {
        if (metadata == null || !TIFF_METADATA_FORMAT.equals(metadata.getNativeMetadataFormatName())) {
            return Optional.empty();
        }
        TIFFDirectory directory;
        try {
            directory = TIFFDirectory.createFromMetadata(metadata);
        } catch (IIOInvalidTreeException e) {
            log.warn("Ignoring unreadable TIFF metadata: {}", e.getMessage());
            return Optional.empty();
        }

        List<TIFFField> found = new ArrayList<>();
        for (int tag : GEO_TAGS) {
            TIFFField field = directory.getTIFFField(tag);
            if (field != null) {
                found.add(field);
            }
        }
        return found.isEmpty() ? Optional.empty() : Optional.of(new GeoReference(found));
    }

    public Optional<TIFFField> field(int tagNumber) {
        return fields.stream().filter(f -> f.getTagNumber() == tagNumber).findFirst();
    }
}
