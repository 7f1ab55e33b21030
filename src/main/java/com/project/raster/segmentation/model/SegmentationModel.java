package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.io.RasterDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * The concrete {@link InferenceModel}: catalogue entry for preprocessing, a backend for
 * inference and a decoder for labels. Model variants differ in configuration and decoder only.
 */
public class SegmentationModel implements InferenceModel {
    private static final Logger log = LoggerFactory.getLogger(SegmentationModel.class);

    private final ModelConfig config;
    private final InferenceBackend backend;
    private final LabelDecoder decoder;
    private final TileNormalizer normalizer;

    public SegmentationModel(ModelConfig config, InferenceBackend backend) {
        this(config, backend, LabelDecoder.forConfig(config), null);
    }

    private SegmentationModel(ModelConfig config, InferenceBackend backend, LabelDecoder decoder, TileNormalizer normalizer) {
        this.config = config;
        this.backend = backend;
        this.decoder = decoder;
        this.normalizer = normalizer;
    }

    public ModelConfig config() {
        return config;
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public int inputChannels() {
        return config.inputChannels();
    }

    @Override
    public int numClasses() {
        return config.numClasses();
    }

    @Override
    public OptionalInt preferredTileSize() {
        return config.tileSize() == null ? OptionalInt.empty() : OptionalInt.of(config.tileSize());
    }

    @Override
    public SegmentationModel forDataType(RasterDataType dataType) {
        double maxPixelValue;
        if (config.maxPixelValue() != null) {
            maxPixelValue = config.maxPixelValue();
        } else if (dataType.isFloatingPoint()) {
            log.warn("Image data type is {}; assuming pixel values are already scaled to [0, 1]", dataType);
            maxPixelValue = 1.0;
        } else {
            maxPixelValue = switch (dataType) {
                case UINT8 -> 255.0;
                case UINT16 -> 65535.0;
                case INT16 -> 32767.0;
                default -> throw new InvalidConfigurationException("Unsupported image data type " + dataType
                        + " for model " + config.id() + "; set a max pixel value in the model configuration");
            };
        }
        log.debug("Model {} scales input by 1/{}", config.id(), maxPixelValue);
        TileNormalizer bound = new TileNormalizer(config.normalization(), config.mean(), config.std(), maxPixelValue);
        return new SegmentationModel(config, backend, decoder, bound);
    }

    @Override
    public float[][][][] predict(float[][][][] batch) {
        if (normalizer == null) {
            throw new IllegalStateException("Model " + config.id() + " is not bound to an image data type");
        }
        return backend.run(normalizer.apply(batch));
    }

    @Override
    public byte[][] postprocess(float[][][] scores) {
        return decoder.decode(scores);
    }

    @Override
    public float[][][] shortcut(int tileSize) {
        return decoder.shortcut(tileSize);
    }
}
