package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Catalogue entry of a segmentation model, bound from {@code app.models[i].*}.
 *
 * @param name               registry name, e.g. {@code kelp-rgb}
 * @param revision           calendar revision, e.g. {@code 20240722}; the latest sorts last
 * @param description        free text shown in the catalogue
 * @param location           local path or http(s) URL of the ONNX file
 * @param inputChannels      number of bands the model expects
 * @param numClasses         number of score channels the model outputs
 * @param activation         activation applied before decoding
 * @param normalization      input normalization
 * @param mean               per-channel means for {@link Normalization#STANDARD}
 * @param std                per-channel standard deviations for {@link Normalization#STANDARD}
 * @param maxPixelValue      divisor applied to raw pixels; {@code null} infers it from the image data type
 * @param defaultOutputValue label produced for constant (e.g. nodata-filled) tiles
 * @param nodataValue        nodata value written to the label raster
 * @param tileSize           preferred tile size; {@code null} when the model accepts any
 * @param decoder            how score channels are turned into labels
 * @param presenceChannels   leading presence channels, used by {@link DecoderType#PRESENCE_SPECIES} only
 */
public record ModelConfig(
        String name,
        String revision,
        String description,
        String location,
        @DefaultValue("3") int inputChannels,
        @DefaultValue("2") int numClasses,
        @DefaultValue("NONE") Activation activation,
        @DefaultValue("STANDARD") Normalization normalization,
        List<Double> mean,
        List<Double> std,
        Double maxPixelValue,
        @DefaultValue("0") int defaultOutputValue,
        @DefaultValue("0") int nodataValue,
        Integer tileSize,
        @DefaultValue("ARGMAX") DecoderType decoder,
        @DefaultValue("1") int presenceChannels
) {
    static final List<Double> IMAGENET_MEAN = List.of(0.485, 0.456, 0.406);
    static final List<Double> IMAGENET_STD = List.of(0.229, 0.224, 0.225);

    public ModelConfig {
        description = description == null ? "" : description;
        activation = activation == null ? Activation.NONE : activation;
        normalization = normalization == null ? Normalization.STANDARD : normalization;
        decoder = decoder == null ? DecoderType.ARGMAX : decoder;
        if (normalization == Normalization.STANDARD && inputChannels == 3) {
            mean = mean == null || mean.isEmpty() ? IMAGENET_MEAN : mean;
            std = std == null || std.isEmpty() ? IMAGENET_STD : std;
        }
        mean = mean == null ? List.of() : List.copyOf(mean);
        std = std == null ? List.of() : List.copyOf(std);
    }

    /**
     * Checks the entry for consistency. Called when the registry is built, so a bad catalogue
     * fails at startup rather than halfway through a run.
     */
    public ModelConfig validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Model name must not be blank");
        }
        String id = id();
        if (revision == null || revision.isBlank()) {
            throw new InvalidConfigurationException("Model " + name + " has no revision");
        }
        if (location == null || location.isBlank()) {
            throw new InvalidConfigurationException("Model " + id + " has no location");
        }
        if (inputChannels < 1) {
            throw new InvalidConfigurationException("Model " + id + " must take at least one input channel");
        }
        if (numClasses < 1) {
            throw new InvalidConfigurationException("Model " + id + " must output at least one score channel");
        }
        if (normalization == Normalization.STANDARD) {
            if (mean.size() != inputChannels || std.size() != inputChannels) {
                throw new InvalidConfigurationException("Model " + id + " needs " + inputChannels
                        + " mean and std values for standard normalization, got " + mean.size() + " and " + std.size());
            }
            if (std.stream().anyMatch(s -> s == 0.0)) {
                throw new InvalidConfigurationException("Model " + id + " has a zero std value");
            }
        }
        if (maxPixelValue != null && maxPixelValue <= 0) {
            throw new InvalidConfigurationException("Model " + id + " max pixel value must be positive: " + maxPixelValue);
        }
        if (tileSize != null && (tileSize <= 0 || tileSize % 2 != 0)) {
            throw new InvalidConfigurationException("Model " + id + " tile size must be positive and even: " + tileSize);
        }
        if (defaultOutputValue < 0 || defaultOutputValue > 255 || nodataValue < 0 || nodataValue > 255) {
            throw new InvalidConfigurationException("Model " + id + " output values must fit in uint8");
        }
        LabelDecoder.forConfig(this);
        return this;
    }

    public String id() {
        return name + "@" + revision;
    }

    public boolean isRemote() {
        return location.startsWith("http://") || location.startsWith("https://");
    }
}
