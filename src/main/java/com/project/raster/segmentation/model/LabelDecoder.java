package com.project.raster.segmentation.model;

/**
 * Turns summed score channels into uint8 labels.
 */
public interface LabelDecoder {

    byte[][] decode(float[][][] scores);

    /** Constant scores of a {@code tileSize x tileSize} tile that decode to the default output value. */
    float[][][] shortcut(int tileSize);

    static LabelDecoder forConfig(ModelConfig config) {
        return switch (config.decoder()) {
            case ARGMAX -> new ArgmaxLabelDecoder(config.numClasses(), config.activation(), config.defaultOutputValue());
            case PRESENCE_SPECIES -> new PresenceSpeciesLabelDecoder(
                    config.numClasses(), config.presenceChannels(), config.defaultOutputValue());
        };
    }
}
