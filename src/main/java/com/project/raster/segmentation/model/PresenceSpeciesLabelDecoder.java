package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;

/**
 * Decoder for legacy two-stage models whose output stacks presence channels on top of species
 * channels. With one presence channel a pixel is present when its logit is positive (sigmoid
 * above 0.5); with two, when the second channel wins. Present pixels are labelled
 * {@code argmax(species) + 1}, absent ones 0.
 */
public class PresenceSpeciesLabelDecoder implements LabelDecoder {

    private final int numClasses;
    private final int presenceChannels;
    private final int defaultOutputValue;

    public PresenceSpeciesLabelDecoder(int numClasses, int presenceChannels, int defaultOutputValue) {
        if (presenceChannels < 1 || presenceChannels > 2 || numClasses <= presenceChannels) {
            throw new InvalidConfigurationException("Need one or two presence channels followed by species channels, got "
                    + presenceChannels + " of " + numClasses);
        }
        int species = numClasses - presenceChannels;
        if (defaultOutputValue < 0 || defaultOutputValue > species) {
            throw new InvalidConfigurationException("Default output value " + defaultOutputValue
                    + " is not a label of a model with " + species + " species");
        }
        this.numClasses = numClasses;
        this.presenceChannels = presenceChannels;
        this.defaultOutputValue = defaultOutputValue;
    }

    @Override
    public byte[][] decode(float[][][] scores) {
        if (scores.length != numClasses) {
            throw new IllegalArgumentException("Expected " + numClasses + " score channels, got " + scores.length);
        }
        int height = scores[0].length;
        int width = height == 0 ? 0 : scores[0][0].length;
        byte[][] labels = new byte[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                boolean present = presenceChannels == 1
                        ? scores[0][r][c] > 0f
                        : scores[1][r][c] > scores[0][r][c];
                if (!present) {
                    continue;
                }
                int best = presenceChannels;
                for (int k = presenceChannels + 1; k < numClasses; k++) {
                    if (scores[k][r][c] > scores[best][r][c]) {
                        best = k;
                    }
                }
                labels[r][c] = (byte) (best - presenceChannels + 1);
            }
        }
        return labels;
    }

    @Override
    public float[][][] shortcut(int tileSize) {
        float[][][] scores = new float[numClasses][tileSize][tileSize];
        boolean present = defaultOutputValue > 0;
        if (presenceChannels == 1) {
            ArgmaxLabelDecoder.fill(scores[0], present ? ArgmaxLabelDecoder.SHORTCUT_LOGIT : -ArgmaxLabelDecoder.SHORTCUT_LOGIT);
        } else {
            ArgmaxLabelDecoder.fill(scores[present ? 1 : 0], 1f);
        }
        if (present) {
            ArgmaxLabelDecoder.fill(scores[presenceChannels + defaultOutputValue - 1], 1f);
        }
        return scores;
    }
}
