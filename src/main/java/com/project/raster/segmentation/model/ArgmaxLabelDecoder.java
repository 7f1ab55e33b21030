package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;

import java.util.Arrays;

/**
 * Label = index of the highest score, first index on ties.
 * <p>
 * Softmax and sigmoid are monotonic, so for multi-channel outputs the activation never changes
 * the winner and is not evaluated. A single-channel output is a binary probability {@code p} and
 * decodes like {@code argmax([1 - p, p])}. With a sigmoid activation the channel holds the logit
 * of the background class: {@code p = sigmoid(-x)}, so negative logits decode to label 1.
 */
public class ArgmaxLabelDecoder implements LabelDecoder {

    static final float SHORTCUT_LOGIT = 10f;

    private final int numClasses;
    private final Activation activation;
    private final int defaultOutputValue;

    public ArgmaxLabelDecoder(int numClasses, Activation activation, int defaultOutputValue) {
        if (numClasses < 1) {
            throw new InvalidConfigurationException("Need at least one score channel, got " + numClasses);
        }
        if (numClasses == 1 && activation == Activation.SOFTMAX) {
            throw new InvalidConfigurationException("Softmax over a single score channel is constant");
        }
        int labels = Math.max(numClasses, 2);
        if (defaultOutputValue < 0 || defaultOutputValue >= labels) {
            throw new InvalidConfigurationException("Default output value " + defaultOutputValue
                    + " is not a label of a " + labels + "-class model");
        }
        this.numClasses = numClasses;
        this.activation = activation;
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

        if (numClasses == 1) {
            float[][] channel = scores[0];
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    labels[r][c] = (byte) (probability(channel[r][c]) > 0.5f ? 1 : 0);
                }
            }
            return labels;
        }

        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int best = 0;
                float bestScore = scores[0][r][c];
                for (int k = 1; k < numClasses; k++) {
                    float score = scores[k][r][c];
                    if (score > bestScore) {
                        bestScore = score;
                        best = k;
                    }
                }
                labels[r][c] = (byte) best;
            }
        }
        return labels;
    }

    @Override
    public float[][][] shortcut(int tileSize) {
        float[][][] scores = new float[numClasses][tileSize][tileSize];
        if (numClasses == 1) {
            float value;
            if (activation == Activation.SIGMOID) {
                value = defaultOutputValue == 1 ? -SHORTCUT_LOGIT : SHORTCUT_LOGIT;
            } else {
                value = defaultOutputValue;
            }
            fill(scores[0], value);
        } else {
            fill(scores[defaultOutputValue], 1f);
        }
        return scores;
    }

    private float probability(float value) {
        return activation == Activation.SIGMOID ? sigmoid(-value) : value;
    }

    private static float sigmoid(float x) {
        return (float) (1.0 / (1.0 + Math.exp(-x)));
    }

    static void fill(float[][] channel, float value) {
        for (float[] row : channel) {
            Arrays.fill(row, value);
        }
    }
}
