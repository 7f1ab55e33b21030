package com.project.raster.segmentation.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TileNormalizerTest {

    @Test
    void none_onlyScalesByMaxPixelValue() {
        TileNormalizer normalizer = new TileNormalizer(Normalization.NONE, null, null, 255.0);
        float[][][] tile = {{{0f, 51f, 255f}}};

        float[][][] out = normalizer.apply(tile);

        assertThat(out[0][0][0]).isZero();
        assertThat(out[0][0][1]).isCloseTo(0.2f, within(1e-6f));
        assertThat(out[0][0][2]).isCloseTo(1f, within(1e-6f));
        assertThat(tile[0][0][1]).isEqualTo(51f);
    }

    @Test
    void standard_subtractsMeanAndDividesByStd() {
        TileNormalizer normalizer = new TileNormalizer(Normalization.STANDARD, List.of(0.5, 0.25), List.of(0.5, 0.25), 100.0);
        float[][][] tile = {{{50f, 100f}}, {{25f, 0f}}};

        float[][][] out = normalizer.apply(tile);

        assertThat(out[0][0]).containsExactly(new float[]{0f, 1f}, within(1e-6f));
        assertThat(out[1][0]).containsExactly(new float[]{0f, -1f}, within(1e-6f));
    }

    @Test
    void standard_rejectsChannelMismatch() {
        TileNormalizer normalizer = new TileNormalizer(Normalization.STANDARD, List.of(0.5), List.of(0.5), 1.0);

        assertThatThrownBy(() -> normalizer.apply(new float[2][1][1]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void minMax_usesRangeOfWholeTile() {
        TileNormalizer normalizer = new TileNormalizer(Normalization.MIN_MAX, null, null, 1.0);
        float[][][] tile = {{{2f, 4f}}, {{6f, 10f}}};

        float[][][] out = normalizer.apply(tile);

        assertThat(out[0][0]).containsExactly(new float[]{0f, 0.25f}, within(1e-6f));
        assertThat(out[1][0]).containsExactly(new float[]{0.5f, 1f}, within(1e-6f));
    }

    @Test
    void minMaxPerChannel_usesRangeOfEachChannel() {
        TileNormalizer normalizer = new TileNormalizer(Normalization.MIN_MAX_PER_CHANNEL, null, null, 1.0);
        float[][][] tile = {{{2f, 4f}}, {{6f, 10f}}, {{3f, 3f}}};

        float[][][] out = normalizer.apply(tile);

        assertThat(out[0][0]).containsExactly(new float[]{0f, 1f}, within(1e-6f));
        assertThat(out[1][0]).containsExactly(new float[]{0f, 1f}, within(1e-6f));
        assertThat(out[2][0]).containsExactly(new float[]{0f, 0f}, within(1e-6f));
    }

    @Test
    void rejectsNonPositiveMaxPixelValue() {
        assertThatThrownBy(() -> new TileNormalizer(Normalization.NONE, null, null, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
