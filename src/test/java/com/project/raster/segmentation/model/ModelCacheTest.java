package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.ModelException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.web.client.RestTemplateBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCacheTest {

    @TempDir
    Path tempDir;

    private ModelCache cache() {
        return new ModelCache(tempDir.resolve("cache").toString(), new RestTemplateBuilder());
    }

    private static ModelConfig at(String location) {
        return new ModelConfig("kelp", "20240722", null, location, 3, 2, Activation.NONE, Normalization.NONE,
                null, null, null, 0, 0, null, DecoderType.ARGMAX, 1);
    }

    @Test
    void resolve_usesLocalFileInPlace() throws IOException {
        Path weights = Files.write(tempDir.resolve("kelp.onnx"), new byte[]{1, 2, 3});

        assertThat(cache().resolve(at(weights.toString()))).isEqualTo(weights.toAbsolutePath().normalize());
    }

    @Test
    void resolve_rejectsMissingLocalFile() {
        assertThatThrownBy(() -> cache().resolve(at(tempDir.resolve("missing.onnx").toString())))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("kelp@20240722");
    }

    @Test
    void remoteModelsAreCachedByNameAndRevision() {
        ModelCache cache = cache();

        assertThat(cache.cachedPath(at("https://example.org/weights/kelp_rgb.onnx")))
                .isEqualTo(cache.cacheDir().resolve("kelp").resolve("20240722").resolve("kelp_rgb.onnx"));
        assertThat(cache.cachedPath(at("https://example.org/")).getFileName()).hasToString("model.onnx");
    }

    @Test
    void resolve_reusesCachedDownload() throws IOException {
        ModelCache cache = cache();
        ModelConfig remote = at("https://example.org/weights/kelp_rgb.onnx");
        Path cached = cache.cachedPath(remote);
        Files.createDirectories(cached.getParent());
        Files.write(cached, new byte[]{42});

        assertThat(cache.resolve(remote)).isEqualTo(cached);
    }

    @Test
    void status_reportsWhereWeightsComeFrom() throws IOException {
        ModelCache cache = cache();
        Path weights = Files.write(tempDir.resolve("kelp.onnx"), new byte[]{1});
        ModelConfig remote = at("https://example.org/weights/kelp_rgb.onnx");

        assertThat(cache.status(at(weights.toString()))).isEqualTo(ModelCache.Status.LOCAL);
        assertThat(cache.status(at(tempDir.resolve("missing.onnx").toString()))).isEqualTo(ModelCache.Status.MISSING);
        assertThat(cache.status(remote)).isEqualTo(ModelCache.Status.AVAILABLE);

        Files.createDirectories(cache.cachedPath(remote).getParent());
        Files.write(cache.cachedPath(remote), new byte[]{42});
        assertThat(cache.status(remote)).isEqualTo(ModelCache.Status.CACHED);
    }

    @Test
    void clean_deletesDownloadedWeightsOnly() throws IOException {
        ModelCache cache = cache();
        Path local = Files.write(tempDir.resolve("kelp.onnx"), new byte[]{1, 2});
        ModelConfig remote = at("https://example.org/weights/kelp_rgb.onnx");
        Path cached = cache.cachedPath(remote);
        Files.createDirectories(cached.getParent());
        Files.write(cached, new byte[2048]);

        assertThat(cache.clean()).isEqualTo(2048);

        assertThat(cache.cacheDir()).doesNotExist();
        assertThat(local).exists();
        assertThat(cache.status(remote)).isEqualTo(ModelCache.Status.AVAILABLE);
        assertThat(cache.clean()).isZero();
    }
}
