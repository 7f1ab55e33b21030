package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * Local cache of model weights, laid out as {@code <cache-dir>/<name>/<revision>/<file>}.
 * Remote weights are downloaded once into a temporary file and moved into place, so a partial
 * download never shows up as a cached model. Local locations are used as they are.
 */
@Component
public class ModelCache {
    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    public enum Status {
        /** Local weights that exist. */
        LOCAL,
        /** Local weights that do not exist. */
        MISSING,
        /** Remote weights already downloaded. */
        CACHED,
        /** Remote weights that will be downloaded on first use. */
        AVAILABLE
    }

    private final Path cacheDir;
    private final RestTemplate restTemplate;

    public ModelCache(@Value("${app.model-cache.dir:${user.home}/.cache/raster-segmentation/models}") String cacheDir,
                      RestTemplateBuilder restTemplateBuilder) {
        this.cacheDir = Paths.get(cacheDir).toAbsolutePath().normalize();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(15))
                .setReadTimeout(Duration.ofSeconds(120))
                .build();
    }

    public Path cacheDir() {
        return cacheDir;
    }

    /**
     * Returns a local path to the weights of {@code config}, downloading them first if needed.
     */
    public Path resolve(ModelConfig config) {
        if (!config.isRemote()) {
            Path local = Paths.get(config.location()).toAbsolutePath().normalize();
            if (!Files.isRegularFile(local)) {
                throw new ModelException("Model file of " + config.id() + " not found: " + local);
            }
            return local;
        }

        Path target = cachedPath(config);
        if (Files.isRegularFile(target)) {
            log.debug("Using cached weights {} for {}", target, config.id());
            return target;
        }
        return download(config, target);
    }

    public Status status(ModelConfig config) {
        if (!config.isRemote()) {
            return Files.isRegularFile(Paths.get(config.location())) ? Status.LOCAL : Status.MISSING;
        }
        return Files.isRegularFile(cachedPath(config)) ? Status.CACHED : Status.AVAILABLE;
    }

    /**
     * Deletes every downloaded weight file along with the cache directory. Local model files are
     * never touched.
     *
     * @return bytes freed, 0 if the cache was already empty
     */
    public long clean() {
        if (!Files.isDirectory(cacheDir)) {
            log.info("Model cache {} does not exist", cacheDir);
            return 0;
        }
        try {
            long freed;
            try (Stream<Path> files = Files.walk(cacheDir)) {
                freed = files.filter(Files::isRegularFile).mapToLong(ModelCache::size).sum();
            }
            FileSystemUtils.deleteRecursively(cacheDir);
            log.info("Cleared model cache {} ({} KB)", cacheDir, freed / 1024);
            return freed;
        } catch (IOException | UncheckedIOException e) {
            throw new ModelException("Failed to clear model cache " + cacheDir, e);
        }
    }

    private static long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    Path cachedPath(ModelConfig config) {
        String path = URI.create(config.location()).getPath();
        String filename = path == null || path.isEmpty() || path.endsWith("/")
                ? "model.onnx"
                : path.substring(path.lastIndexOf('/') + 1);
        return cacheDir.resolve(config.name()).resolve(config.revision()).resolve(filename);
    }

    private Path download(ModelConfig config, Path target) {
        log.info("Downloading weights of {} from {}", config.id(), config.location());
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".part");
            Path destination = tmp;
            restTemplate.execute(URI.create(config.location()), HttpMethod.GET, null, response -> {
                Files.copy(response.getBody(), destination, StandardCopyOption.REPLACE_EXISTING);
                return destination;
            });
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Cached weights of {} at {} ({} KB)", config.id(), target, Files.size(target) / 1024);
            return target;
        } catch (IOException | RestClientException e) {
            throw new ModelException("Failed to download weights of " + config.id() + " from " + config.location(), e);
        } finally {
            deleteIfPresent(tmp);
        }
    }

    private static void deleteIfPresent(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete partial download {}: {}", tmp, e.getMessage());
        }
    }
}
