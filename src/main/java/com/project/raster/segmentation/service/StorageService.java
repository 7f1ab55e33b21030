package com.project.raster.segmentation.service;

import com.project.raster.segmentation.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;

/**
 * Keeps uploaded rasters under {@code app.upload.dir} and label rasters and previews under
 * {@code app.results.dir}, served at {@code /results/**}.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final Set<String> RASTER_EXTENSIONS = Set.of("tif", "tiff", "png", "jpg", "jpeg", "bmp");

    private final Path uploadDir;
    private final Path resultsDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String uploadDir,
                          @Value("${app.results.dir:results}") String resultsDir) {
        this.uploadDir = createDirectory(uploadDir);
        this.resultsDir = createDirectory(resultsDir);
        log.info("Using upload directory {} and results directory {}", this.uploadDir, this.resultsDir);
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String extension = StringUtils.getFilenameExtension(original);
        String contentType = file.getContentType();
        boolean image = contentType != null && contentType.startsWith("image/");
        if (!image && (extension == null || !RASTER_EXTENSIONS.contains(extension.toLowerCase()))) {
            throw new StorageException("Only raster uploads are allowed (received: " + contentType + ")");
        }
        String filename = timestamp() + "_" + safeName(original);
        Path target = uploadDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload {} ({} KB)", target, file.getSize() / 1024);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /**
     * Reserves a path for the label raster of {@code source}; the file is created by the writer.
     */
    public StoredFile allocateResult(String source) {
        String base = StringUtils.stripFilenameExtension(safeName(source == null ? "image" : source));
        String filename = timestamp() + "_" + base + "_labels.tif";
        return new StoredFile(resultsDir.resolve(filename), filename, "results/" + filename);
    }

    public StoredFile storePreview(byte[] pngBytes, StoredFile result) {
        String filename = StringUtils.stripFilenameExtension(result.filename()) + "_preview.png";
        Path target = resultsDir.resolve(filename);
        try {
            Files.write(target, pngBytes);
            return new StoredFile(target, filename, "results/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store result preview", e);
        }
    }

    public Path resultsDir() {
        return resultsDir;
    }

    private static Path createDirectory(String dir) {
        Path path = Paths.get(dir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(path);
            return path;
        } catch (IOException e) {
            throw new StorageException("Cannot create directory: " + path, e);
        }
    }

    private static String safeName(String name) {
        return StringUtils.getFilename(name).replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static String timestamp() {
        return TIMESTAMP.format(LocalDateTime.now());
    }
}
