package com.project.raster.segmentation.controller;

import com.project.raster.segmentation.DTOs.SegmentationRequest;
import com.project.raster.segmentation.DTOs.SegmentationResult;
import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.exceptions.SegmentationException;
import com.project.raster.segmentation.service.SegmentationService;
import com.project.raster.segmentation.service.StorageService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;


@Controller
@Validated
public class SegmentationController {
    private static final Logger log = LoggerFactory.getLogger(SegmentationController.class);

    private final SegmentationService segmentationService;
    private final StorageService storageService;
    private final SegmentationForm form;

    @Value("${app.upload.max-size-mb:512}")
    private long maxUploadSizeMb;

    public SegmentationController(SegmentationService segmentationService, StorageService storageService,
                                  SegmentationForm form) {
        this.segmentationService = segmentationService;
        this.storageService = storageService;
        this.form = form;
    }

    @GetMapping("/segment")
    public String showForm(Model model) {
        form.populate(model);
        return "segment";
    }

    @PostMapping(value = "/segment", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam("model") @NotBlank String modelName,
            @RequestParam(name = "revision", required = false) String revision,
            @RequestParam(name = "tileSize", required = false)
            @Min(value = 2, message = "Tile size must be at least 2 pixels")
            @Max(value = 8192, message = "Tile size cannot exceed 8192 pixels")
            Integer tileSize,
            @RequestParam(name = "batchSize", defaultValue = "1")
            @Min(value = 1, message = "Batch size must be at least 1")
            @Max(value = 64, message = "Batch size cannot exceed 64")
            int batchSize,
            @RequestParam(name = "blurKernelSize", defaultValue = "5")
            @Min(0) @Max(99)
            int blurKernelSize,
            @RequestParam(name = "morphKernelSize", defaultValue = "0")
            @Min(0) @Max(99)
            int morphKernelSize,
            @RequestParam(name = "bandOrder", required = false) String bandOrder,
            Model model
    ) {
        validateUploadedFile(file);

        log.info("Processing file: {} ({}KB) with model {}", file.getOriginalFilename(), file.getSize() / 1024, modelName);

        var storedOriginal = storageService.store(file);
        log.debug("File stored as: {}", storedOriginal.filename());
        var labels = storageService.allocateResult(file.getOriginalFilename());

        try {
            SegmentationRequest request = new SegmentationRequest(modelName, blankToNull(revision), tileSize, batchSize,
                    blurKernelSize, morphKernelSize, SegmentationRequest.parseBandOrder(bandOrder));
            SegmentationResult result = segmentationService.segment(storedOriginal.path(), labels.path(), request);
            var preview = storageService.storePreview(result.previewPng(), labels);

            populateResultModel(model, labels, preview, result);
            log.info("Segmentation completed successfully for {}", file.getOriginalFilename());
            return "result";

        } catch (SegmentationException e) {
            log.warn("Segmentation failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            form.populate(model);
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", getSuggestionForError(e));
            return "segment";
        }
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a raster to upload");
        }
        if (file.getSize() > maxUploadSizeMb * 1024 * 1024) {
            throw new IllegalArgumentException("File is too large. Maximum size: " + maxUploadSizeMb + "MB");
        }
    }

    private void populateResultModel(Model model, StorageService.StoredFile labels,
                                     StorageService.StoredFile preview, SegmentationResult result) {
        model.addAttribute("labelsPath", "/" + labels.relativeWebPath());
        model.addAttribute("previewPath", "/" + preview.relativeWebPath());

        model.addAttribute("modelId", result.modelId());
        model.addAttribute("width", result.width());
        model.addAttribute("height", result.height());
        model.addAttribute("tileSize", result.tileSize());
        model.addAttribute("tiles", result.tileCount());
        model.addAttribute("shortcutTiles", result.shortcutTileCount());
        model.addAttribute("elapsedMillis", result.elapsedMillis());
        model.addAttribute("classCounts", result.classCounts().stream()
                .map(c -> new ClassDetails(c.label(), c.pixels(), String.format("%.2f", c.percent())))
                .toList());
    }

    private String getSuggestionForError(SegmentationException e) {
        if (e instanceof InvalidConfigurationException && e.getMessage().contains("Band order")) {
            return "Set a band order with one band number per model input channel, e.g. 1,2,3.";
        } else if (e instanceof InvalidConfigurationException) {
            return "Check the processing parameters: tile size must be even, kernel sizes odd or 0.";
        } else if (e.getMessage().contains("raster")) {
            return "Upload a GeoTIFF, PNG or JPEG that can be opened by the server.";
        }
        return "Try different parameters or another image.";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public record ClassDetails(int label, long pixels, String percent) {}
}
