package com.project.raster.segmentation.exceptions;

import com.project.raster.segmentation.controller.SegmentationForm;
import com.project.raster.segmentation.service.SegmentationService;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Turns failures outside the segmentation call itself (upload storage, request validation,
 * unexpected errors) into the form view with an error message.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final SegmentationService segmentationService;
    private final SegmentationForm segmentationForm;

    public GlobalExceptionHandler(SegmentationService segmentationService, SegmentationForm segmentationForm) {
        this.segmentationService = segmentationService;
        this.segmentationForm = segmentationForm;
    }

    @ExceptionHandler(StorageException.class)
    public String handleStorage(StorageException ex, Model model) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return form(model, ex.getMessage(), "Upload a GeoTIFF, PNG, JPEG or BMP raster.");
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public String handleConfiguration(InvalidConfigurationException ex, Model model) {
        log.warn("Invalid configuration: {}", ex.getMessage());
        return form(model, ex.getMessage(), "Check the selected model and the processing parameters.");
    }

    @ExceptionHandler(SegmentationException.class)
    public String handleProcessing(SegmentationException ex, Model model) {
        log.error("Segmentation failed", ex);
        return form(model, ex.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return form(model, "File is too large for this server's upload limit.", null);
    }

    @ExceptionHandler({ConstraintViolationException.class, IllegalArgumentException.class})
    public String handleInvalidRequest(RuntimeException ex, Model model) {
        log.warn("Invalid request: {}", ex.getMessage());
        return form(model, "Invalid parameters: " + ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        model.addAttribute("models", segmentationService.models());
        model.addAttribute("error", "An unexpected error occurred. Please try again or contact the administrator.");
        return "index";
    }

    private String form(Model model, String error, String suggestion) {
        segmentationForm.populate(model);
        model.addAttribute("error", error);
        if (suggestion != null) {
            model.addAttribute("suggestion", suggestion);
        }
        return "segment";
    }
}
