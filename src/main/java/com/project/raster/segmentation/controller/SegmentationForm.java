package com.project.raster.segmentation.controller;

import com.project.raster.segmentation.service.ProcessingConfig;
import com.project.raster.segmentation.service.SegmentationService;
import org.springframework.stereotype.Component;
import org.springframework.ui.Model;

import java.util.List;

/**
 * Attributes the {@code segment} view needs, whether it is shown fresh or after an error.
 */
@Component
public class SegmentationForm {

    static final List<String> SUPPORTED_FORMATS = List.of("GeoTIFF (.tif, .tiff)", "PNG", "JPEG", "BMP");

    private final SegmentationService segmentationService;

    public SegmentationForm(SegmentationService segmentationService) {
        this.segmentationService = segmentationService;
    }

    public void populate(Model model) {
        model.addAttribute("models", segmentationService.models());
        model.addAttribute("defaultBlurKernelSize", ProcessingConfig.DEFAULT_BLUR_KERNEL_SIZE);
        model.addAttribute("defaultMorphKernelSize", ProcessingConfig.DEFAULT_MORPH_KERNEL_SIZE);
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }
}
