package com.project.raster.segmentation.controller;

import com.project.raster.segmentation.service.SegmentationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the home page with the model catalogue.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final SegmentationService segmentationService;

    public HomeController(SegmentationService segmentationService) {
        this.segmentationService = segmentationService;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("models", segmentationService.models());
        return "index"; // templates/index.html
    }
}
