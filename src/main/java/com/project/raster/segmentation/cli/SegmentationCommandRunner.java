package com.project.raster.segmentation.cli;

import com.project.raster.segmentation.DTOs.ModelSummary;
import com.project.raster.segmentation.DTOs.SegmentationRequest;
import com.project.raster.segmentation.DTOs.SegmentationResult;
import com.project.raster.segmentation.exceptions.InvalidConfigurationException;
import com.project.raster.segmentation.exceptions.SegmentationException;
import com.project.raster.segmentation.exceptions.StorageException;
import com.project.raster.segmentation.model.ModelCache;
import com.project.raster.segmentation.model.ModelConfig;
import com.project.raster.segmentation.model.ModelRegistry;
import com.project.raster.segmentation.service.SegmentationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command line surface:
 * <pre>
 * segment --model=NAME --input=PATH --output=PATH [--revision=R] [--tile-size=N] [--batch-size=N]
 *         [--blur-kernel-size=N] [--morph-kernel-size=N] [--band-order=1,2,3]
 * models
 * revisions --model=NAME
 * clean
 * </pre>
 * Without a command the application starts the web server instead.
 */
@Component
public class SegmentationCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(SegmentationCommandRunner.class);

    static final String SEGMENT = "segment";
    static final String MODELS = "models";
    static final String REVISIONS = "revisions";
    static final String CLEAN = "clean";
    private static final Set<String> COMMANDS = Set.of(SEGMENT, MODELS, REVISIONS, CLEAN);

    private final SegmentationService segmentationService;
    private final ModelRegistry modelRegistry;
    private final ModelCache modelCache;
    private PrintStream out = System.out;
    private int exitCode;

    public SegmentationCommandRunner(SegmentationService segmentationService, ModelRegistry modelRegistry,
                                     ModelCache modelCache) {
        this.segmentationService = segmentationService;
        this.modelRegistry = modelRegistry;
        this.modelCache = modelCache;
    }

    public static boolean isCommand(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return COMMANDS.contains(arg);
            }
        }
        return false;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty() || !COMMANDS.contains(commands.get(0))) {
            return;
        }
        try {
            String command = commands.get(0);
            if (SEGMENT.equals(command)) {
                segment(args);
            } else if (REVISIONS.equals(command)) {
                listRevisions(required(args, "model"));
            } else if (CLEAN.equals(command)) {
                clean();
            } else {
                listModels();
            }
            exitCode = 0;
        } catch (InvalidConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            exitCode = 2;
        } catch (SegmentationException | StorageException e) {
            log.error("Segmentation failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void segment(ApplicationArguments args) {
        SegmentationRequest request = new SegmentationRequest(
                required(args, "model"),
                optional(args, "revision"),
                integer(args, "tile-size"),
                integer(args, "batch-size"),
                integer(args, "blur-kernel-size"),
                integer(args, "morph-kernel-size"),
                SegmentationRequest.parseBandOrder(optional(args, "band-order")));
        Path input = Path.of(required(args, "input"));
        Path output = Path.of(required(args, "output"));

        SegmentationResult result = segmentationService.segment(input, output, request);
        out.printf("Wrote %s (%dx%d) with %s: %d tiles, %d skipped, %d ms%n", result.output(), result.width(),
                result.height(), result.modelId(), result.tileCount(), result.shortcutTileCount(), result.elapsedMillis());
        for (SegmentationResult.ClassCount count : result.classCounts()) {
            out.printf("  class %3d: %12d px (%6.2f%%)%n", count.label(), count.pixels(), count.percent());
        }
    }

    private void listModels() {
        List<ModelSummary> models = segmentationService.models();
        if (models.isEmpty()) {
            out.println("No models configured (app.models)");
            return;
        }
        for (ModelSummary model : models) {
            out.printf("%-24s %-10s %d band(s) -> %d class(es)  %s%n", model.name(), model.revision(),
                    model.inputChannels(), model.numClasses(), model.description());
        }
    }

    private void listRevisions(String name) {
        List<ModelConfig> revisions = modelRegistry.revisions(name);
        out.printf("Revisions of %s:%n", name);
        for (int i = 0; i < revisions.size(); i++) {
            ModelConfig config = revisions.get(i);
            String description = config.description() == null ? "" : config.description();
            out.printf("%-10s %-6s %-9s %s%n", config.revision(), i == 0 ? "latest" : "",
                    modelCache.status(config).name().toLowerCase(Locale.ROOT), description);
        }
    }

    private void clean() {
        long freed = modelCache.clean();
        if (freed == 0) {
            out.println("Model cache is already empty");
        } else {
            out.printf("Cleared model cache at %s, freed %d KB%n", modelCache.cacheDir(), freed / 1024);
        }
    }

    private static String required(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("Missing required option --" + name);
        }
        return value;
    }

    private static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static Integer integer(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Option --" + name + " expects an integer, got '" + value + "'", e);
        }
    }
}
