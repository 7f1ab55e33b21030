package com.project.raster.segmentation;

import com.project.raster.segmentation.cli.SegmentationCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bootstraps the application. With a {@code segment} or {@code models} command it runs once
 * without the web server and exits with the command's status; otherwise it serves the web UI.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Application.class);
        if (SegmentationCommandRunner.isCommand(args)) {
            app.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(app.run(args)));
        }
        app.run(args);
    }
}
