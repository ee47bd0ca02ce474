package com.docweaver.cli;

import com.docweaver.core.config.ConfigLoader;
import com.docweaver.core.config.ProjectConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by the commands that work on a project configuration.
 */
public class ProjectOptions {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docweaver.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-t", "--theme"},
        description = "Theme to use (overrides config)"
    )
    String theme;

    @Option(
        names = {"--themes"},
        description = "Themes directory (overrides config)"
    )
    Path themesDirectory;

    /**
     * Loads the configuration and applies the command line overrides.
     *
     * @return effective configuration
     */
    ProjectConfig loadConfiguration() {
        ProjectConfig config = ConfigLoader.load(configPath);
        if (theme != null && !theme.isBlank()) {
            config = config.withTheme(theme);
        }
        if (themesDirectory != null) {
            config = config.withPaths(config.baseDirectory(), themesDirectory.toAbsolutePath().normalize().toString(),
                config.apiModel(), config.outputDirectory());
        }
        return config;
    }
}
