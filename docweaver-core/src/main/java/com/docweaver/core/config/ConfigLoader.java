package com.docweaver.core.config;

import com.docweaver.core.validation.ValidationException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Utility for loading DocWeaver configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code docweaver.yaml} into a {@link ProjectConfig} record,
 * resolves its relative paths and validates it. Unlike theme settings, configuration
 * problems are fatal: every violation is collected into one {@link ValidationException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Path.of("docweaver.yaml"));
 * Path output = Path.of(config.outputDirectory());
 * }</pre>
 */
public final class ConfigLoader {

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "docweaver.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = JsonMapper.builder(new YAMLFactory())
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads and validates configuration from a YAML file.
     *
     * @param configPath path to {@code docweaver.yaml}
     * @return configuration with absolute, normalized paths
     * @throws ValidationException if the file is missing, cannot be parsed or is invalid
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ValidationException("Configuration file not found: " + configPath);
        }

        ProjectConfig config;
        try {
            log.debug("Loading configuration from: {}", configPath);
            config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
        } catch (IOException e) {
            throw new ValidationException("Configuration file could not be parsed: " + configPath,
                List.of(String.valueOf(e.getMessage())));
        }
        if (config == null) {
            throw new ValidationException("Configuration file is empty: " + configPath);
        }

        ProjectConfig resolved = resolvePaths(config, configPath.toAbsolutePath().normalize().getParent());
        List<String> errors = resolved.getValidationErrors();
        if (!errors.isEmpty()) {
            throw new ValidationException("Configuration file is invalid: " + configPath, errors);
        }

        log.info("Loaded configuration from: {}", configPath);
        return resolved;
    }

    /**
     * Resolves the relative paths of a configuration.
     *
     * <p>An unset base directory becomes {@code configDirectory}; a relative one is
     * resolved against it. The themes directory, API model and output directory are
     * resolved against the base directory.
     *
     * @param config configuration as read
     * @param configDirectory directory containing the configuration file
     * @return configuration with absolute paths
     */
    public static ProjectConfig resolvePaths(ProjectConfig config, Path configDirectory) {
        Path base = config.baseDirectory() == null || config.baseDirectory().isBlank()
            ? configDirectory
            : configDirectory.resolve(config.baseDirectory());
        base = base.toAbsolutePath().normalize();

        return config.withPaths(
            base.toString(),
            resolve(base, config.themesDirectory()),
            resolve(base, config.apiModel()),
            resolve(base, config.outputDirectory())
        );
    }

    private static String resolve(Path base, String path) {
        if (path == null || path.isBlank()) {
            return path;
        }
        return base.resolve(path).normalize().toString();
    }
}
