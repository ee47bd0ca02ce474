package com.docweaver.core.config;

import com.docweaver.core.topic.TopicHierarchy;
import com.docweaver.core.util.FileTransferFilter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for DocWeaver projects.
 *
 * <p>Loaded from {@code docweaver.yaml}. Relative paths are resolved by
 * {@link ConfigLoader}: the base directory against the directory of the configuration
 * file, everything else against the base directory.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * baseUrl: "https://docs.example.com/"
 * convention: dotnet
 * theme: classic
 * themeSettings:
 *   pageFooter: "**Copyright** Example Ltd."
 * apiModel: build/api-model.json
 * topics:
 *   - "docs/**"
 *   - "!docs/drafts/**"
 * topicOrder:
 *   - docs/getting-started.md
 * topicHierarchy: directory
 * assets:
 *   - source: ["images/*.png"]
 *     targetPath: images
 * outputDirectory: site
 * }</pre>
 *
 * @param baseDirectory directory topic, asset and model paths are relative to
 * @param baseUrl absolute root URL of the published site, or null for a relocatable site
 * @param convention documentation convention, defaults to {@link DocConvention#DOTNET}
 * @param theme theme identifier, defaults to {@code classic}
 * @param themeSettings values for the theme's parameters
 * @param themesDirectory root directory of the themes, containing one directory per format
 * @param apiModel path of the API model JSON file, or null
 * @param topics glob patterns of topic files, defaults to {@code *.md}
 * @param topicOrder relative paths of topics to list first
 * @param topicHierarchy strategy deriving subtopics from file layout
 * @param assets additional files copied to the output
 * @param outputDirectory directory the site is written to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("baseDirectory") String baseDirectory,
    @JsonProperty("baseUrl") String baseUrl,
    @JsonProperty("convention") DocConvention convention,
    @JsonProperty("theme") String theme,
    @JsonProperty("themeSettings") Map<String, Object> themeSettings,
    @JsonProperty("themesDirectory") String themesDirectory,
    @JsonProperty("apiModel") String apiModel,
    @JsonProperty("topics") List<String> topics,
    @JsonProperty("topicOrder") List<String> topicOrder,
    @JsonProperty("topicHierarchy") TopicHierarchy topicHierarchy,
    @JsonProperty("assets") List<FileTransferFilter> assets,
    @JsonProperty("outputDirectory") String outputDirectory
) {
    /** Theme used when none is configured. */
    public static final String DEFAULT_THEME = "classic";

    /** Themes directory used when none is configured. */
    public static final String DEFAULT_THEMES_DIRECTORY = "themes";

    /**
     * Compact constructor applying defaults.
     */
    public ProjectConfig {
        if (convention == null) {
            convention = DocConvention.DOTNET;
        }
        if (theme == null) {
            theme = DEFAULT_THEME;
        }
        themeSettings = themeSettings == null ? Map.of() : new LinkedHashMap<>(themeSettings);
        if (themesDirectory == null || themesDirectory.isBlank()) {
            themesDirectory = DEFAULT_THEMES_DIRECTORY;
        }
        if (apiModel != null && apiModel.isBlank()) {
            apiModel = null;
        }
        topics = topics == null ? List.of("*.md") : List.copyOf(topics);
        topicOrder = topicOrder == null ? List.of() : List.copyOf(topicOrder);
        if (topicHierarchy == null) {
            topicHierarchy = TopicHierarchy.NONE;
        }
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    /**
     * Returns the base directory as a path.
     *
     * @return base directory, or the current directory when unset
     */
    @JsonIgnore
    public Path baseDirectoryPath() {
        return baseDirectory == null || baseDirectory.isBlank() ? Path.of("") : Path.of(baseDirectory);
    }

    /**
     * Returns the base URL as a URI.
     *
     * @return base URL, or null when unset or malformed
     */
    @JsonIgnore
    public URI baseUri() {
        if (baseUrl == null || baseUrl.isBlank()) {
            return null;
        }
        try {
            return new URI(baseUrl);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Returns a copy with the given paths.
     *
     * @param baseDirectory resolved base directory
     * @param themesDirectory resolved themes directory
     * @param apiModel resolved API model path, or null
     * @param outputDirectory resolved output directory
     * @return updated configuration
     */
    public ProjectConfig withPaths(String baseDirectory, String themesDirectory, String apiModel, String outputDirectory) {
        return new ProjectConfig(baseDirectory, baseUrl, convention, theme, themeSettings, themesDirectory,
            apiModel, topics, topicOrder, topicHierarchy, assets, outputDirectory);
    }

    /**
     * Returns a copy using another theme.
     *
     * @param themeName theme identifier
     * @return updated configuration
     */
    public ProjectConfig withTheme(String themeName) {
        return new ProjectConfig(baseDirectory, baseUrl, convention, themeName, themeSettings, themesDirectory,
            apiModel, topics, topicOrder, topicHierarchy, assets, outputDirectory);
    }

    /**
     * Checks the configuration for errors that prevent a build.
     *
     * @return validation errors as {@code key: message}, empty if valid
     */
    public List<String> getValidationErrors() {
        List<String> errors = new ArrayList<>();
        if (!Files.isDirectory(baseDirectoryPath())) {
            errors.add("baseDirectory: Directory '" + baseDirectory + "' does not exist.");
        }

        if (baseUrl != null && !baseUrl.isBlank()) {
            URI uri = baseUri();
            if (uri == null || !uri.isAbsolute()) {
                errors.add("baseUrl: The base URL must be an absolute URI.");
            }
        }

        if (apiModel == null && topics.isEmpty()) {
            errors.add("apiModel: The API model is required when no filter for topics is specified.");
        }

        for (int i = 0; i < assets.size(); i++) {
            if (assets.get(i).source().isEmpty()) {
                errors.add("assets[" + i + "].source: At least one glob pattern is required.");
            }
        }

        if (outputDirectory == null || outputDirectory.isBlank()) {
            errors.add("outputDirectory: The output directory is required.");
        }
        if (theme.isBlank()) {
            errors.add("theme: The theme is required.");
        }
        return errors;
    }
}
