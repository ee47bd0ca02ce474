package com.docweaver.core.theme;

import com.docweaver.core.config.DocConvention;
import com.docweaver.core.util.FileGlobFilter;
import com.docweaver.core.util.FileTransferFilter;
import com.docweaver.core.util.FileUtils;
import com.docweaver.core.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves a theme by walking its inheritance chain.
 *
 * <p>Starting at the requested theme, each link is loaded from
 * {@code <themesDirectory>/<name>/theme.json} and merged into an accumulator, then the
 * declared {@code base} is followed. Merging happens most-derived first, one pass per
 * link:
 *
 * <ul>
 *   <li><b>Metadata</b> - only the requested theme's metadata is kept</li>
 *   <li><b>Parameters</b> - by name, case-insensitive, first definition wins</li>
 *   <li><b>Templates</b> - by file name without extension, case-insensitive, first wins</li>
 *   <li><b>Scripts/styles</b> - by target path, files accumulate (see {@link BundleResolver})</li>
 *   <li><b>Assets</b> - by path relative to the theme directory, case-insensitive, first wins</li>
 * </ul>
 *
 * <p>The walk stops when a theme has no base or names a theme already merged. Such a
 * cycle is absorbed rather than rejected; it is logged as a warning.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ThemeLoader loader = ThemeLoader.forConvention(Path.of("themes"), DocConvention.DOTNET, validator);
 * Theme theme = loader.load("classic");
 * theme.getScripts().forEach((target, files) -> System.out.println(target + " <- " + files));
 * }</pre>
 */
public class ThemeLoader {

    /** Name of the declaration file inside each theme directory. */
    public static final String DECLARATION_FILE = "theme.json";

    private static final Logger log = LoggerFactory.getLogger(ThemeLoader.class);

    private static final String TEMPLATE_EXTENSION = "hbs";
    private static final String SCRIPT_EXTENSION = "js";
    private static final String STYLE_EXTENSION = "css";

    private final Path themesDirectory;
    private final ThemeConfigReader configReader;

    /**
     * Creates a loader for the themes in a directory.
     *
     * @param themesDirectory directory containing one subdirectory per theme
     * @param configReader reader for theme declarations
     */
    public ThemeLoader(Path themesDirectory, ThemeConfigReader configReader) {
        this.themesDirectory = Objects.requireNonNull(themesDirectory, "themesDirectory must not be null");
        this.configReader = Objects.requireNonNull(configReader, "configReader must not be null");
    }

    /**
     * Creates a loader for the themes of a documentation convention.
     *
     * @param themesRoot root themes directory, containing one directory per format
     * @param convention convention selecting the format directory
     * @param validator validator for parameter defaults
     * @return loader for {@code <themesRoot>/<format>}
     */
    public static ThemeLoader forConvention(Path themesRoot, DocConvention convention, ParameterValidator validator) {
        return new ThemeLoader(themesRoot.resolve(convention.themeFormat()), new ThemeConfigReader(validator));
    }

    /**
     * Returns the directory themes are resolved in.
     *
     * @return themes directory
     */
    public Path getThemesDirectory() {
        return themesDirectory;
    }

    /**
     * Loads and resolves a theme.
     *
     * <p>A theme name that is an absolute path addresses a theme directory outside the
     * themes directory.
     *
     * @param themeName identifier of the theme
     * @return resolved theme
     * @throws ThemeNotFoundException if a theme directory or declaration is missing
     * @throws ValidationException if a declaration is invalid
     * @throws IllegalStateException if a theme directory cannot be traversed
     */
    public Theme load(String themeName) {
        if (themeName == null || themeName.isBlank()) {
            throw new IllegalArgumentException("themeName must not be blank");
        }

        log.info("Loading theme '{}' from {}", themeName, themesDirectory);
        Composition composition = new Composition();
        Set<String> visited = new LinkedHashSet<>();
        ThemeMetadata metadata = null;

        String current = themeName;
        while (current != null && visited.add(current)) {
            Path directory = resolveDirectory(current);
            ThemeConfig config = configReader.read(directory.resolve(DECLARATION_FILE));

            if (metadata == null) {
                metadata = config.metadata();
            }
            composition.merge(config, directory);
            log.debug("Merged theme '{}' ({} parameters, {} templates, {} script bundles, {} style bundles, {} assets)",
                current, composition.parameters.size(), composition.templates.size(),
                composition.scripts.size(), composition.styles.size(), composition.assets.size());

            current = config.base();
        }

        if (current != null) {
            log.warn("Theme '{}' has a cyclic inheritance chain {} -> {}; ignoring the repeated base",
                themeName, visited, current);
        }

        Theme theme = new Theme(
            themeName,
            metadata,
            new ArrayList<>(visited),
            composition.parameters,
            composition.templates,
            composition.scripts.toMap(),
            composition.styles.toMap(),
            composition.assets
        );
        log.info("Loaded theme '{}' (chain: {})", themeName, String.join(" -> ", theme.getChain()));
        return theme;
    }

    private Path resolveDirectory(String themeName) {
        Path directory = themesDirectory.resolve(themeName).toAbsolutePath().normalize();
        if (!Files.isDirectory(directory)) {
            throw new ThemeNotFoundException("Theme '" + themeName + "' could not be found: " + directory, directory);
        }
        return directory;
    }

    /**
     * Mutable accumulator for one chain resolution. Discarded if any link fails.
     */
    private static final class Composition {

        private final Map<String, ThemeParameter> parameters = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, Path> templates = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, Path> assets = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final BundleResolver scripts = new BundleResolver();
        private final BundleResolver styles = new BundleResolver();

        void merge(ThemeConfig config, Path directory) {
            mergeBundle(scripts, config.scripts(), directory, SCRIPT_EXTENSION);
            mergeBundle(styles, config.styles(), directory, STYLE_EXTENSION);

            for (Path template : find(new FileGlobFilter(config.templates()), directory, TEMPLATE_EXTENSION)) {
                templates.putIfAbsent(FileUtils.getBaseName(template), template);
            }

            for (Path asset : find(new FileGlobFilter(config.assets()), directory, null)) {
                assets.putIfAbsent(FileUtils.toUnixPath(directory.relativize(asset)), asset);
            }

            config.parameters().forEach(parameters::putIfAbsent);
        }

        private static void mergeBundle(BundleResolver resolver, FileTransferFilter filter, Path directory, String extension) {
            resolver.merge(filter.targetPath(), find(filter.sourceFilter(), directory, extension));
        }

        private static List<Path> find(FileGlobFilter filter, Path directory, String extension) {
            try {
                return filter.findMatchingFiles(directory, extension);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to enumerate theme files in " + directory + " for " + filter, e);
            }
        }
    }
}
