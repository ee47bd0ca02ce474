package com.docweaver.core.theme;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A theme fully resolved through its inheritance chain.
 *
 * <p>Created once per build by {@link ThemeLoader}; immutable afterwards. All maps are
 * keyed case-insensitively.
 */
public final class Theme {

    private final String id;
    private final ThemeMetadata metadata;
    private final List<String> chain;
    private final SortedMap<String, ThemeParameter> parameters;
    private final SortedMap<String, Path> templates;
    private final SortedMap<String, List<Path>> scripts;
    private final SortedMap<String, List<Path>> styles;
    private final SortedMap<String, Path> assets;

    Theme(
        String id,
        ThemeMetadata metadata,
        List<String> chain,
        Map<String, ThemeParameter> parameters,
        Map<String, Path> templates,
        Map<String, List<Path>> scripts,
        Map<String, List<Path>> styles,
        Map<String, Path> assets
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.metadata = metadata != null ? metadata : ThemeMetadata.empty();
        this.chain = List.copyOf(chain);
        this.parameters = freeze(parameters);
        this.templates = freeze(templates);
        this.scripts = freeze(scripts);
        this.styles = freeze(styles);
        this.assets = freeze(assets);
    }

    private static <V> SortedMap<String, V> freeze(Map<String, V> source) {
        TreeMap<String, V> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(source);
        return Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Returns the identifier the theme was requested by.
     *
     * @return theme identifier, i.e. its directory name
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the metadata of the most-derived theme.
     *
     * @return theme metadata
     */
    public ThemeMetadata getMetadata() {
        return metadata;
    }

    /**
     * Returns the identifiers of the merged themes, most-derived first.
     *
     * @return inheritance chain, starting with {@link #getId()}
     */
    public List<String> getChain() {
        return chain;
    }

    /**
     * Returns the merged parameters.
     *
     * @return parameters by name
     */
    public SortedMap<String, ThemeParameter> getParameters() {
        return parameters;
    }

    /**
     * Returns the merged template files.
     *
     * @return template path by template name (file name without extension)
     */
    public SortedMap<String, Path> getTemplates() {
        return templates;
    }

    /**
     * Returns the merged script bundles.
     *
     * @return ordered source files by bundle target path
     */
    public SortedMap<String, List<Path>> getScripts() {
        return scripts;
    }

    /**
     * Returns the merged style bundles.
     *
     * @return ordered source files by bundle target path
     */
    public SortedMap<String, List<Path>> getStyles() {
        return styles;
    }

    /**
     * Returns the merged asset files.
     *
     * @return source file by path relative to the declaring theme's directory
     */
    public SortedMap<String, Path> getAssets() {
        return assets;
    }

    @Override
    public String toString() {
        return "Theme[" + id + ", chain=" + chain + "]";
    }
}
