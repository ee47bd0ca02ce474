package com.docweaver.core.theme;

import com.docweaver.core.util.FileTransferFilter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Declaration of a single theme, as read from its {@code theme.json}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * {
 *   "base": "classic",
 *   "metadata": { "name": "Dark", "version": "1.0.0" },
 *   "templates": ["templates/"],
 *   "scripts": { "source": ["scripts/"], "targetPath": "js/site.js" },
 *   "styles": { "source": ["styles/"], "targetPath": "css/site.css" },
 *   "assets": ["images/**"],
 *   "parameters": {
 *     "footer": { "type": "markdown", "defaultValue": "Built with **DocWeaver**" }
 *   }
 * }
 * }</pre>
 *
 * @param base identifier of the parent theme, or null for a standalone theme
 * @param metadata informational metadata
 * @param parameters declared parameters keyed case-insensitively
 * @param templates glob patterns for template files
 * @param scripts script sources and their bundle path
 * @param styles style sources and their bundle path
 * @param assets glob patterns for files copied as-is
 */
public record ThemeConfig(
    String base,
    ThemeMetadata metadata,
    Map<String, ThemeParameter> parameters,
    List<String> templates,
    FileTransferFilter scripts,
    FileTransferFilter styles,
    List<String> assets
) {
    /** Bundle path used when a declaration omits {@code scripts.targetPath}. */
    public static final String DEFAULT_SCRIPT_TARGET = "script.js";

    /** Bundle path used when a declaration omits {@code styles.targetPath}. */
    public static final String DEFAULT_STYLE_TARGET = "styles.css";

    /**
     * Compact constructor with defaults.
     */
    public ThemeConfig {
        if (base != null && base.isBlank()) {
            base = null;
        }
        if (metadata == null) {
            metadata = ThemeMetadata.empty();
        }
        TreeMap<String, ThemeParameter> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (parameters != null) {
            sorted.putAll(parameters);
        }
        parameters = Collections.unmodifiableMap(sorted);
        templates = templates == null ? List.of() : List.copyOf(templates);
        if (scripts == null) {
            scripts = new FileTransferFilter(List.of(), DEFAULT_SCRIPT_TARGET);
        }
        if (styles == null) {
            styles = new FileTransferFilter(List.of(), DEFAULT_STYLE_TARGET);
        }
        assets = assets == null ? List.of() : List.copyOf(assets);
    }
}
