package com.docweaver.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * @param outputDirectory directory the site is generated into
 * @param settings renderer-specific settings, e.g. {@code console.colors}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Gets a boolean setting.
     *
     * @param key setting key
     * @param defaultValue value used when the setting is absent
     * @return true if the setting is {@code "true"}, ignoring case
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
