package com.docweaver.core.theme;

import java.net.URI;

/**
 * Informational metadata of a theme.
 *
 * <p>Not used by generation logic; exposed to templates and the {@code theme} command.
 *
 * @param format content format the theme renders, e.g. {@code html} or {@code md}
 * @param name display name
 * @param version theme version
 * @param description short description
 * @param author author name
 * @param license license identifier
 * @param homepage homepage or documentation URL
 */
public record ThemeMetadata(
    String format,
    String name,
    String version,
    String description,
    String author,
    String license,
    URI homepage
) {
    /**
     * Returns metadata with every field unset.
     *
     * @return empty metadata
     */
    public static ThemeMetadata empty() {
        return new ThemeMetadata(null, null, null, null, null, null, null);
    }
}
