package com.docweaver.core.theme;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Effective theme parameter values for one build.
 *
 * @param values parameter values by case-insensitive name, in name order: theme defaults
 *               overridden by valid user settings
 * @param warnings messages for user settings that were rejected
 */
public record ThemeSettings(
    Map<String, Object> values,
    List<String> warnings
) {
    /**
     * Compact constructor with defaults.
     */
    public ThemeSettings {
        Map<String, Object> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (values != null) {
            copy.putAll(values);
        }
        values = Collections.unmodifiableMap(copy);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
