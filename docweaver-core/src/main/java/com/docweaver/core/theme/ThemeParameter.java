package com.docweaver.core.theme;

import java.util.Objects;

/**
 * A parameter declared by a theme.
 *
 * <p>Instances created through {@link #define} always hold a default value that has been
 * validated against {@code type}; for Markdown parameters it is the transformed output.
 *
 * @param type data type of the parameter
 * @param description optional human-readable purpose
 * @param defaultValue validated default value, or null
 */
public record ThemeParameter(
    ThemeParameterType type,
    String description,
    Object defaultValue
) {
    /**
     * Compact constructor with validation.
     */
    public ThemeParameter {
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Defines a parameter, validating its raw default value.
     *
     * @param type declared type
     * @param description optional description
     * @param rawDefaultValue loosely typed default, possibly null
     * @param validator validator applied to the default
     * @return parameter holding the validated default
     * @throws ThemeParameterFormatException if the default does not match the type
     */
    public static ThemeParameter define(
        ThemeParameterType type,
        String description,
        Object rawDefaultValue,
        ParameterValidator validator
    ) {
        return new ThemeParameter(type, description, validator.validate(rawDefaultValue, type));
    }

    /**
     * Returns whether the parameter has a default value.
     *
     * @return true if a default is set
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }
}
