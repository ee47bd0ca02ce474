package com.docweaver.core.theme;

import com.docweaver.core.markdown.TextTransformer;

import java.util.Objects;

/**
 * Validates theme parameter values and prepares Markdown values for rendering.
 *
 * <p>The shape check is delegated to {@link ThemeParameterType#validate(Object)}. A valid
 * {@link ThemeParameterType#MARKDOWN} string is additionally passed through the text
 * transformer, so the returned value is the transformed output.
 */
public class ParameterValidator {

    private final TextTransformer markdownTransformer;

    /**
     * Creates a validator.
     *
     * @param markdownTransformer transformer applied to Markdown values
     */
    public ParameterValidator(TextTransformer markdownTransformer) {
        this.markdownTransformer = Objects.requireNonNull(markdownTransformer, "markdownTransformer must not be null");
    }

    /**
     * Validates a raw value against a declared type.
     *
     * @param rawValue loosely typed value, possibly null
     * @param declaredType declared parameter type
     * @return validated (and for Markdown, transformed) value
     * @throws ThemeParameterFormatException if the value does not match the type
     */
    public Object validate(Object rawValue, ThemeParameterType declaredType) {
        Objects.requireNonNull(declaredType, "declaredType must not be null");
        Object value = declaredType.validate(rawValue);
        if (declaredType == ThemeParameterType.MARKDOWN && value instanceof String markdown) {
            return markdownTransformer.transform(markdown);
        }
        return value;
    }
}
