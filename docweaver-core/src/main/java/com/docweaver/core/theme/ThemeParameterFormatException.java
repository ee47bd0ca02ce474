package com.docweaver.core.theme;

/**
 * Thrown when a theme parameter value does not match the parameter's declared type.
 */
public class ThemeParameterFormatException extends RuntimeException {

    /**
     * Creates a format exception.
     *
     * @param message description of the mismatch
     */
    public ThemeParameterFormatException(String message) {
        super(message);
    }
}
