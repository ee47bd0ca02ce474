package com.docweaver.core.theme;

import java.nio.file.Path;

/**
 * Thrown when a theme directory or its {@code theme.json} declaration does not exist.
 */
public class ThemeNotFoundException extends RuntimeException {

    private final Path path;

    /**
     * Creates the exception.
     *
     * @param message description of what is missing
     * @param path the missing directory or file
     */
    public ThemeNotFoundException(String message, Path path) {
        super(message);
        this.path = path;
    }

    /**
     * Returns the missing path.
     *
     * @return missing directory or file
     */
    public Path getPath() {
        return path;
    }
}
