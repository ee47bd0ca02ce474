package com.docweaver.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Represents a generated file to be rendered.
 *
 * <p>A file either carries its text {@code content} or names a {@code source} file that is
 * copied byte for byte. Exactly one of the two is set.
 *
 * @param relativePath relative path for the file (e.g., "topics/getting-started.html")
 * @param content file content, or null for a copied file
 * @param source file to copy, or null for a text file
 * @param contentType content type or format
 */
public record GeneratedFile(
    String relativePath,
    String content,
    Path source,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        if ((content == null) == (source == null)) {
            throw new IllegalArgumentException("Exactly one of content and source must be set: " + relativePath);
        }
    }

    /**
     * Creates a text file.
     *
     * @param relativePath relative output path
     * @param content file content
     * @param contentType content type
     * @return generated file
     */
    public static GeneratedFile text(String relativePath, String content, String contentType) {
        return new GeneratedFile(relativePath, content, null, contentType);
    }

    /**
     * Creates a file copied from disk.
     *
     * @param relativePath relative output path
     * @param source file to copy
     * @return generated file
     */
    public static GeneratedFile copy(String relativePath, Path source) {
        return new GeneratedFile(relativePath, null, source, null);
    }

    /**
     * Returns whether the file is copied from a source file.
     *
     * @return true for a copied file
     */
    public boolean isCopy() {
        return source != null;
    }
}
