package com.docweaver.core.context;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file copied unchanged into the generated site.
 *
 * @param source absolute path of the source file
 * @param targetPath path of the copy relative to the output directory, using {@code /}
 */
public record AssetReference(
    Path source,
    String targetPath
) {
    /**
     * Compact constructor with validation.
     */
    public AssetReference {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(targetPath, "targetPath must not be null");
    }
}
