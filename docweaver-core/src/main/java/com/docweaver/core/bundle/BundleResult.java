package com.docweaver.core.bundle;

import com.docweaver.core.renderer.GeneratedFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A bundle ready to be written.
 *
 * @param file the bundle file
 * @param failedSources source files that could not be read and were left out
 */
public record BundleResult(
    GeneratedFile file,
    List<Path> failedSources
) {
    /**
     * Compact constructor with validation.
     */
    public BundleResult {
        Objects.requireNonNull(file, "file must not be null");
        failedSources = failedSources == null ? List.of() : List.copyOf(failedSources);
    }
}
