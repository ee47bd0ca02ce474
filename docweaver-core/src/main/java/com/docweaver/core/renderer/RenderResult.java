package com.docweaver.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of rendering a {@link GeneratedOutput}.
 *
 * @param written number of files written
 * @param failures relative paths of files that could not be written
 */
public record RenderResult(
    int written,
    List<String> failures
) {
    /**
     * Compact constructor with validation.
     */
    public RenderResult {
        Objects.requireNonNull(failures, "failures must not be null");
        failures = List.copyOf(failures);
    }

    /**
     * Returns whether every file was written.
     *
     * @return true if no file failed
     */
    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
