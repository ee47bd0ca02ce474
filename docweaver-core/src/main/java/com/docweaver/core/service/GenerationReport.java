package com.docweaver.core.service;

import java.util.List;

/**
 * Summary of a generation run.
 *
 * @param pages number of pages produced
 * @param bundles number of script and style bundles produced
 * @param assets number of assets copied
 * @param warnings recoverable problems, such as rejected theme settings
 * @param errors files that could not be produced or written
 */
public record GenerationReport(
    int pages,
    int bundles,
    int assets,
    List<String> warnings,
    List<String> errors
) {
    /**
     * Compact constructor with defaults.
     */
    public GenerationReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Returns whether any file failed.
     *
     * @return true if at least one error was recorded
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
