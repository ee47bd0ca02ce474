package com.docweaver.cli;

import com.docweaver.core.theme.ThemeNotFoundException;
import com.docweaver.core.validation.ValidationException;
import org.slf4j.Logger;

/**
 * Process exit codes and the mapping of failures onto them.
 */
public final class ExitCodes {

    /** Run completed. */
    public static final int OK = 0;

    /** Run completed, but some files could not be produced. */
    public static final int GENERATION_ERRORS = 1;

    /** Invalid command line. Matches picocli's usage exit code. */
    public static final int USAGE = 2;

    /** Invalid configuration or theme. */
    public static final int VALIDATION = 3;

    /** Unexpected failure. */
    public static final int FAILURE = 4;

    private ExitCodes() {
        // Utility class
    }

    /**
     * Reports a failed command and returns its exit code.
     *
     * @param action description of what failed, e.g. "Build"
     * @param e the failure
     * @param log logger of the failing command
     * @return {@link #VALIDATION} for configuration and theme errors, {@link #FAILURE} otherwise
     */
    public static int report(String action, RuntimeException e, Logger log) {
        if (e instanceof ValidationException validation) {
            log.debug("{} failed validation", action, e);
            System.err.println("✗ " + action + " failed: " + e.getMessage());
            validation.getErrors().forEach(error -> System.err.println("    - " + error));
            return VALIDATION;
        }
        if (e instanceof ThemeNotFoundException) {
            log.debug("{} failed: theme not found", action, e);
            System.err.println("✗ " + action + " failed: " + e.getMessage());
            return VALIDATION;
        }

        log.error("{} failed", action, e);
        System.err.println("✗ " + action + " failed: " + e.getMessage());
        return FAILURE;
    }
}
