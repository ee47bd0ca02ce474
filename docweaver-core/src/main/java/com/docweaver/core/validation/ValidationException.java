package com.docweaver.core.validation;

import java.util.List;

/**
 * Thrown when a configuration or theme declaration fails validation.
 *
 * <p>Carries every detected violation, not just the first, so callers can report them
 * together.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    /**
     * Creates a validation exception without individual violations.
     *
     * @param message summary message
     */
    public ValidationException(String message) {
        this(message, List.of());
    }

    /**
     * Creates a validation exception.
     *
     * @param message summary message, typically naming the offending file
     * @param errors individual violations
     */
    public ValidationException(String message, List<String> errors) {
        super(message);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /**
     * Returns the individual violations.
     *
     * @return immutable list of violation messages, possibly empty
     */
    public List<String> getErrors() {
        return errors;
    }
}
