package com.murmur.eventmodel;

import java.util.List;

/**
 * Result of validating an {@link EventEnvelope}.
 *
 * @param valid true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * @throws InvalidEventException when this result is a failure
     */
    public void orThrow(String eventId) {
        if (!valid) {
            throw new InvalidEventException(eventId, errors);
        }
    }
}
