package org.codenode.fbp.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating a model element.
 *
 * @param success {@code true} if no problems were found.
 * @param errors  human-readable descriptions of every problem found, empty on success.
 */
public record ValidationResult(boolean success, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }

    public String errorMessage() {
        return String.join("; ", errors);
    }

    /**
     * Combines this result with another one, keeping the errors of both.
     */
    public ValidationResult and(ValidationResult other) {
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return of(merged);
    }

    /**
     * Converts a failed result into a {@link FlowConfigurationException}.
     *
     * @param subject what was validated, used as the message prefix.
     * @throws FlowConfigurationException if this result is not successful.
     */
    public void orThrow(String subject) {
        if (!success) {
            throw new FlowConfigurationException(subject + " is invalid: " + errorMessage(), errors);
        }
    }
}
