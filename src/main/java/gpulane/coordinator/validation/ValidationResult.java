package gpulane.coordinator.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of request validation. A valid result carries the normalised
 * parameters; a failure names the violated field with expected and actual values.
 */
public record ValidationResult(
        boolean valid,
        String field,
        String expected,
        String actual,
        String message,
        String mode,
        Map<String, Object> normalizedParameters) {

    public static ValidationResult ok(String mode, Map<String, Object> normalizedParameters) {
        return new ValidationResult(true, null, null, null, null, mode,
                Collections.unmodifiableMap(new LinkedHashMap<>(normalizedParameters)));
    }

    public static ValidationResult failure(String field, Object expected, Object actual, String message) {
        return new ValidationResult(false, field,
                expected == null ? null : String.valueOf(expected),
                actual == null ? null : String.valueOf(actual),
                message, null, Map.of());
    }
}
