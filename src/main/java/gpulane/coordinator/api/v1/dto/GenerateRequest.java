package gpulane.coordinator.api.v1.dto;

import gpulane.coordinator.model.GenerationRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Decodes the flat {@code POST /generate} body. The named fields are lifted out;
 * everything else (steps, cfg_scale, images, frames, ...) goes to the parameters
 * map untouched for the validator.
 */
public final class GenerateRequest {

    private static final Set<String> TOP_LEVEL = Set.of("model", "type", "mode", "prompt");

    private GenerateRequest() {
    }

    public static GenerationRequest parse(Map<String, Object> body, Instant arrival) {
        if (body == null) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        body.forEach((key, value) -> {
            if (!TOP_LEVEL.contains(key)) {
                parameters.put(key, value);
            }
        });
        return new GenerationRequest(
                string(body, "model"),
                string(body, "type"),
                string(body, "mode"),
                string(body, "prompt"),
                parameters,
                arrival);
    }

    private static String string(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return s;
    }
}
