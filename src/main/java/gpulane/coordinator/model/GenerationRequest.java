package gpulane.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Incoming generation request after JSON decoding, before validation.
 *
 * @param model      requested model id
 * @param type       declared kind ({@code video|image}), may be null
 * @param mode       generation mode, null means the model's default
 * @param prompt     text prompt
 * @param parameters every other request field (steps, cfg_scale, images, ...)
 * @param arrival    when the request reached the scheduler
 */
public record GenerationRequest(
        String model,
        String type,
        String mode,
        String prompt,
        Map<String, Object> parameters,
        Instant arrival) {

    public GenerationRequest {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        Objects.requireNonNull(arrival, "arrival is required");
    }
}
