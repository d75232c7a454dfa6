package gpulane.coordinator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpulane.coordinator.model.GenerationKind;
import gpulane.coordinator.model.VideoGenerationConstraints;

import java.util.List;
import java.util.Map;

/**
 * One entry of the model catalog ({@code models.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelSpec(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("modes") List<String> modes,
        @JsonProperty("default_mode") String defaultMode,
        @JsonProperty("fixed_parameters") Map<String, Number> fixedParameters) {

    public GenerationKind kind() {
        return GenerationKind.fromWire(type);
    }

    /** Heavy models get a dedicated lane and go through degraded admission on fallback */
    public boolean isHeavy() {
        return kind() == GenerationKind.VIDEO;
    }

    public boolean supportsMode(String mode) {
        return modes != null && modes.contains(mode);
    }

    /**
     * Fixed parameter set of this model, or null when it has none.
     */
    public VideoGenerationConstraints constraints() {
        if (fixedParameters == null || !fixedParameters.containsKey("steps")) {
            return null;
        }
        Number cfg = fixedParameters.get("cfg_scale");
        return new VideoGenerationConstraints(id, fixedParameters.get("steps").intValue(),
                cfg == null ? null : cfg.doubleValue());
    }

    void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("model id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type is required for model " + id);
        }
        kind();
        if (modes == null || modes.isEmpty()) {
            throw new IllegalArgumentException("modes must not be empty for model " + id);
        }
    }
}
