package gpulane.coordinator.validation;

import gpulane.coordinator.config.ModelCatalog;
import gpulane.coordinator.config.ModelSpec;
import gpulane.coordinator.model.GenerationRequest;
import gpulane.coordinator.model.VideoGenerationConstraints;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checks requests against the model catalog. Pure: touches no lane or queue
 * state, so a rejected request leaves every counter as it was.
 *
 * <p>
 * Fixed parameters are compared for exact equality. A missing fixed parameter is
 * filled in with the required value; {@code cfg} (and {@code guidance_scale} for
 * models with a fixed CFG) is read as {@code cfg_scale} when the latter is absent.
 */
public class ConstraintValidator {

    public static final int MAX_PROMPT_LENGTH = 2000;

    private final ModelCatalog catalog;

    public ConstraintValidator(ModelCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Full request validation: model, type, mode, prompt, mode inputs, then fixed parameters.
     */
    public ValidationResult validate(GenerationRequest request) {
        Optional<ModelSpec> found = catalog.find(request.model());
        if (found.isEmpty()) {
            return unknownModel(request.model());
        }
        ModelSpec spec = found.get();

        if (request.type() != null && !request.type().equals(spec.type())) {
            return ValidationResult.failure("type", spec.type(), request.type(),
                    "Model '" + spec.id() + "' requires type='" + spec.type() + "'.");
        }

        String mode = request.mode() != null ? request.mode() : spec.defaultMode();
        if (!spec.supportsMode(mode)) {
            return ValidationResult.failure("mode", spec.modes(), mode,
                    "Invalid mode '" + mode + "' for model '" + spec.id() + "'. Valid: " + spec.modes() + ".");
        }

        String prompt = request.prompt();
        if (prompt == null || prompt.isBlank()) {
            return ValidationResult.failure("prompt", "non-empty text", prompt, "prompt must not be empty.");
        }
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            return ValidationResult.failure("prompt", "at most " + MAX_PROMPT_LENGTH + " characters",
                    prompt.length() + " characters", "prompt is too long.");
        }

        ValidationResult inputs = checkModeInputs(mode, request.parameters());
        if (inputs != null) {
            return inputs;
        }

        ValidationResult fixed = validate(spec.id(), request.parameters());
        if (!fixed.valid()) {
            return fixed;
        }
        return ValidationResult.ok(mode, fixed.normalizedParameters());
    }

    /**
     * Fixed-parameter check only.
     */
    public ValidationResult validate(String model, Map<String, Object> parameters) {
        Optional<ModelSpec> found = catalog.find(model);
        if (found.isEmpty()) {
            return unknownModel(model);
        }
        ModelSpec spec = found.get();
        VideoGenerationConstraints constraints = spec.constraints();

        Map<String, Object> normalized = new LinkedHashMap<>(parameters != null ? parameters : Map.of());
        // an explicit null cfg_scale counts as unset
        if (normalized.get("cfg_scale") == null && normalized.get("cfg") != null) {
            normalized.put("cfg_scale", normalized.get("cfg"));
        }
        if (constraints != null && constraints.hasFixedCfg()
                && normalized.get("cfg_scale") == null && normalized.get("guidance_scale") != null) {
            normalized.put("cfg_scale", normalized.get("guidance_scale"));
        }

        if (constraints == null) {
            return ValidationResult.ok(spec.defaultMode(), normalized);
        }

        Object steps = normalized.get("steps");
        if (steps == null) {
            normalized.put("steps", constraints.fixedSteps());
        } else if (!(steps instanceof Number n) || !matches(n, constraints.fixedSteps())) {
            return ValidationResult.failure("steps", constraints.fixedSteps(), steps,
                    "For " + model + ", steps must be exactly " + constraints.fixedSteps() + " (got " + steps + ").");
        }

        if (constraints.hasFixedCfg()) {
            Object cfg = normalized.get("cfg_scale");
            if (cfg == null) {
                normalized.put("cfg_scale", constraints.fixedCfg());
            } else if (!(cfg instanceof Number n) || !matches(n, constraints.fixedCfg())) {
                return ValidationResult.failure("cfg_scale", constraints.fixedCfg(), cfg,
                        "For " + model + ", cfg_scale must be exactly " + constraints.fixedCfg() + " (got " + cfg + ").");
            }
        }

        return ValidationResult.ok(spec.defaultMode(), normalized);
    }

    private ValidationResult checkModeInputs(String mode, Map<String, Object> parameters) {
        switch (mode) {
            case "i2v", "img2img" -> {
                if (isBlank(parameters.get("reference_image"))) {
                    return ValidationResult.failure("reference_image", "image data", null,
                            "reference_image is required for " + mode + " mode.");
                }
            }
            case "first_last_frame" -> {
                if (isBlank(parameters.get("first_frame_image")) || isBlank(parameters.get("last_frame_image"))) {
                    return ValidationResult.failure("first_frame_image", "image data", null,
                            "first_frame_image and last_frame_image are required for first_last_frame mode.");
                }
            }
            case "arbitrary_frame" -> {
                Object frames = parameters.get("arbitrary_frames");
                if (!(frames instanceof Collection<?> list) || list.isEmpty()) {
                    return ValidationResult.failure("arbitrary_frames", "non-empty list", frames,
                            "arbitrary_frames must not be empty for arbitrary_frame mode.");
                }
            }
            default -> {
                // t2v and txt2img need no image inputs
            }
        }
        return null;
    }

    private ValidationResult unknownModel(String model) {
        return ValidationResult.failure("model", catalog.all().stream().map(ModelSpec::id).toList(), model,
                "Unknown model '" + model + "'.");
    }

    private static boolean matches(Number actual, double expected) {
        if (!Double.isFinite(actual.doubleValue())) {
            return false;
        }
        BigDecimal value = new BigDecimal(actual.toString());
        return value.compareTo(BigDecimal.valueOf(expected)) == 0;
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
