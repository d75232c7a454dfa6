package gpulane.coordinator.model;

import java.util.Objects;

/**
 * Fixed generation parameters a heavy model must be called with.
 *
 * @param model      model id
 * @param fixedSteps required number of inference steps
 * @param fixedCfg   required CFG scale, or null when the model leaves it free
 */
public record VideoGenerationConstraints(String model, int fixedSteps, Double fixedCfg) {

    public VideoGenerationConstraints {
        Objects.requireNonNull(model, "model is required");
        if (fixedSteps <= 0) {
            throw new IllegalArgumentException("fixedSteps must be positive for " + model);
        }
    }

    public boolean hasFixedCfg() {
        return fixedCfg != null;
    }
}
