package gpulane.coordinator.execution;

/**
 * Output of a successful generation.
 *
 * @param resultLocation where the rendered media was stored
 */
public record GenerationResult(String resultLocation) {

    public GenerationResult {
        if (resultLocation == null || resultLocation.isBlank()) {
            throw new IllegalArgumentException("resultLocation is required");
        }
    }
}
