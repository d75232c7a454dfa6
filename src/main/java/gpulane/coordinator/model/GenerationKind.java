package gpulane.coordinator.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Kind of generation. Video models are the heavy ones that get a dedicated lane.
 */
public enum GenerationKind {
    VIDEO(Duration.ofMinutes(30)),
    IMAGE(Duration.ofMinutes(10));

    private final Duration processingTtl;

    GenerationKind(Duration processingTtl) {
        this.processingTtl = processingTtl;
    }

    /** Time a task of this kind may stay in PROCESSING before the reaper fails it */
    public Duration processingTtl() {
        return processingTtl;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GenerationKind fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
