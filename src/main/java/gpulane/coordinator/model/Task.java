package gpulane.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable lifecycle record of one generation request.
 * Updates go through the repository's conditional transitions; use
 * {@link #toBuilder()} only to derive in-memory copies.
 */
public final class Task {
    private final String id;
    private final String model;
    private final GenerationKind kind;
    private final String mode;
    private final String parameters; // validated JSON payload
    private final TaskStatus status;
    private final int progress;
    private final String errorMessage;
    private final String resultLocation;
    private final LaneMode laneMode;
    private final FallbackReason fallbackReason;
    private final boolean fallbackActivated;
    private final String stage;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.model = Objects.requireNonNull(builder.model, "model is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.mode = builder.mode;
        this.parameters = builder.parameters != null ? builder.parameters : "{}";
        this.status = Objects.requireNonNull(builder.status, "status is required");
        if (builder.progress < 0 || builder.progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100: " + builder.progress);
        }
        if (status == TaskStatus.DONE && builder.resultLocation == null) {
            throw new IllegalArgumentException("resultLocation is required for a done task");
        }
        if (status == TaskStatus.FAILED && builder.errorMessage == null) {
            throw new IllegalArgumentException("errorMessage is required for a failed task");
        }
        this.progress = builder.progress;
        this.errorMessage = builder.errorMessage;
        this.resultLocation = builder.resultLocation;
        this.laneMode = builder.laneMode;
        this.fallbackReason = builder.fallbackReason;
        this.fallbackActivated = builder.fallbackActivated;
        this.stage = builder.stage;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String model() {
        return model;
    }

    public GenerationKind kind() {
        return kind;
    }

    public String mode() {
        return mode;
    }

    public String parameters() {
        return parameters;
    }

    public TaskStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String resultLocation() {
        return resultLocation;
    }

    public LaneMode laneMode() {
        return laneMode;
    }

    public FallbackReason fallbackReason() {
        return fallbackReason;
    }

    /**
     * True when the request left its dedicated lane and went to the shared worker.
     */
    public boolean fallbackActivated() {
        return fallbackActivated;
    }

    public String stage() {
        return stage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .model(model)
                .kind(kind)
                .mode(mode)
                .parameters(parameters)
                .status(status)
                .progress(progress)
                .errorMessage(errorMessage)
                .resultLocation(resultLocation)
                .laneMode(laneMode)
                .fallbackReason(fallbackReason)
                .fallbackActivated(fallbackActivated)
                .stage(stage)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String model;
        private GenerationKind kind;
        private String mode;
        private String parameters;
        private TaskStatus status = TaskStatus.PENDING;
        private int progress = 0;
        private String errorMessage;
        private String resultLocation;
        private LaneMode laneMode;
        private FallbackReason fallbackReason;
        private boolean fallbackActivated;
        private String stage;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder kind(GenerationKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder parameters(String parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder resultLocation(String resultLocation) {
            this.resultLocation = resultLocation;
            return this;
        }

        public Builder laneMode(LaneMode laneMode) {
            this.laneMode = laneMode;
            return this;
        }

        public Builder fallbackReason(FallbackReason fallbackReason) {
            this.fallbackReason = fallbackReason;
            return this;
        }

        public Builder fallbackActivated(boolean fallbackActivated) {
            this.fallbackActivated = fallbackActivated;
            return this;
        }

        public Builder stage(String stage) {
            this.stage = stage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', model=" + model + ", status=" + status + ", laneMode=" + laneMode + "}";
    }
}
