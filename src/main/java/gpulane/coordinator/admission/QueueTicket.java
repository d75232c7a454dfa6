package gpulane.coordinator.admission;

import java.time.Duration;
import java.time.Instant;

/**
 * One admitted request holding a degraded-queue slot until released.
 * Mutable state is guarded by the owning {@link AdmissionController}'s lock.
 */
public final class QueueTicket {

    private final String taskId;
    private final String model;
    private final Instant arrival;
    private boolean started;

    QueueTicket(String taskId, String model, Instant arrival) {
        this.taskId = taskId;
        this.model = model;
        this.arrival = arrival;
    }

    public String taskId() {
        return taskId;
    }

    public String model() {
        return model;
    }

    public Instant arrival() {
        return arrival;
    }

    public boolean started() {
        return started;
    }

    void markStarted() {
        this.started = true;
    }

    boolean isOverdue(Instant now, Duration maxWait) {
        return !started && Duration.between(arrival, now).compareTo(maxWait) >= 0;
    }

    @Override
    public String toString() {
        return "QueueTicket{taskId='" + taskId + "', model=" + model + ", started=" + started + "}";
    }
}
