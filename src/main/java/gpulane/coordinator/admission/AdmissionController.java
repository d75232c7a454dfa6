package gpulane.coordinator.admission;

import gpulane.coordinator.model.DegradedQueuePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded logical queue for degraded shared-worker mode.
 *
 * <p>
 * Depth is the number of admitted tickets not yet released, whether still
 * waiting or already running. The depth check and the insert happen under one
 * lock, so concurrent callers can never push the queue past
 * {@link DegradedQueuePolicy#maxDepth()}.
 *
 * <p>
 * A ticket that has waited {@link DegradedQueuePolicy#maxWait()} since arrival
 * without starting is overdue: {@link #markStarted(String)} refuses it and
 * {@link #expireOverdue()} removes it.
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final DegradedQueuePolicy policy;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();
    private final Map<String, QueueTicket> tickets = new LinkedHashMap<>();

    public AdmissionController(DegradedQueuePolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public DegradedQueuePolicy policy() {
        return policy;
    }

    /**
     * Admit immediately or reject. Admitting an already admitted task id is a no-op
     * that reports ADMITTED.
     */
    public AdmissionDecision tryAdmit(String taskId, String model, Instant arrival) {
        lock.lock();
        try {
            return admitLocked(taskId, model, arrival);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admit, waiting up to {@code budget} (never more than the policy's max wait from
     * arrival) for a slot to be released. Wakes early on every release.
     */
    public AdmissionDecision awaitAdmission(String taskId, String model, Instant arrival, Duration budget) {
        Duration remainingWait = policy.maxWait().minus(Duration.between(arrival, clock.instant()));
        Duration effective = budget.compareTo(remainingWait) < 0 ? budget : remainingWait;
        long nanos = Math.max(0, effective.toNanos());

        lock.lock();
        try {
            AdmissionDecision decision = admitLocked(taskId, model, arrival);
            while (!decision.admitted() && nanos > 0) {
                nanos = slotFreed.awaitNanos(nanos);
                decision = admitLocked(taskId, model, arrival);
            }
            return decision;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Admission wait for task {} interrupted", taskId);
            return new AdmissionDecision(AdmissionResult.REJECTED, tickets.size(), policy.maxDepth());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called by the shared worker right before inference. Refuses unknown or overdue
     * tickets; an overdue ticket is released as part of the refusal.
     *
     * @return true if the task may start
     */
    public boolean markStarted(String taskId) {
        lock.lock();
        try {
            QueueTicket ticket = tickets.get(taskId);
            if (ticket == null) {
                return false;
            }
            if (ticket.isOverdue(clock.instant(), policy.maxWait())) {
                tickets.remove(taskId);
                slotFreed.signalAll();
                log.info("Task {} waited past {}s in degraded queue, refusing start", taskId,
                        policy.maxWaitSeconds());
                return false;
            }
            ticket.markStarted();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release a slot. Idempotent.
     *
     * @return true if a ticket was held for this task
     */
    public boolean release(String taskId) {
        lock.lock();
        try {
            QueueTicket removed = tickets.remove(taskId);
            if (removed != null) {
                slotFreed.signalAll();
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every ticket that has waited past max wait without starting.
     */
    public List<QueueTicket> expireOverdue() {
        Instant now = clock.instant();
        List<QueueTicket> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<QueueTicket> it = tickets.values().iterator();
            while (it.hasNext()) {
                QueueTicket ticket = it.next();
                if (ticket.isOverdue(now, policy.maxWait())) {
                    it.remove();
                    expired.add(ticket);
                }
            }
            if (!expired.isEmpty()) {
                slotFreed.signalAll();
            }
        } finally {
            lock.unlock();
        }
        return expired;
    }

    public int depth() {
        lock.lock();
        try {
            return tickets.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admitted tickets that have not started yet.
     */
    public int waitingCount() {
        lock.lock();
        try {
            return (int) tickets.values().stream().filter(t -> !t.started()).count();
        } finally {
            lock.unlock();
        }
    }

    public boolean holds(String taskId) {
        lock.lock();
        try {
            return tickets.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    private AdmissionDecision admitLocked(String taskId, String model, Instant arrival) {
        if (tickets.containsKey(taskId)) {
            return new AdmissionDecision(AdmissionResult.ADMITTED, tickets.size(), policy.maxDepth());
        }
        if (tickets.size() >= policy.maxDepth()) {
            return new AdmissionDecision(AdmissionResult.REJECTED, tickets.size(), policy.maxDepth());
        }
        tickets.put(taskId, new QueueTicket(taskId, model, arrival));
        return new AdmissionDecision(AdmissionResult.ADMITTED, tickets.size(), policy.maxDepth());
    }
}
