package gpulane.coordinator.scheduler;

import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.admission.QueueExpiryHandler;
import gpulane.coordinator.admission.QueueTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Expires degraded-queue tickets that waited past max wait without starting,
 * failing their tasks with the overflow code.
 */
public class DegradedQueueSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DegradedQueueSweeper.class);

    private final AdmissionController admission;
    private final QueueExpiryHandler expiryHandler;

    public DegradedQueueSweeper(AdmissionController admission, QueueExpiryHandler expiryHandler) {
        this.admission = admission;
        this.expiryHandler = expiryHandler;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Degraded queue sweeper error", e);
        }
    }

    /**
     * @return number of tasks failed by this sweep
     */
    public int sweep() {
        List<QueueTicket> expired = admission.expireOverdue();
        int failed = 0;
        for (QueueTicket ticket : expired) {
            if (expiryHandler.expire(ticket)) {
                failed++;
            }
        }
        if (!expired.isEmpty()) {
            log.info("Degraded queue sweep: {} tickets expired, {} tasks failed", expired.size(), failed);
        }
        return failed;
    }
}
