package com.example.billing.service;

import com.example.billing.domain.ActivityLog;
import com.example.billing.event.ActivityRecordedEvent;
import com.example.billing.repository.ActivityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Persists activity entries once the audited change has committed. A rolled
 * back change leaves no entry behind, and a failed write is logged and dropped.
 */
@Component
public class ActivityLogWriter {

    private static final Logger log = LoggerFactory.getLogger(ActivityLogWriter.class);

    private final ActivityLogRepository activityLogRepository;

    public ActivityLogWriter(ActivityLogRepository activityLogRepository) {
        this.activityLogRepository = activityLogRepository;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onActivityRecorded(ActivityRecordedEvent event) {
        try {
            activityLogRepository.save(new ActivityLog(event.ownerId(), event.action(), event.entityType(),
                event.entityId(), event.description()));
        } catch (RuntimeException e) {
            log.warn("Failed to record {} on {} {} (owner {}): {}",
                event.action(), event.entityType(), event.entityId(), event.ownerId(), e.getMessage(), e);
        }
    }
}
