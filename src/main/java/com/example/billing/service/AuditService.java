package com.example.billing.service;

import com.example.billing.domain.ActivityLog;
import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.event.ActivityRecordedEvent;
import com.example.billing.repository.ActivityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Records who did what to which billing entity.
 *
 * Entries are written by {@link ActivityLogWriter} after the surrounding
 * transaction commits, so an operation that rolls back is never audited.
 * Logging is best-effort: a failure to write an entry is logged and dropped,
 * the audited operation carries on.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String INVOICE = "INVOICE";
    public static final String QUOTATION = "QUOTATION";
    public static final String PAYMENT = "PAYMENT";
    public static final String RECURRING_SCHEDULE = "RECURRING_SCHEDULE";

    private final ApplicationEventPublisher eventPublisher;
    private final ActivityLogRepository activityLogRepository;

    public AuditService(ApplicationEventPublisher eventPublisher, ActivityLogRepository activityLogRepository) {
        this.eventPublisher = eventPublisher;
        this.activityLogRepository = activityLogRepository;
    }

    public void logEvent(Long ownerId, Action action, String entityType, Long entityId, String description) {
        try {
            eventPublisher.publishEvent(new ActivityRecordedEvent(ownerId, action, entityType, entityId, description));
        } catch (RuntimeException e) {
            log.warn("Failed to record {} on {} {} (owner {}): {}",
                action, entityType, entityId, ownerId, e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<ActivityLog> recentActivity(Long ownerId, int limit) {
        return activityLogRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId,
            PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<ActivityLog> historyOf(Long ownerId, String entityType, Long entityId) {
        return activityLogRepository.findByOwnerIdAndEntityTypeAndEntityIdOrderByCreatedAtDesc(
            ownerId, entityType, entityId);
    }
}
