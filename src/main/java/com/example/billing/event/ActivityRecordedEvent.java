package com.example.billing.event;

import com.example.billing.domain.ActivityLog.Action;

/**
 * An audited action. The entry is written only if the transaction that
 * performed the action commits; outside a transaction it is written at once.
 */
public record ActivityRecordedEvent(Long ownerId, Action action, String entityType, Long entityId,
                                    String description) {
}
