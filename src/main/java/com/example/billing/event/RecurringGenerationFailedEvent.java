package com.example.billing.event;

/**
 * Published by the sweep when generating an invoice for a schedule failed.
 * Raised outside any transaction.
 */
public record RecurringGenerationFailedEvent(Long ownerId, Long scheduleId, String error) {
}
