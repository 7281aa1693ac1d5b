package com.example.billing.event;

import java.math.BigDecimal;

/**
 * Published when a recurring schedule has produced an invoice.
 */
public record RecurringInvoiceGeneratedEvent(Long ownerId, Long scheduleId, Long invoiceId, String invoiceNumber,
                                             BigDecimal total, boolean scheduleDeactivated) {
}
