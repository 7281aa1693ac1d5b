package com.example.billing.event;

import java.math.BigDecimal;

/**
 * Published when a payment has been applied to an invoice. Listeners see it
 * only after the payment transaction has committed.
 */
public record PaymentRecordedEvent(Long ownerId, Long invoiceId, String invoiceNumber, Long paymentId,
                                   BigDecimal amount, BigDecimal remainingAmount, boolean fullyPaid) {
}
