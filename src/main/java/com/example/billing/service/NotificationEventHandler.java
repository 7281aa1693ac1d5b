package com.example.billing.service;

import com.example.billing.event.PaymentRecordedEvent;
import com.example.billing.event.RecurringGenerationFailedEvent;
import com.example.billing.event.RecurringInvoiceGeneratedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed billing events into notifications. A notification failure
 * is logged and never reaches the billing operation that raised the event.
 */
@Component
public class NotificationEventHandler {

    private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

    private final NotificationService notificationService;

    public NotificationEventHandler(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPaymentRecorded(PaymentRecordedEvent event) {
        try {
            notificationService.handlePaymentRecorded(event);
        } catch (Exception e) {
            log.warn("Failed to create notifications for payment {} on invoice {}",
                event.paymentId(), event.invoiceNumber(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRecurringInvoiceGenerated(RecurringInvoiceGeneratedEvent event) {
        try {
            notificationService.handleRecurringGenerated(event);
        } catch (Exception e) {
            log.warn("Failed to create notification for recurring schedule {} invoice {}",
                event.scheduleId(), event.invoiceNumber(), e);
        }
    }

    // Published outside any transaction by the sweep
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRecurringGenerationFailed(RecurringGenerationFailedEvent event) {
        try {
            notificationService.handleRecurringFailed(event);
        } catch (Exception e) {
            log.warn("Failed to create failure notification for recurring schedule {}", event.scheduleId(), e);
        }
    }
}
