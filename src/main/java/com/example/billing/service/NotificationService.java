package com.example.billing.service;

import com.example.billing.domain.Notification;
import com.example.billing.domain.Notification.NotificationType;
import com.example.billing.event.PaymentRecordedEvent;
import com.example.billing.event.RecurringGenerationFailedEvent;
import com.example.billing.event.RecurringInvoiceGeneratedEvent;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.repository.NotificationRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates in-app notifications for billing events and optionally mirrors them by email.
 *
 * The handle methods run in a new transaction because they are called after
 * the transaction that raised the event has committed.
 */
@Service
@Transactional
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final EmailService emailService;
    private final String emailTo;

    public NotificationService(NotificationRepository notificationRepository,
                               EmailService emailService,
                               @Value("${billing.notifications.email.to:}") String emailTo) {
        this.notificationRepository = notificationRepository;
        this.emailService = emailService;
        this.emailTo = emailTo;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<Notification> handlePaymentRecorded(PaymentRecordedEvent event) {
        List<Notification> created = new ArrayList<>();
        created.add(create(event.ownerId(), NotificationType.PAYMENT_RECEIVED,
            "Payment received",
            "Payment of " + event.amount() + " recorded on invoice " + event.invoiceNumber()
                + ". Remaining: " + event.remainingAmount(),
            AuditService.INVOICE, event.invoiceId()));
        if (event.fullyPaid()) {
            created.add(create(event.ownerId(), NotificationType.INVOICE_PAID,
                "Invoice paid",
                "Invoice " + event.invoiceNumber() + " has been paid in full",
                AuditService.INVOICE, event.invoiceId()));
        }
        return created;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification handleRecurringGenerated(RecurringInvoiceGeneratedEvent event) {
        String message = "Invoice " + event.invoiceNumber() + " (total " + event.total()
            + ") was generated from recurring schedule #" + event.scheduleId();
        if (event.scheduleDeactivated()) {
            message = message + ". The schedule has reached its end date and is now inactive";
        }
        return create(event.ownerId(), NotificationType.RECURRING_GENERATED, "Recurring invoice generated",
            message, AuditService.INVOICE, event.invoiceId());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification handleRecurringFailed(RecurringGenerationFailedEvent event) {
        return create(event.ownerId(), NotificationType.RECURRING_FAILED, "Recurring invoice failed",
            "Generating an invoice from recurring schedule #" + event.scheduleId() + " failed: " + event.error(),
            AuditService.RECURRING_SCHEDULE, event.scheduleId());
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long ownerId) {
        return notificationRepository.countByOwnerIdAndReadFalse(ownerId);
    }

    @Transactional(readOnly = true)
    public List<Notification> list(Long ownerId, int limit) {
        return notificationRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId, PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<Notification> listUnread(Long ownerId) {
        return notificationRepository.findByOwnerIdAndReadFalseOrderByCreatedAtDesc(ownerId);
    }

    public Notification markRead(Long ownerId, Long notificationId) {
        Notification notification = notificationRepository.findByIdAndOwnerId(notificationId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
        notification.markRead();
        return notificationRepository.save(notification);
    }

    public int markAllRead(Long ownerId) {
        List<Notification> unread = notificationRepository.findByOwnerIdAndReadFalseOrderByCreatedAtDesc(ownerId);
        unread.forEach(Notification::markRead);
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    private Notification create(Long ownerId, NotificationType type, String title, String message,
                                String entityType, Long entityId) {
        Notification notification = notificationRepository.save(
            new Notification(ownerId, type, title, message, entityType, entityId));
        if (emailService.isEnabled() && !emailTo.isBlank()) {
            emailService.send(emailTo, title, message);
        }
        return notification;
    }
}
