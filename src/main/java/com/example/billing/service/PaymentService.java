package com.example.billing.service;

import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.domain.Invoice;
import com.example.billing.domain.Invoice.InvoiceStatus;
import com.example.billing.domain.Money;
import com.example.billing.domain.Payment;
import com.example.billing.domain.Payment.PaymentMethod;
import com.example.billing.event.PaymentRecordedEvent;
import com.example.billing.exception.InvalidStateException;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.exception.ValidationException;
import com.example.billing.repository.InvoiceRepository;
import com.example.billing.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for applying payments to invoices and reversing them.
 *
 * The sum of an invoice's payments never exceeds its total. Applying a payment
 * that covers the remaining balance moves the invoice to PAID from whatever
 * status it had; removing a payment from a PAID invoice that is no longer
 * covered moves it back to SENT. The payment row and the status change are
 * written in the same transaction, with the invoice row locked so that
 * concurrent payments are checked against each other's committed amounts.
 */
@Service
@Transactional
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;

    public PaymentService(InvoiceRepository invoiceRepository,
                          PaymentRepository paymentRepository,
                          AuditService auditService,
                          ApplicationEventPublisher eventPublisher) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Applies a payment to an invoice.
     *
     * @throws ValidationException if the amount is missing, not positive or has more than two decimals
     * @throws InvalidStateException if the invoice is cancelled or the payment exceeds the remaining balance
     */
    public Payment applyPayment(Long ownerId, Long invoiceId, PaymentRequest request) {
        BigDecimal amount = validateAmount(request.amount());
        Invoice invoice = findInvoiceForUpdate(ownerId, invoiceId);

        if (invoice.isCancelled()) {
            throw new InvalidStateException("Cannot record a payment on cancelled invoice "
                + invoice.getInvoiceNumber());
        }
        BigDecimal remaining = invoice.getRemainingAmount();
        if (invoice.getAmountPaid().add(amount).compareTo(invoice.getTotal()) > 0) {
            throw new InvalidStateException("Payment of " + amount + " exceeds the remaining balance of invoice "
                + invoice.getInvoiceNumber() + ". Maximum allowed: " + remaining);
        }

        LocalDate paymentDate = request.paymentDate() != null ? request.paymentDate() : LocalDate.now();
        PaymentMethod method = request.method() != null ? request.method() : PaymentMethod.BANK_TRANSFER;
        Payment payment = new Payment(amount, paymentDate, method);
        payment.setNotes(request.notes());
        invoice.addPayment(payment);
        payment = paymentRepository.save(payment);

        InvoiceStatus previous = invoice.getStatus();
        invoice.recalculateAmountPaid();
        if (invoice.isFullyPaid() && previous != InvoiceStatus.PAID) {
            invoice.setStatus(InvoiceStatus.PAID);
            log.info("Invoice {} fully paid, status {} -> PAID", invoice.getInvoiceNumber(), previous);
        }
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(ownerId, Action.PAYMENT_RECORDED, AuditService.PAYMENT, payment.getId(),
            "Recorded payment of " + amount + " (" + method + ") on invoice " + invoice.getInvoiceNumber());
        if (invoice.getStatus() != previous) {
            auditService.logEvent(ownerId, Action.STATUS_CHANGE, AuditService.INVOICE, invoice.getId(),
                "Invoice " + invoice.getInvoiceNumber() + " status changed from " + previous + " to "
                    + invoice.getStatus() + " by payment");
        }

        eventPublisher.publishEvent(new PaymentRecordedEvent(ownerId, invoice.getId(), invoice.getInvoiceNumber(),
            payment.getId(), amount, invoice.getRemainingAmount(), invoice.isFullyPaid()));

        return payment;
    }

    /**
     * Removes a payment. A PAID invoice that is no longer fully covered goes back to SENT.
     */
    public Invoice removePayment(Long ownerId, Long invoiceId, Long paymentId) {
        Invoice invoice = findInvoiceForUpdate(ownerId, invoiceId);
        Payment payment = invoice.getPayments().stream()
            .filter(p -> p.getId() != null && p.getId().equals(paymentId))
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));

        InvoiceStatus previous = invoice.getStatus();
        invoice.removePayment(payment);
        invoice.recalculateAmountPaid();
        if (previous == InvoiceStatus.PAID && !invoice.isFullyPaid()) {
            invoice.setStatus(InvoiceStatus.SENT);
            log.info("Invoice {} no longer fully paid, status PAID -> SENT", invoice.getInvoiceNumber());
        }
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(ownerId, Action.PAYMENT_REMOVED, AuditService.PAYMENT, paymentId,
            "Removed payment of " + payment.getAmount() + " from invoice " + invoice.getInvoiceNumber());
        if (invoice.getStatus() != previous) {
            auditService.logEvent(ownerId, Action.STATUS_CHANGE, AuditService.INVOICE, invoice.getId(),
                "Invoice " + invoice.getInvoiceNumber() + " status changed from " + previous + " to "
                    + invoice.getStatus() + " by payment removal");
        }

        return invoice;
    }

    /**
     * Payments of an invoice, most recent payment date first.
     */
    @Transactional(readOnly = true)
    public List<Payment> listPayments(Long ownerId, Long invoiceId) {
        Invoice invoice = invoiceRepository.findByIdAndOwnerId(invoiceId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
        return paymentRepository.findByInvoiceOrderByPaymentDateDescIdDesc(invoice);
    }

    private Invoice findInvoiceForUpdate(Long ownerId, Long invoiceId) {
        return invoiceRepository.findForUpdate(invoiceId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    private BigDecimal validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be positive");
        }
        if (!Money.fitsScale(amount)) {
            throw new ValidationException("Payment amount must have at most two decimals: " + amount);
        }
        return amount.setScale(2);
    }
}
