package com.example.billing.service;

import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.domain.Customer;
import com.example.billing.domain.Invoice;
import com.example.billing.domain.Invoice.InvoiceStatus;
import com.example.billing.domain.InvoiceLine;
import com.example.billing.domain.Money;
import com.example.billing.exception.InvalidStateException;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.exception.ValidationException;
import com.example.billing.repository.CustomerRepository;
import com.example.billing.repository.InvoiceRepository;
import com.example.billing.repository.PaymentRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service for creating and editing invoices.
 *
 * Every change to the line set re-runs the full totals calculation over the
 * invoice's current lines. Lines and header can only be changed while the
 * invoice is DRAFT or SENT.
 */
@Service
@Transactional
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final CustomerRepository customerRepository;
    private final PaymentRepository paymentRepository;
    private final DocumentNumberService numberService;
    private final AuditService auditService;

    public InvoiceService(InvoiceRepository invoiceRepository,
                          CustomerRepository customerRepository,
                          PaymentRepository paymentRepository,
                          DocumentNumberService numberService,
                          AuditService auditService) {
        this.invoiceRepository = invoiceRepository;
        this.customerRepository = customerRepository;
        this.paymentRepository = paymentRepository;
        this.numberService = numberService;
        this.auditService = auditService;
    }

    /**
     * Creates an invoice with its lines and computed totals in one step.
     * The invoice gets the owner's next invoice number.
     */
    public Invoice create(Long ownerId, InvoiceRequest request) {
        if (request.invoiceDate() == null) {
            throw new ValidationException("Invoice date is required");
        }
        validateDueDate(request.invoiceDate(), request.dueDate());
        InvoiceStatus status = request.status() != null ? request.status() : InvoiceStatus.DRAFT;
        if (status != InvoiceStatus.DRAFT && status != InvoiceStatus.SENT) {
            throw new ValidationException("New invoices must be DRAFT or SENT, got " + status);
        }
        LineItemRequest.validateAll(request.lines());
        Customer customer = findCustomer(ownerId, request.customerId());

        String invoiceNumber = numberService.nextInvoiceNumber(ownerId);
        Invoice invoice = new Invoice(ownerId, customer, invoiceNumber, request.invoiceDate(), request.dueDate());
        invoice.setStatus(status);
        invoice.setNotes(request.notes());
        if (request.lines() != null) {
            for (LineItemRequest line : request.lines()) {
                invoice.addLine(line.toInvoiceLine());
            }
        }
        invoice.recalculateTotals();
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(ownerId, Action.CREATE, AuditService.INVOICE, invoice.getId(),
            "Created invoice " + invoiceNumber + " for " + customer.getCompanyName()
                + " (total " + invoice.getTotal() + ")");

        return invoice;
    }

    @Transactional(readOnly = true)
    public Invoice get(Long ownerId, Long invoiceId) {
        return invoiceRepository.findByIdAndOwnerId(invoiceId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    /**
     * Lists an owner's invoices, newest first. Customer and status filters are optional.
     */
    @Transactional(readOnly = true)
    public Page<Invoice> list(Long ownerId, Long customerId, InvoiceStatus status, Pageable pageable) {
        return invoiceRepository.search(ownerId, customerId, status, pageable);
    }

    public Invoice updateHeader(Long ownerId, Long invoiceId, DocumentHeader header) {
        Invoice invoice = get(ownerId, invoiceId);
        requireEditable(invoice);
        if (header.documentDate() == null) {
            throw new ValidationException("Invoice date is required");
        }
        validateDueDate(header.documentDate(), header.dueDate());

        if (header.customerId() != null && !header.customerId().equals(invoice.getCustomer().getId())) {
            invoice.setCustomer(findCustomer(ownerId, header.customerId()));
        }
        invoice.setInvoiceDate(header.documentDate());
        invoice.setDueDate(header.dueDate());
        invoice.setNotes(header.notes());
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(ownerId, Action.UPDATE, AuditService.INVOICE, invoice.getId(),
            "Updated invoice " + invoice.getInvoiceNumber());

        return invoice;
    }

    /**
     * Explicit status change. The invoice transition policy is permissive, so
     * any target status is accepted.
     */
    public Invoice changeStatus(Long ownerId, Long invoiceId, InvoiceStatus target) {
        if (target == null) {
            throw new ValidationException("Invoice status is required");
        }
        Invoice invoice = get(ownerId, invoiceId);
        InvoiceStatus current = invoice.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidStateException("Cannot change invoice status from " + current + " to " + target);
        }
        if (current == target) {
            return invoice;
        }
        invoice.setStatus(target);
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(ownerId, Action.STATUS_CHANGE, AuditService.INVOICE, invoice.getId(),
            "Invoice " + invoice.getInvoiceNumber() + " status changed from " + current + " to " + target);

        return invoice;
    }

    public Invoice changeStatus(Long ownerId, Long invoiceId, String target) {
        return changeStatus(ownerId, invoiceId, InvoiceStatus.parse(target));
    }

    public Invoice addLine(Long ownerId, Long invoiceId, LineItemRequest request) {
        request.validate();
        Invoice invoice = getForUpdate(ownerId, invoiceId);
        requireEditable(invoice);

        InvoiceLine line = request.toInvoiceLine();
        invoice.addLine(line);
        return saveAfterLineChange(invoice, "Added line '" + line.getDescription() + "' to invoice ");
    }

    public Invoice updateLine(Long ownerId, Long invoiceId, Long lineId, LineItemRequest request) {
        request.validate();
        Invoice invoice = getForUpdate(ownerId, invoiceId);
        requireEditable(invoice);

        InvoiceLine line = invoice.findLine(lineId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice line", lineId));
        request.applyTo(line);
        line.calculateTotals();
        return saveAfterLineChange(invoice, "Updated line '" + line.getDescription() + "' on invoice ");
    }

    public Invoice removeLine(Long ownerId, Long invoiceId, Long lineId) {
        Invoice invoice = getForUpdate(ownerId, invoiceId);
        requireEditable(invoice);

        InvoiceLine line = invoice.findLine(lineId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice line", lineId));
        invoice.removeLine(line);
        return saveAfterLineChange(invoice, "Removed line '" + line.getDescription() + "' from invoice ");
    }

    /**
     * Deletes an invoice together with its lines and payments.
     */
    public void delete(Long ownerId, Long invoiceId) {
        Invoice invoice = get(ownerId, invoiceId);
        invoiceRepository.delete(invoice);

        auditService.logEvent(ownerId, Action.DELETE, AuditService.INVOICE, invoiceId,
            "Deleted invoice " + invoice.getInvoiceNumber());
    }

    @Transactional(readOnly = true)
    public InvoiceStats getStats(Long ownerId) {
        Map<InvoiceStatus, Long> countByStatus = new EnumMap<>(InvoiceStatus.class);
        for (InvoiceStatus status : InvoiceStatus.values()) {
            countByStatus.put(status, invoiceRepository.countByOwnerIdAndStatus(ownerId, status));
        }
        BigDecimal totalInvoiced = Money.round(invoiceRepository.sumTotalByOwner(ownerId));
        BigDecimal totalPaid = Money.round(paymentRepository.sumByOwner(ownerId));
        BigDecimal totalUnpaid = Money.round(invoiceRepository.sumTotalByOwnerAndStatusIn(ownerId,
            List.of(InvoiceStatus.DRAFT, InvoiceStatus.SENT)));

        return new InvoiceStats(invoiceRepository.countByOwnerId(ownerId), totalInvoiced, totalPaid,
            totalUnpaid, countByStatus);
    }

    /**
     * Recalculates totals after a line change. An invoice with payments that
     * now cover the new total is moved to PAID, as a payment would have done.
     */
    private Invoice saveAfterLineChange(Invoice invoice, String description) {
        invoice.recalculateTotals();
        if (invoice.getAmountPaid().compareTo(invoice.getTotal()) > 0) {
            throw new InvalidStateException("Invoice total " + invoice.getTotal()
                + " would fall below the amount already paid (" + invoice.getAmountPaid() + ")");
        }
        InvoiceStatus previous = invoice.getStatus();
        if (invoice.getAmountPaid().signum() > 0 && invoice.isFullyPaid()) {
            invoice.setStatus(InvoiceStatus.PAID);
        }
        invoice = invoiceRepository.save(invoice);

        auditService.logEvent(invoice.getOwnerId(), Action.UPDATE, AuditService.INVOICE, invoice.getId(),
            description + invoice.getInvoiceNumber());
        if (invoice.getStatus() != previous) {
            auditService.logEvent(invoice.getOwnerId(), Action.STATUS_CHANGE, AuditService.INVOICE, invoice.getId(),
                "Invoice " + invoice.getInvoiceNumber() + " status changed from " + previous + " to "
                    + invoice.getStatus() + " by line change");
        }

        return invoice;
    }

    private Invoice getForUpdate(Long ownerId, Long invoiceId) {
        return invoiceRepository.findForUpdate(invoiceId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    private void requireEditable(Invoice invoice) {
        if (!invoice.isEditable()) {
            throw new InvalidStateException("Invoice " + invoice.getInvoiceNumber()
                + " cannot be modified in status " + invoice.getStatus());
        }
    }

    private void validateDueDate(LocalDate documentDate, LocalDate dueDate) {
        if (dueDate != null && dueDate.isBefore(documentDate)) {
            throw new ValidationException("Due date " + dueDate + " is before invoice date " + documentDate);
        }
    }

    private Customer findCustomer(Long ownerId, Long customerId) {
        if (customerId == null) {
            throw new ValidationException("Customer is required");
        }
        return customerRepository.findByIdAndOwnerId(customerId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    }
}
