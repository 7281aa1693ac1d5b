package com.example.billing.service;

import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.domain.Customer;
import com.example.billing.domain.Invoice;
import com.example.billing.domain.InvoiceLine;
import com.example.billing.domain.Quotation;
import com.example.billing.domain.Quotation.QuotationStatus;
import com.example.billing.domain.QuotationLine;
import com.example.billing.exception.InvalidStateException;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.exception.ValidationException;
import com.example.billing.repository.CustomerRepository;
import com.example.billing.repository.InvoiceRepository;
import com.example.billing.repository.QuotationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Service for quotations and their conversion into invoices.
 *
 * A converted quotation is a historical record: header, lines and status are
 * frozen and it can no longer be deleted. CONVERTED is only ever set by
 * {@link #convertToInvoice(Long, Long)}.
 */
@Service
@Transactional
public class QuotationService {

    private static final Logger log = LoggerFactory.getLogger(QuotationService.class);

    private final QuotationRepository quotationRepository;
    private final InvoiceRepository invoiceRepository;
    private final CustomerRepository customerRepository;
    private final DocumentNumberService numberService;
    private final AuditService auditService;

    public QuotationService(QuotationRepository quotationRepository,
                            InvoiceRepository invoiceRepository,
                            CustomerRepository customerRepository,
                            DocumentNumberService numberService,
                            AuditService auditService) {
        this.quotationRepository = quotationRepository;
        this.invoiceRepository = invoiceRepository;
        this.customerRepository = customerRepository;
        this.numberService = numberService;
        this.auditService = auditService;
    }

    public Quotation create(Long ownerId, QuotationRequest request) {
        if (request.quotationDate() == null) {
            throw new ValidationException("Quotation date is required");
        }
        validateValidUntil(request.quotationDate(), request.validUntil());
        LineItemRequest.validateAll(request.lines());
        Customer customer = findCustomer(ownerId, request.customerId());

        String number = numberService.nextQuotationNumber(ownerId, LocalDate.now().getYear());
        Quotation quotation = new Quotation(ownerId, customer, number, request.quotationDate(), request.validUntil());
        quotation.setNotes(request.notes());
        if (request.lines() != null) {
            for (LineItemRequest line : request.lines()) {
                quotation.addLine(line.toQuotationLine());
            }
        }
        quotation.recalculateTotals();
        quotation = quotationRepository.save(quotation);

        auditService.logEvent(ownerId, Action.CREATE, AuditService.QUOTATION, quotation.getId(),
            "Created quotation " + number + " for " + customer.getCompanyName());

        return quotation;
    }

    @Transactional(readOnly = true)
    public Quotation get(Long ownerId, Long quotationId) {
        return quotationRepository.findByIdAndOwnerId(quotationId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Quotation", quotationId));
    }

    @Transactional(readOnly = true)
    public Page<Quotation> list(Long ownerId, Long customerId, QuotationStatus status, Pageable pageable) {
        return quotationRepository.search(ownerId, customerId, status, pageable);
    }

    /**
     * Preview of the number the owner's next quotation would get this year.
     */
    @Transactional(readOnly = true)
    public String peekNextNumber(Long ownerId) {
        return numberService.peekQuotationNumber(ownerId, LocalDate.now().getYear());
    }

    public Quotation updateHeader(Long ownerId, Long quotationId, DocumentHeader header) {
        Quotation quotation = get(ownerId, quotationId);
        requireNotConverted(quotation);
        if (header.documentDate() == null) {
            throw new ValidationException("Quotation date is required");
        }
        validateValidUntil(header.documentDate(), header.dueDate());

        if (header.customerId() != null && !header.customerId().equals(quotation.getCustomer().getId())) {
            quotation.setCustomer(findCustomer(ownerId, header.customerId()));
        }
        quotation.setQuotationDate(header.documentDate());
        quotation.setValidUntil(header.dueDate());
        quotation.setNotes(header.notes());
        quotation = quotationRepository.save(quotation);

        auditService.logEvent(ownerId, Action.UPDATE, AuditService.QUOTATION, quotation.getId(),
            "Updated quotation " + quotation.getQuotationNumber());

        return quotation;
    }

    /**
     * Changes the status of a quotation that has not been converted.
     *
     * @throws ValidationException if the target is CONVERTED, which only conversion may set
     * @throws InvalidStateException if the quotation is already converted
     */
    public Quotation changeStatus(Long ownerId, Long quotationId, QuotationStatus target) {
        if (target == null) {
            throw new ValidationException("Quotation status is required");
        }
        if (target == QuotationStatus.CONVERTED) {
            throw new ValidationException("Status CONVERTED can only be reached by converting the quotation");
        }
        Quotation quotation = get(ownerId, quotationId);
        requireNotConverted(quotation);

        QuotationStatus current = quotation.getStatus();
        if (current == target) {
            return quotation;
        }
        if (!current.canTransitionTo(target)) {
            throw new InvalidStateException("Cannot change quotation status from " + current + " to " + target);
        }
        quotation.setStatus(target);
        quotation = quotationRepository.save(quotation);

        auditService.logEvent(ownerId, Action.STATUS_CHANGE, AuditService.QUOTATION, quotation.getId(),
            "Quotation " + quotation.getQuotationNumber() + " status changed from " + current + " to " + target);

        return quotation;
    }

    public Quotation changeStatus(Long ownerId, Long quotationId, String target) {
        return changeStatus(ownerId, quotationId, QuotationStatus.parse(target));
    }

    public Quotation addLine(Long ownerId, Long quotationId, LineItemRequest request) {
        request.validate();
        Quotation quotation = get(ownerId, quotationId);
        requireNotConverted(quotation);

        QuotationLine line = request.toQuotationLine();
        quotation.addLine(line);
        return saveAfterLineChange(quotation, "Added line '" + line.getDescription() + "' to quotation ");
    }

    public Quotation updateLine(Long ownerId, Long quotationId, Long lineId, LineItemRequest request) {
        request.validate();
        Quotation quotation = get(ownerId, quotationId);
        requireNotConverted(quotation);

        QuotationLine line = quotation.findLine(lineId)
            .orElseThrow(() -> new ResourceNotFoundException("Quotation line", lineId));
        request.applyTo(line);
        line.calculateTotals();
        return saveAfterLineChange(quotation, "Updated line '" + line.getDescription() + "' on quotation ");
    }

    public Quotation removeLine(Long ownerId, Long quotationId, Long lineId) {
        Quotation quotation = get(ownerId, quotationId);
        requireNotConverted(quotation);

        QuotationLine line = quotation.findLine(lineId)
            .orElseThrow(() -> new ResourceNotFoundException("Quotation line", lineId));
        quotation.removeLine(line);
        return saveAfterLineChange(quotation, "Removed line '" + line.getDescription() + "' from quotation ");
    }

    public void delete(Long ownerId, Long quotationId) {
        Quotation quotation = get(ownerId, quotationId);
        requireNotConverted(quotation);
        quotationRepository.delete(quotation);

        auditService.logEvent(ownerId, Action.DELETE, AuditService.QUOTATION, quotationId,
            "Deleted quotation " + quotation.getQuotationNumber());
    }

    /**
     * Converts a quotation into a draft invoice dated today.
     *
     * Lines are copied with their computed amounts and the invoice takes the
     * quotation's totals as they are, so the invoice shows exactly the figures
     * the customer was quoted. A quotation converts at most once.
     */
    public Invoice convertToInvoice(Long ownerId, Long quotationId) {
        Quotation quotation = get(ownerId, quotationId);
        if (quotation.isConverted()) {
            throw new InvalidStateException("Quotation " + quotation.getQuotationNumber()
                + " has already been converted to invoice " + quotation.getConvertedInvoiceId());
        }
        if (quotation.getLines().isEmpty()) {
            throw new InvalidStateException("Quotation " + quotation.getQuotationNumber()
                + " has no lines and cannot be converted");
        }

        String invoiceNumber = numberService.nextInvoiceNumber(ownerId);
        Invoice invoice = new Invoice(ownerId, quotation.getCustomer(), invoiceNumber, LocalDate.now(), null);
        invoice.setNotes(quotation.getNotes());
        for (QuotationLine line : quotation.getLines()) {
            invoice.addLine(InvoiceLine.copyOf(line));
        }
        invoice.applyTotals(quotation.getTotals());
        invoice = invoiceRepository.save(invoice);

        quotation.markConverted(invoice.getId());
        quotationRepository.save(quotation);

        log.info("Converted quotation {} into invoice {}", quotation.getQuotationNumber(), invoiceNumber);
        auditService.logEvent(ownerId, Action.CREATE, AuditService.INVOICE, invoice.getId(),
            "Created invoice " + invoiceNumber + " from quotation " + quotation.getQuotationNumber());
        auditService.logEvent(ownerId, Action.CONVERT, AuditService.QUOTATION, quotation.getId(),
            "Converted quotation " + quotation.getQuotationNumber() + " into invoice " + invoiceNumber);

        return invoice;
    }

    private Quotation saveAfterLineChange(Quotation quotation, String description) {
        quotation.recalculateTotals();
        quotation = quotationRepository.save(quotation);

        auditService.logEvent(quotation.getOwnerId(), Action.UPDATE, AuditService.QUOTATION, quotation.getId(),
            description + quotation.getQuotationNumber());

        return quotation;
    }

    private void requireNotConverted(Quotation quotation) {
        if (quotation.isConverted()) {
            throw new InvalidStateException("Quotation " + quotation.getQuotationNumber()
                + " has been converted and can no longer be modified");
        }
    }

    private void validateValidUntil(LocalDate quotationDate, LocalDate validUntil) {
        if (validUntil != null && validUntil.isBefore(quotationDate)) {
            throw new ValidationException("Valid-until date " + validUntil
                + " is before quotation date " + quotationDate);
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
