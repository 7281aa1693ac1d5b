package com.example.billing.service;

import com.example.billing.domain.DocumentSequence;
import com.example.billing.domain.DocumentSequence.DocumentType;
import com.example.billing.repository.DocumentSequenceRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out document numbers from per-owner counters.
 *
 * Invoices: {@code INV-0001}, one sequence per owner.
 * Quotations: {@code QUO-2026-0001}, one sequence per owner and year.
 *
 * The counter row is locked for the rest of the calling transaction, so two
 * concurrent creations for the same owner serialize on it. A number is never
 * handed out twice, even after the document carrying it is deleted.
 */
@Service
@Transactional
public class DocumentNumberService {

    private final DocumentSequenceRepository sequenceRepository;
    private final String invoicePrefix;
    private final String quotationPrefix;

    public DocumentNumberService(DocumentSequenceRepository sequenceRepository,
                                 @Value("${billing.numbering.invoice-prefix:INV}") String invoicePrefix,
                                 @Value("${billing.numbering.quotation-prefix:QUO}") String quotationPrefix) {
        this.sequenceRepository = sequenceRepository;
        this.invoicePrefix = invoicePrefix;
        this.quotationPrefix = quotationPrefix;
    }

    public String nextInvoiceNumber(Long ownerId) {
        long value = lockSequence(ownerId, DocumentType.INVOICE, DocumentSequence.NO_YEAR).next();
        return formatInvoiceNumber(value);
    }

    public String nextQuotationNumber(Long ownerId, int year) {
        long value = lockSequence(ownerId, DocumentType.QUOTATION, year).next();
        return formatQuotationNumber(year, value);
    }

    /**
     * Preview of the next invoice number. Does not reserve it.
     */
    @Transactional(readOnly = true)
    public String peekInvoiceNumber(Long ownerId) {
        return formatInvoiceNumber(currentValue(ownerId, DocumentType.INVOICE, DocumentSequence.NO_YEAR));
    }

    /**
     * Preview of the next quotation number for the given year. Does not reserve it.
     */
    @Transactional(readOnly = true)
    public String peekQuotationNumber(Long ownerId, int year) {
        return formatQuotationNumber(year, currentValue(ownerId, DocumentType.QUOTATION, year));
    }

    private DocumentSequence lockSequence(Long ownerId, DocumentType type, int year) {
        return sequenceRepository.findForUpdate(ownerId, type, year)
            .orElseGet(() -> sequenceRepository.saveAndFlush(new DocumentSequence(ownerId, type, year)));
    }

    private long currentValue(Long ownerId, DocumentType type, int year) {
        return sequenceRepository.findByOwnerIdAndDocumentTypeAndYear(ownerId, type, year)
            .map(DocumentSequence::getNextValue)
            .orElse(1L);
    }

    private String formatInvoiceNumber(long value) {
        return String.format("%s-%04d", invoicePrefix, value);
    }

    private String formatQuotationNumber(int year, long value) {
        return String.format("%s-%d-%04d", quotationPrefix, year, value);
    }
}
