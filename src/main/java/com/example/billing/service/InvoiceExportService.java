package com.example.billing.service;

import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.repository.InvoiceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only export of invoices to the fixed export schema, UBL XML and PDF.
 */
@Service
@Transactional(readOnly = true)
public class InvoiceExportService {

    private final InvoiceRepository invoiceRepository;
    private final UblInvoiceWriter ublWriter;
    private final InvoicePdfService pdfService;

    public InvoiceExportService(InvoiceRepository invoiceRepository,
                                UblInvoiceWriter ublWriter,
                                InvoicePdfService pdfService) {
        this.invoiceRepository = invoiceRepository;
        this.ublWriter = ublWriter;
        this.pdfService = pdfService;
    }

    public InvoiceExport export(Long ownerId, Long invoiceId) {
        return invoiceRepository.findByIdAndOwnerId(invoiceId, ownerId)
            .map(InvoiceExport::of)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    public String exportUbl(Long ownerId, Long invoiceId) {
        return ublWriter.write(export(ownerId, invoiceId));
    }

    public byte[] exportPdf(Long ownerId, Long invoiceId) {
        return pdfService.render(export(ownerId, invoiceId));
    }
}
