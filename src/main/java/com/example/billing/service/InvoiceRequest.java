package com.example.billing.service;

import com.example.billing.domain.Invoice.InvoiceStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * Header and lines of an invoice to create. A null status means DRAFT.
 */
public record InvoiceRequest(Long customerId, LocalDate invoiceDate, LocalDate dueDate,
                             InvoiceStatus status, String notes, List<LineItemRequest> lines) {
}
