package com.example.billing.service;

import java.time.LocalDate;

/**
 * Editable header fields shared by invoices and quotations. {@code dueDate}
 * is the payment due date of an invoice or the validity date of a quotation.
 */
public record DocumentHeader(Long customerId, LocalDate documentDate, LocalDate dueDate, String notes) {
}
