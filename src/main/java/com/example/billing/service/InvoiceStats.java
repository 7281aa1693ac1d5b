package com.example.billing.service;

import com.example.billing.domain.Invoice.InvoiceStatus;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Per-owner invoice figures. {@code totalUnpaid} is the sum of DRAFT and SENT invoice totals.
 */
public record InvoiceStats(long invoiceCount, BigDecimal totalInvoiced, BigDecimal totalPaid,
                           BigDecimal totalUnpaid, Map<InvoiceStatus, Long> countByStatus) {
}
