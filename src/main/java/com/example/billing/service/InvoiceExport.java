package com.example.billing.service;

import com.example.billing.domain.Customer;
import com.example.billing.domain.Invoice;
import com.example.billing.domain.InvoiceLine;
import com.example.billing.domain.Money;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fixed-schema, read-only view of an invoice for the XML and PDF renderers.
 * Amounts are the stored 2-decimal values, unformatted.
 */
public record InvoiceExport(
    String invoiceNumber,
    LocalDate invoiceDate,
    LocalDate dueDate,
    String status,
    String notes,
    Instant createdAt,
    Party customer,
    List<Line> lines,
    BigDecimal subtotal,
    BigDecimal taxTotal,
    BigDecimal total,
    BigDecimal amountPaid,
    BigDecimal remainingAmount) {

    public record Party(String name, String taxNumber, String taxOffice, String email, String address, String city) {
    }

    public record Line(int lineNumber, String description, BigDecimal quantity, BigDecimal unitPrice,
                       int taxRate, BigDecimal lineTotal, BigDecimal taxAmount) {
    }

    /** Taxable base and tax of all lines sharing one rate. */
    public record TaxGroup(int rate, BigDecimal taxableAmount, BigDecimal taxAmount) {
    }

    public static InvoiceExport of(Invoice invoice) {
        Customer customer = invoice.getCustomer();
        Party party = new Party(customer.getCompanyName(), customer.getTaxNumber(), customer.getTaxOffice(),
            customer.getEmail(), customer.getAddress(), customer.getCity());

        List<Line> lines = new ArrayList<>();
        int number = 1;
        for (InvoiceLine line : invoice.getLines()) {
            lines.add(new Line(number++, line.getDescription(), line.getQuantity(), line.getUnitPrice(),
                line.getTaxRate(), line.getLineTotal(), line.getTaxAmount()));
        }

        return new InvoiceExport(invoice.getInvoiceNumber(), invoice.getInvoiceDate(), invoice.getDueDate(),
            invoice.getStatus().name(), invoice.getNotes(), invoice.getCreatedAt(), party,
            Collections.unmodifiableList(lines), invoice.getSubtotal(), invoice.getTaxTotal(), invoice.getTotal(),
            invoice.getAmountPaid(), invoice.getRemainingAmount());
    }

    /**
     * Line amounts grouped by tax rate, lowest rate first.
     */
    public List<TaxGroup> taxGroups() {
        Map<Integer, BigDecimal[]> byRate = new TreeMap<>();
        for (Line line : lines) {
            BigDecimal[] sums = byRate.computeIfAbsent(line.taxRate(), r -> new BigDecimal[]{Money.ZERO, Money.ZERO});
            sums[0] = sums[0].add(line.lineTotal());
            sums[1] = sums[1].add(line.taxAmount());
        }
        List<TaxGroup> groups = new ArrayList<>();
        byRate.forEach((rate, sums) -> groups.add(new TaxGroup(rate, sums[0], sums[1])));
        return groups;
    }
}
