package com.example.billing.service;

import com.example.billing.domain.InvoiceLine;
import com.example.billing.domain.LineDetails;
import com.example.billing.domain.Money;
import com.example.billing.domain.QuotationLine;
import com.example.billing.domain.ScheduleLine;
import com.example.billing.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Caller-supplied line item. A null tax rate means the default rate.
 */
public record LineItemRequest(String description, BigDecimal quantity, BigDecimal unitPrice,
                              Integer taxRate, Long productId) {

    public static LineItemRequest of(String description, BigDecimal quantity, BigDecimal unitPrice, int taxRate) {
        return new LineItemRequest(description, quantity, unitPrice, taxRate, null);
    }

    public static LineItemRequest of(LineDetails line) {
        return new LineItemRequest(line.getDescription(), line.getQuantity(), line.getUnitPrice(),
            line.getTaxRate(), line.getProductId());
    }

    public void validate() {
        if (description == null || description.isBlank()) {
            throw new ValidationException("Line description is required");
        }
        if (description.length() > 255) {
            throw new ValidationException("Line description must be at most 255 characters");
        }
        if (quantity == null || quantity.signum() < 0) {
            throw new ValidationException("Quantity must be zero or positive");
        }
        if (!Money.fitsScale(quantity)) {
            throw new ValidationException("Quantity must have at most two decimals: " + quantity);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new ValidationException("Unit price must be zero or positive");
        }
        if (!Money.fitsScale(unitPrice)) {
            throw new ValidationException("Unit price must have at most two decimals: " + unitPrice);
        }
        if (taxRate != null && (taxRate < 0 || taxRate > 100)) {
            throw new ValidationException("Tax rate must be between 0 and 100, got " + taxRate);
        }
    }

    public int effectiveTaxRate() {
        return taxRate != null ? taxRate : LineDetails.DEFAULT_TAX_RATE;
    }

    public InvoiceLine toInvoiceLine() {
        InvoiceLine line = new InvoiceLine(description.trim(), quantity, unitPrice, effectiveTaxRate());
        line.setProductId(productId);
        line.calculateTotals();
        return line;
    }

    public QuotationLine toQuotationLine() {
        QuotationLine line = new QuotationLine(description.trim(), quantity, unitPrice, effectiveTaxRate());
        line.setProductId(productId);
        line.calculateTotals();
        return line;
    }

    public ScheduleLine toScheduleLine() {
        ScheduleLine line = new ScheduleLine(description.trim(), quantity, unitPrice, effectiveTaxRate());
        line.setProductId(productId);
        return line;
    }

    /**
     * Writes this request's fields onto an existing line. Derived amounts are
     * left to the caller.
     */
    public void applyTo(LineDetails line) {
        line.setDescription(description.trim());
        line.setQuantity(quantity);
        line.setUnitPrice(unitPrice);
        line.setTaxRate(effectiveTaxRate());
        line.setProductId(productId);
    }

    static void validateAll(Iterable<LineItemRequest> lines) {
        if (lines == null) {
            return;
        }
        for (LineItemRequest line : lines) {
            if (line == null) {
                throw new ValidationException("Line item must not be null");
            }
            line.validate();
        }
    }
}
