package com.example.billing.domain;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import java.math.BigDecimal;

/**
 * A line item that stores its derived amounts (invoice and quotation lines).
 */
@MappedSuperclass
public abstract class PricedLine extends LineDetails {

    @Column(name = "line_index")
    private int lineIndex;

    @Column(name = "line_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal lineTotal = Money.ZERO;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount = Money.ZERO;

    protected PricedLine() {
    }

    protected PricedLine(String description, BigDecimal quantity, BigDecimal unitPrice, int taxRate) {
        super(description, quantity, unitPrice, taxRate);
    }

    /**
     * Recomputes line total and tax amount from quantity, unit price and tax rate.
     * Must be called after any change to those fields.
     */
    public void calculateTotals() {
        Money.LineAmounts amounts = Money.calculateLine(getQuantity(), getUnitPrice(), getTaxRate());
        lineTotal = amounts.lineTotal();
        taxAmount = amounts.taxAmount();
    }

    /**
     * Copies description, pricing and the already-computed amounts verbatim.
     */
    protected void copyPricedFrom(PricedLine other) {
        copyDetailsFrom(other);
        this.lineTotal = other.getLineTotal();
        this.taxAmount = other.getTaxAmount();
    }

    public int getLineIndex() {
        return lineIndex;
    }

    public void setLineIndex(int lineIndex) {
        this.lineIndex = lineIndex;
    }

    public BigDecimal getLineTotal() {
        return lineTotal;
    }

    public void setLineTotal(BigDecimal lineTotal) {
        this.lineTotal = lineTotal;
    }

    public BigDecimal getTaxAmount() {
        return taxAmount;
    }

    public void setTaxAmount(BigDecimal taxAmount) {
        this.taxAmount = taxAmount;
    }
}
