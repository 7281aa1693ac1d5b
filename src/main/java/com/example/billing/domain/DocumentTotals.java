package com.example.billing.domain;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Subtotal, tax total and grand total of a billing document, always computed
 * from the document's full current set of lines.
 */
public record DocumentTotals(BigDecimal subtotal, BigDecimal taxTotal, BigDecimal total) {

    public static final DocumentTotals EMPTY = new DocumentTotals(Money.ZERO, Money.ZERO, Money.ZERO);

    public static DocumentTotals of(Collection<? extends PricedLine> lines) {
        BigDecimal subtotal = Money.ZERO;
        BigDecimal taxTotal = Money.ZERO;
        for (PricedLine line : lines) {
            subtotal = subtotal.add(line.getLineTotal() != null ? line.getLineTotal() : Money.ZERO);
            taxTotal = taxTotal.add(line.getTaxAmount() != null ? line.getTaxAmount() : Money.ZERO);
        }
        return new DocumentTotals(subtotal, taxTotal, subtotal.add(taxTotal));
    }
}
