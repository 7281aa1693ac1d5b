package com.example.billing.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary arithmetic for billing documents.
 *
 * All amounts are carried at two fractional digits, rounded half-up.
 * Rounding is applied per line, never on an aggregated sum: a document's
 * tax total is the sum of already-rounded line tax amounts.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
    }

    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    /**
     * Net amount of a line: quantity x unit price, rounded.
     */
    public static BigDecimal lineTotal(BigDecimal quantity, BigDecimal unitPrice) {
        return round(quantity.multiply(unitPrice));
    }

    /**
     * Tax on an already-rounded line total for an integer percentage rate.
     */
    public static BigDecimal taxAmount(BigDecimal lineTotal, int taxRate) {
        return round(lineTotal.multiply(BigDecimal.valueOf(taxRate)).divide(HUNDRED));
    }

    /**
     * Calculates both derived amounts for a single line.
     * Inputs are assumed to be validated (non-negative, rate within 0..100).
     */
    public static LineAmounts calculateLine(BigDecimal quantity, BigDecimal unitPrice, int taxRate) {
        BigDecimal lineTotal = lineTotal(quantity, unitPrice);
        return new LineAmounts(lineTotal, taxAmount(lineTotal, taxRate));
    }

    /**
     * True when the value can be stored at the monetary scale without rounding.
     */
    public static boolean fitsScale(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= SCALE;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Derived amounts of one line.
     */
    public record LineAmounts(BigDecimal lineTotal, BigDecimal taxAmount) {
    }
}
