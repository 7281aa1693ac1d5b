package com.example.billing.service;

import com.example.billing.domain.Payment.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A payment to apply. A null date means today; a null method means bank transfer.
 */
public record PaymentRequest(BigDecimal amount, LocalDate paymentDate, PaymentMethod method, String notes) {

    public static PaymentRequest of(BigDecimal amount, LocalDate paymentDate) {
        return new PaymentRequest(amount, paymentDate, null, null);
    }
}
