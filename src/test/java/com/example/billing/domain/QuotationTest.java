package com.example.billing.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.example.billing.domain.Quotation.QuotationStatus;
import com.example.billing.exception.ValidationException;

/** Unit tests for Quotation status rules and conversion marking. */
class QuotationTest {

  @Test
  void canTransitionTo_ConvertedNeverATarget() {
    for (QuotationStatus from : QuotationStatus.values()) {
      assertFalse(from.canTransitionTo(QuotationStatus.CONVERTED), from + " -> CONVERTED");
    }
  }

  @Test
  void canTransitionTo_FromConverted_AlwaysFalse() {
    for (QuotationStatus to : QuotationStatus.values()) {
      assertFalse(QuotationStatus.CONVERTED.canTransitionTo(to));
    }
  }

  @Test
  void canTransitionTo_BetweenOpenStatuses_Allowed() {
    assertTrue(QuotationStatus.DRAFT.canTransitionTo(QuotationStatus.SENT));
    assertTrue(QuotationStatus.SENT.canTransitionTo(QuotationStatus.ACCEPTED));
    assertTrue(QuotationStatus.SENT.canTransitionTo(QuotationStatus.REJECTED));
    assertTrue(QuotationStatus.REJECTED.canTransitionTo(QuotationStatus.DRAFT));
  }

  @Test
  void parse_Unknown_ThrowsValidationException() {
    assertThrows(ValidationException.class, () -> QuotationStatus.parse("pending"));
  }

  @Test
  void markConverted_RecordsInvoiceLink() {
    Quotation quotation =
        new Quotation(1L, new Customer(1L, "Acme Ltd"), "QUO-2026-0001", LocalDate.now(), null);
    QuotationLine line = new QuotationLine("Audit", new BigDecimal("2"), new BigDecimal("150.00"), 20);
    line.calculateTotals();
    quotation.addLine(line);
    quotation.recalculateTotals();

    quotation.markConverted(42L);

    assertTrue(quotation.isConverted());
    assertEquals(QuotationStatus.CONVERTED, quotation.getStatus());
    assertEquals(42L, quotation.getConvertedInvoiceId());
    assertNotNull(quotation.getConvertedAt());
    assertEquals(new BigDecimal("360.00"), quotation.getTotals().total());
  }
}
