package com.example.billing.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.domain.Customer;
import com.example.billing.domain.Invoice;
import com.example.billing.domain.Invoice.InvoiceStatus;
import com.example.billing.domain.InvoiceLine;
import com.example.billing.domain.Payment;
import com.example.billing.exception.InvalidStateException;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.exception.ValidationException;
import com.example.billing.repository.CustomerRepository;
import com.example.billing.repository.InvoiceRepository;
import com.example.billing.repository.PaymentRepository;

/** Unit tests for InvoiceService. */
@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

  private static final Long OWNER_ID = 1L;
  private static final Long CUSTOMER_ID = 10L;
  private static final LocalDate INVOICE_DATE = LocalDate.of(2026, 3, 1);

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private CustomerRepository customerRepository;
  @Mock private PaymentRepository paymentRepository;
  @Mock private DocumentNumberService numberService;
  @Mock private AuditService auditService;

  private InvoiceService invoiceService;
  private Customer customer;

  @BeforeEach
  void setUp() {
    invoiceService =
        new InvoiceService(
            invoiceRepository, customerRepository, paymentRepository, numberService, auditService);

    customer = new Customer(OWNER_ID, "Acme Ltd");
    customer.setId(CUSTOMER_ID);
  }

  private void stubSaveAssigningId() {
    when(invoiceRepository.save(any(Invoice.class)))
        .thenAnswer(
            invocation -> {
              Invoice saved = invocation.getArgument(0);
              if (saved.getId() == null) {
                saved.setId(100L);
              }
              return saved;
            });
  }

  private Invoice existingInvoice(InvoiceStatus status, String... linePrices) {
    Invoice invoice = new Invoice(OWNER_ID, customer, "INV-0001", INVOICE_DATE, null);
    invoice.setId(100L);
    invoice.setStatus(status);
    long lineId = 1;
    for (String price : linePrices) {
      InvoiceLine line = new InvoiceLine("Item " + lineId, BigDecimal.ONE, new BigDecimal(price), 20);
      line.setId(lineId++);
      line.calculateTotals();
      invoice.addLine(line);
    }
    invoice.recalculateTotals();
    return invoice;
  }

  @Test
  void create_ValidRequest_NumbersAndTotalsInvoice() {
    // Given
    when(customerRepository.findByIdAndOwnerId(CUSTOMER_ID, OWNER_ID)).thenReturn(Optional.of(customer));
    when(numberService.nextInvoiceNumber(OWNER_ID)).thenReturn("INV-0001");
    stubSaveAssigningId();

    InvoiceRequest request =
        new InvoiceRequest(
            CUSTOMER_ID,
            INVOICE_DATE,
            INVOICE_DATE.plusDays(30),
            null,
            "March services",
            List.of(
                LineItemRequest.of("Consulting", new BigDecimal("3"), new BigDecimal("33.33"), 18),
                new LineItemRequest("Hosting", BigDecimal.ONE, new BigDecimal("10.00"), null, null)));

    // When
    Invoice invoice = invoiceService.create(OWNER_ID, request);

    // Then
    assertEquals(100L, invoice.getId());
    assertEquals("INV-0001", invoice.getInvoiceNumber());
    assertEquals(InvoiceStatus.DRAFT, invoice.getStatus());
    assertEquals(2, invoice.getLines().size());
    assertEquals(20, invoice.getLines().get(1).getTaxRate());
    assertEquals(new BigDecimal("109.99"), invoice.getSubtotal());
    assertEquals(new BigDecimal("20.00"), invoice.getTaxTotal());
    assertEquals(new BigDecimal("129.99"), invoice.getTotal());
    assertEquals(new BigDecimal("0.00"), invoice.getAmountPaid());
    verify(auditService).logEvent(eq(OWNER_ID), eq(Action.CREATE), eq(AuditService.INVOICE), eq(100L), anyString());
  }

  @Test
  void create_NegativeQuantity_RejectedBeforeNumbering() {
    InvoiceRequest request =
        new InvoiceRequest(
            CUSTOMER_ID, INVOICE_DATE, null, null, null,
            List.of(LineItemRequest.of("Broken", new BigDecimal("-1"), BigDecimal.TEN, 20)));

    assertThrows(ValidationException.class, () -> invoiceService.create(OWNER_ID, request));
    verifyNoInteractions(numberService, invoiceRepository);
  }

  @Test
  void create_TaxRateOutOfRange_Rejected() {
    InvoiceRequest request =
        new InvoiceRequest(
            CUSTOMER_ID, INVOICE_DATE, null, null, null,
            List.of(LineItemRequest.of("Broken", BigDecimal.ONE, BigDecimal.TEN, 101)));

    assertThrows(ValidationException.class, () -> invoiceService.create(OWNER_ID, request));
  }

  @Test
  void create_DueDateBeforeInvoiceDate_Rejected() {
    InvoiceRequest request =
        new InvoiceRequest(CUSTOMER_ID, INVOICE_DATE, INVOICE_DATE.minusDays(1), null, null, List.of());

    assertThrows(ValidationException.class, () -> invoiceService.create(OWNER_ID, request));
  }

  @Test
  void create_PaidStatus_Rejected() {
    InvoiceRequest request =
        new InvoiceRequest(CUSTOMER_ID, INVOICE_DATE, null, InvoiceStatus.PAID, null, List.of());

    assertThrows(ValidationException.class, () -> invoiceService.create(OWNER_ID, request));
  }

  @Test
  void create_UnknownCustomer_ThrowsNotFound() {
    when(customerRepository.findByIdAndOwnerId(CUSTOMER_ID, OWNER_ID)).thenReturn(Optional.empty());
    InvoiceRequest request = new InvoiceRequest(CUSTOMER_ID, INVOICE_DATE, null, null, null, List.of());

    assertThrows(ResourceNotFoundException.class, () -> invoiceService.create(OWNER_ID, request));
    verifyNoInteractions(numberService);
  }

  @Test
  void get_OtherOwner_ThrowsNotFound() {
    when(invoiceRepository.findByIdAndOwnerId(100L, 2L)).thenReturn(Optional.empty());

    ResourceNotFoundException error =
        assertThrows(ResourceNotFoundException.class, () -> invoiceService.get(2L, 100L));
    assertEquals("Invoice not found with id 100", error.getMessage());
  }

  @Test
  void addLine_RecalculatesFromAllLines() {
    // Given
    Invoice invoice = existingInvoice(InvoiceStatus.DRAFT, "100.00");
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));
    stubSaveAssigningId();

    // When
    Invoice updated =
        invoiceService.addLine(
            OWNER_ID, 100L, LineItemRequest.of("Extra", new BigDecimal("2"), new BigDecimal("25.00"), 10));

    // Then
    assertEquals(new BigDecimal("150.00"), updated.getSubtotal());
    assertEquals(new BigDecimal("25.00"), updated.getTaxTotal());
    assertEquals(new BigDecimal("175.00"), updated.getTotal());
  }

  @Test
  void updateLine_RecomputesLineAndTotals() {
    Invoice invoice = existingInvoice(InvoiceStatus.SENT, "100.00", "50.00");
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));
    stubSaveAssigningId();

    Invoice updated =
        invoiceService.updateLine(
            OWNER_ID, 100L, 2L, LineItemRequest.of("Item 2", new BigDecimal("3"), new BigDecimal("50.00"), 0));

    assertEquals(new BigDecimal("150.00"), updated.getLines().get(1).getLineTotal());
    assertEquals(new BigDecimal("250.00"), updated.getSubtotal());
    assertEquals(new BigDecimal("20.00"), updated.getTaxTotal());
    assertEquals(new BigDecimal("270.00"), updated.getTotal());
  }

  @Test
  void removeLine_UnknownLine_ThrowsNotFound() {
    Invoice invoice = existingInvoice(InvoiceStatus.DRAFT, "100.00");
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));

    assertThrows(ResourceNotFoundException.class, () -> invoiceService.removeLine(OWNER_ID, 100L, 99L));
  }

  @Test
  void removeLine_LastLine_TotalsBecomeZero() {
    Invoice invoice = existingInvoice(InvoiceStatus.DRAFT, "100.00");
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));
    stubSaveAssigningId();

    Invoice updated = invoiceService.removeLine(OWNER_ID, 100L, 1L);

    assertTrue(updated.getLines().isEmpty());
    assertEquals(new BigDecimal("0.00"), updated.getTotal());
    assertEquals(InvoiceStatus.DRAFT, updated.getStatus());
  }

  @Test
  void removeLine_TotalWouldFallBelowPaid_Rejected() {
    // Given
    Invoice invoice = existingInvoice(InvoiceStatus.SENT, "100.00", "50.00");
    invoice.addPayment(new Payment(new BigDecimal("150.00"), INVOICE_DATE, Payment.PaymentMethod.BANK_TRANSFER));
    invoice.recalculateAmountPaid();
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));

    // When / Then
    assertThrows(InvalidStateException.class, () -> invoiceService.removeLine(OWNER_ID, 100L, 1L));
    verify(invoiceRepository, never()).save(any());
  }

  @Test
  void removeLine_RemainingTotalCoveredByPayments_MarksPaid() {
    // Given: 120.00 + 60.00 invoice with 60.00 already paid
    Invoice invoice = existingInvoice(InvoiceStatus.SENT, "100.00", "50.00");
    invoice.addPayment(new Payment(new BigDecimal("60.00"), INVOICE_DATE, Payment.PaymentMethod.BANK_TRANSFER));
    invoice.recalculateAmountPaid();
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));
    stubSaveAssigningId();

    // When
    Invoice updated = invoiceService.removeLine(OWNER_ID, 100L, 1L);

    // Then
    assertEquals(new BigDecimal("60.00"), updated.getTotal());
    assertEquals(new BigDecimal("0.00"), updated.getRemainingAmount());
    assertEquals(InvoiceStatus.PAID, updated.getStatus());
    verify(auditService)
        .logEvent(eq(OWNER_ID), eq(Action.STATUS_CHANGE), eq(AuditService.INVOICE), eq(100L), contains("to PAID"));
  }

  @Test
  void addLine_PartlyPaidInvoice_StaysSent() {
    Invoice invoice = existingInvoice(InvoiceStatus.SENT, "100.00");
    invoice.addPayment(new Payment(new BigDecimal("50.00"), INVOICE_DATE, Payment.PaymentMethod.CASH));
    invoice.recalculateAmountPaid();
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));
    stubSaveAssigningId();

    Invoice updated =
        invoiceService.addLine(OWNER_ID, 100L, LineItemRequest.of("Extra", BigDecimal.ONE, BigDecimal.TEN, 0));

    assertEquals(new BigDecimal("130.00"), updated.getTotal());
    assertEquals(InvoiceStatus.SENT, updated.getStatus());
    verify(auditService, never())
        .logEvent(anyLong(), eq(Action.STATUS_CHANGE), anyString(), anyLong(), anyString());
  }

  @Test
  void addLine_QuantityWithThreeDecimals_RejectedBeforeLookup() {
    ValidationException error =
        assertThrows(
            ValidationException.class,
            () ->
                invoiceService.addLine(
                    OWNER_ID, 100L, LineItemRequest.of("Fraction", new BigDecimal("0.333"), new BigDecimal("3.00"), 0)));

    assertTrue(error.getMessage().contains("0.333"));
    verifyNoInteractions(invoiceRepository);
  }

  @Test
  void addLine_UnitPriceWithThreeDecimals_Rejected() {
    assertThrows(
        ValidationException.class,
        () ->
            invoiceService.addLine(
                OWNER_ID, 100L, LineItemRequest.of("Fraction", BigDecimal.ONE, new BigDecimal("1.005"), 0)));
  }

  @Test
  void addLine_TrailingZerosBeyondTwoDecimals_Accepted() {
    Invoice invoice = existingInvoice(InvoiceStatus.DRAFT);
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));
    stubSaveAssigningId();

    Invoice updated =
        invoiceService.addLine(
            OWNER_ID, 100L, LineItemRequest.of("Kilos", new BigDecimal("1.500"), new BigDecimal("2.000"), 0));

    assertEquals(new BigDecimal("3.00"), updated.getTotal());
  }

  @Test
  void addLine_PaidInvoice_Rejected() {
    Invoice invoice = existingInvoice(InvoiceStatus.PAID, "100.00");
    when(invoiceRepository.findForUpdate(100L, OWNER_ID)).thenReturn(Optional.of(invoice));

    assertThrows(
        InvalidStateException.class,
        () -> invoiceService.addLine(OWNER_ID, 100L, LineItemRequest.of("Late", BigDecimal.ONE, BigDecimal.TEN, 20)));
  }

  @Test
  void changeStatus_AnyTargetAccepted() {
    // Given
    Invoice invoice = existingInvoice(InvoiceStatus.CANCELLED, "100.00");
    when(invoiceRepository.findByIdAndOwnerId(100L, OWNER_ID)).thenReturn(Optional.of(invoice));
    stubSaveAssigningId();

    // When
    Invoice updated = invoiceService.changeStatus(OWNER_ID, 100L, "draft");

    // Then
    assertEquals(InvoiceStatus.DRAFT, updated.getStatus());
    verify(auditService)
        .logEvent(eq(OWNER_ID), eq(Action.STATUS_CHANGE), eq(AuditService.INVOICE), eq(100L), contains("CANCELLED"));
  }

  @Test
  void changeStatus_SameStatus_NoWrite() {
    Invoice invoice = existingInvoice(InvoiceStatus.SENT, "100.00");
    when(invoiceRepository.findByIdAndOwnerId(100L, OWNER_ID)).thenReturn(Optional.of(invoice));

    invoiceService.changeStatus(OWNER_ID, 100L, InvoiceStatus.SENT);

    verify(invoiceRepository, never()).save(any());
    verifyNoInteractions(auditService);
  }

  @Test
  void changeStatus_UnknownName_ThrowsValidation() {
    assertThrows(ValidationException.class, () -> invoiceService.changeStatus(OWNER_ID, 100L, "archived"));
  }

  @Test
  void getStats_AggregatesRepositorySums() {
    // Given
    when(invoiceRepository.countByOwnerIdAndStatus(eq(OWNER_ID), any(InvoiceStatus.class))).thenReturn(1L);
    when(invoiceRepository.countByOwnerId(OWNER_ID)).thenReturn(4L);
    when(invoiceRepository.sumTotalByOwner(OWNER_ID)).thenReturn(new BigDecimal("1000"));
    when(paymentRepository.sumByOwner(OWNER_ID)).thenReturn(null);
    when(invoiceRepository.sumTotalByOwnerAndStatusIn(eq(OWNER_ID), anyList())).thenReturn(new BigDecimal("250.5"));

    // When
    InvoiceStats stats = invoiceService.getStats(OWNER_ID);

    // Then
    assertEquals(4L, stats.invoiceCount());
    assertEquals(new BigDecimal("1000.00"), stats.totalInvoiced());
    assertEquals(new BigDecimal("0.00"), stats.totalPaid());
    assertEquals(new BigDecimal("250.50"), stats.totalUnpaid());
    assertEquals(1L, stats.countByStatus().get(InvoiceStatus.PAID));
  }
}
