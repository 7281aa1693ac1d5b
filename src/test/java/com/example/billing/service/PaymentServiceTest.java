package com.example.billing.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.domain.Customer;
import com.example.billing.domain.Invoice;
import com.example.billing.domain.Invoice.InvoiceStatus;
import com.example.billing.domain.InvoiceLine;
import com.example.billing.domain.Payment;
import com.example.billing.event.PaymentRecordedEvent;
import com.example.billing.exception.InvalidStateException;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.exception.ValidationException;
import com.example.billing.repository.InvoiceRepository;
import com.example.billing.repository.PaymentRepository;

/** Unit tests for PaymentService: payment application, overpayment guard and status effects. */
@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

  private static final Long OWNER_ID = 1L;
  private static final Long INVOICE_ID = 100L;
  private static final LocalDate PAYMENT_DATE = LocalDate.of(2026, 4, 10);

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private PaymentRepository paymentRepository;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private PaymentService paymentService;
  private Invoice invoice;
  private final AtomicLong paymentIds = new AtomicLong(500);

  @BeforeEach
  void setUp() {
    paymentService = new PaymentService(invoiceRepository, paymentRepository, auditService, eventPublisher);

    Customer customer = new Customer(OWNER_ID, "Acme Ltd");
    customer.setId(10L);
    // 1000.00 net + 20% tax = 1200.00
    invoice = new Invoice(OWNER_ID, customer, "INV-0007", LocalDate.of(2026, 4, 1), null);
    invoice.setId(INVOICE_ID);
    invoice.setStatus(InvoiceStatus.SENT);
    InvoiceLine line = new InvoiceLine("Annual licence", BigDecimal.ONE, new BigDecimal("1000.00"), 20);
    line.calculateTotals();
    invoice.addLine(line);
    invoice.recalculateTotals();
  }

  private void stubInvoiceLookup() {
    when(invoiceRepository.findForUpdate(INVOICE_ID, OWNER_ID)).thenReturn(Optional.of(invoice));
  }

  private void stubSaves() {
    when(paymentRepository.save(any(Payment.class)))
        .thenAnswer(
            invocation -> {
              Payment payment = invocation.getArgument(0);
              payment.setId(paymentIds.incrementAndGet());
              return payment;
            });
    when(invoiceRepository.save(any(Invoice.class))).thenAnswer(invocation -> invocation.getArgument(0));
  }

  @Test
  void applyPayment_PartialThenFull_MarksInvoicePaid() {
    // Given
    stubInvoiceLookup();
    stubSaves();

    // When
    paymentService.applyPayment(OWNER_ID, INVOICE_ID, PaymentRequest.of(new BigDecimal("700"), PAYMENT_DATE));

    // Then
    assertEquals(new BigDecimal("700.00"), invoice.getAmountPaid());
    assertEquals(new BigDecimal("500.00"), invoice.getRemainingAmount());
    assertEquals(InvoiceStatus.SENT, invoice.getStatus());

    // When
    paymentService.applyPayment(OWNER_ID, INVOICE_ID, PaymentRequest.of(new BigDecimal("500.00"), PAYMENT_DATE));

    // Then
    assertEquals(new BigDecimal("1200.00"), invoice.getAmountPaid());
    assertEquals(new BigDecimal("0.00"), invoice.getRemainingAmount());
    assertEquals(InvoiceStatus.PAID, invoice.getStatus());
    verify(auditService)
        .logEvent(eq(OWNER_ID), eq(Action.STATUS_CHANGE), eq(AuditService.INVOICE), eq(INVOICE_ID), anyString());

    // Any further payment is rejected
    InvalidStateException error =
        assertThrows(
            InvalidStateException.class,
            () -> paymentService.applyPayment(
                OWNER_ID, INVOICE_ID, PaymentRequest.of(new BigDecimal("0.01"), PAYMENT_DATE)));
    assertTrue(error.getMessage().contains("Maximum allowed: 0.00"));
    assertEquals(2, invoice.getPayments().size());
    // The balance check always reads the invoice under a row lock
    verify(invoiceRepository, times(3)).findForUpdate(INVOICE_ID, OWNER_ID);
    verify(invoiceRepository, never()).findByIdAndOwnerId(any(), any());
  }

  @Test
  void applyPayment_Overpayment_RejectedWithRemainingInMessage() {
    // Given
    stubInvoiceLookup();

    // When
    InvalidStateException error =
        assertThrows(
            InvalidStateException.class,
            () -> paymentService.applyPayment(
                OWNER_ID, INVOICE_ID, PaymentRequest.of(new BigDecimal("1200.01"), PAYMENT_DATE)));

    // Then
    assertTrue(error.getMessage().contains("Maximum allowed: 1200.00"));
    assertTrue(invoice.getPayments().isEmpty());
    verifyNoInteractions(paymentRepository, eventPublisher);
  }

  @Test
  void applyPayment_CancelledInvoice_Rejected() {
    invoice.setStatus(InvoiceStatus.CANCELLED);
    stubInvoiceLookup();

    assertThrows(
        InvalidStateException.class,
        () -> paymentService.applyPayment(OWNER_ID, INVOICE_ID, PaymentRequest.of(BigDecimal.TEN, PAYMENT_DATE)));
    verifyNoInteractions(paymentRepository);
  }

  @Test
  void applyPayment_NonPositiveAmount_Rejected() {
    assertThrows(
        ValidationException.class,
        () -> paymentService.applyPayment(OWNER_ID, INVOICE_ID, PaymentRequest.of(BigDecimal.ZERO, PAYMENT_DATE)));
    assertThrows(
        ValidationException.class,
        () -> paymentService.applyPayment(
            OWNER_ID, INVOICE_ID, PaymentRequest.of(new BigDecimal("-5"), PAYMENT_DATE)));
    assertThrows(
        ValidationException.class,
        () -> paymentService.applyPayment(OWNER_ID, INVOICE_ID, PaymentRequest.of(null, PAYMENT_DATE)));
    verifyNoInteractions(invoiceRepository);
  }

  @Test
  void applyPayment_MoreThanTwoDecimals_Rejected() {
    assertThrows(
        ValidationException.class,
        () -> paymentService.applyPayment(
            OWNER_ID, INVOICE_ID, PaymentRequest.of(new BigDecimal("10.005"), PAYMENT_DATE)));
  }

  @Test
  void applyPayment_DraftInvoiceFullyPaid_MovesToPaid() {
    invoice.setStatus(InvoiceStatus.DRAFT);
    stubInvoiceLookup();
    stubSaves();

    paymentService.applyPayment(OWNER_ID, INVOICE_ID, PaymentRequest.of(new BigDecimal("1200"), PAYMENT_DATE));

    assertEquals(InvoiceStatus.PAID, invoice.getStatus());
  }

  @Test
  void applyPayment_PublishesEventWithRemainingBalance() {
    // Given
    stubInvoiceLookup();
    stubSaves();

    // When
    Payment payment =
        paymentService.applyPayment(
            OWNER_ID,
            INVOICE_ID,
            new PaymentRequest(new BigDecimal("200.00"), null, Payment.PaymentMethod.CASH, "Deposit"));

    // Then
    assertEquals(LocalDate.now(), payment.getPaymentDate());
    assertEquals(Payment.PaymentMethod.CASH, payment.getMethod());
    ArgumentCaptor<PaymentRecordedEvent> captor = ArgumentCaptor.forClass(PaymentRecordedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    PaymentRecordedEvent event = captor.getValue();
    assertEquals(INVOICE_ID, event.invoiceId());
    assertEquals(payment.getId(), event.paymentId());
    assertEquals(new BigDecimal("1000.00"), event.remainingAmount());
    assertFalse(event.fullyPaid());
  }

  @Test
  void removePayment_FromPaidInvoice_RevertsToSent() {
    // Given
    Payment first = new Payment(new BigDecimal("700.00"), PAYMENT_DATE, Payment.PaymentMethod.CASH);
    first.setId(1L);
    Payment second = new Payment(new BigDecimal("500.00"), PAYMENT_DATE, Payment.PaymentMethod.CASH);
    second.setId(2L);
    invoice.addPayment(first);
    invoice.addPayment(second);
    invoice.recalculateAmountPaid();
    invoice.setStatus(InvoiceStatus.PAID);
    stubInvoiceLookup();
    when(invoiceRepository.save(any(Invoice.class))).thenAnswer(invocation -> invocation.getArgument(0));

    // When
    Invoice updated = paymentService.removePayment(OWNER_ID, INVOICE_ID, 2L);

    // Then
    assertEquals(new BigDecimal("700.00"), updated.getAmountPaid());
    assertEquals(InvoiceStatus.SENT, updated.getStatus());
    assertEquals(List.of(first), updated.getPayments());
    verify(auditService)
        .logEvent(eq(OWNER_ID), eq(Action.PAYMENT_REMOVED), eq(AuditService.PAYMENT), eq(2L), anyString());
  }

  @Test
  void removePayment_UnknownPayment_ThrowsNotFound() {
    stubInvoiceLookup();

    assertThrows(
        ResourceNotFoundException.class, () -> paymentService.removePayment(OWNER_ID, INVOICE_ID, 99L));
  }
}
