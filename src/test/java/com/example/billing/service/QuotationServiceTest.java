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
import com.example.billing.domain.Quotation;
import com.example.billing.domain.Quotation.QuotationStatus;
import com.example.billing.domain.QuotationLine;
import com.example.billing.exception.InvalidStateException;
import com.example.billing.exception.ValidationException;
import com.example.billing.repository.CustomerRepository;
import com.example.billing.repository.InvoiceRepository;
import com.example.billing.repository.QuotationRepository;

/** Unit tests for QuotationService, including conversion into invoices. */
@ExtendWith(MockitoExtension.class)
class QuotationServiceTest {

  private static final Long OWNER_ID = 1L;
  private static final Long CUSTOMER_ID = 10L;
  private static final Long QUOTATION_ID = 50L;

  @Mock private QuotationRepository quotationRepository;
  @Mock private InvoiceRepository invoiceRepository;
  @Mock private CustomerRepository customerRepository;
  @Mock private DocumentNumberService numberService;
  @Mock private AuditService auditService;

  private QuotationService quotationService;
  private Customer customer;

  @BeforeEach
  void setUp() {
    quotationService =
        new QuotationService(
            quotationRepository, invoiceRepository, customerRepository, numberService, auditService);

    customer = new Customer(OWNER_ID, "Acme Ltd");
    customer.setId(CUSTOMER_ID);
  }

  private Quotation existingQuotation(QuotationStatus status) {
    Quotation quotation =
        new Quotation(OWNER_ID, customer, "QUO-2026-0004", LocalDate.of(2026, 2, 1), LocalDate.of(2026, 3, 1));
    quotation.setId(QUOTATION_ID);
    quotation.setNotes("Valid for 30 days");
    QuotationLine first = new QuotationLine("Website redesign", BigDecimal.ONE, new BigDecimal("2500.00"), 20);
    first.setId(1L);
    first.calculateTotals();
    QuotationLine second = new QuotationLine("Hosting", new BigDecimal("12"), new BigDecimal("15.50"), 20);
    second.setId(2L);
    second.calculateTotals();
    quotation.addLine(first);
    quotation.addLine(second);
    quotation.recalculateTotals();
    if (status == QuotationStatus.CONVERTED) {
      quotation.markConverted(300L);
    } else {
      quotation.setStatus(status);
    }
    return quotation;
  }

  private void stubQuotationLookup(Quotation quotation) {
    when(quotationRepository.findByIdAndOwnerId(QUOTATION_ID, OWNER_ID)).thenReturn(Optional.of(quotation));
  }

  @Test
  void create_NumbersByCurrentYear() {
    // Given
    int year = LocalDate.now().getYear();
    when(customerRepository.findByIdAndOwnerId(CUSTOMER_ID, OWNER_ID)).thenReturn(Optional.of(customer));
    when(numberService.nextQuotationNumber(OWNER_ID, year)).thenReturn("QUO-" + year + "-0001");
    when(quotationRepository.save(any(Quotation.class))).thenAnswer(invocation -> invocation.getArgument(0));

    // When
    Quotation quotation =
        quotationService.create(
            OWNER_ID,
            new QuotationRequest(
                CUSTOMER_ID,
                LocalDate.now(),
                null,
                null,
                List.of(LineItemRequest.of("Audit", new BigDecimal("2"), new BigDecimal("150.00"), 20))));

    // Then
    assertEquals("QUO-" + year + "-0001", quotation.getQuotationNumber());
    assertEquals(QuotationStatus.DRAFT, quotation.getStatus());
    assertEquals(new BigDecimal("360.00"), quotation.getTotal());
  }

  @Test
  void create_ValidUntilBeforeDate_Rejected() {
    LocalDate date = LocalDate.of(2026, 2, 1);
    QuotationRequest request = new QuotationRequest(CUSTOMER_ID, date, date.minusDays(1), null, List.of());

    assertThrows(ValidationException.class, () -> quotationService.create(OWNER_ID, request));
    verifyNoInteractions(numberService);
  }

  @Test
  void convertToInvoice_CopiesLinesAndQuotedTotals() {
    // Given
    Quotation quotation = existingQuotation(QuotationStatus.ACCEPTED);
    // Price edited on the line without re-pricing: the quoted figures must still carry over
    quotation.getLines().get(0).setUnitPrice(new BigDecimal("9999.00"));
    stubQuotationLookup(quotation);
    when(numberService.nextInvoiceNumber(OWNER_ID)).thenReturn("INV-0012");
    when(invoiceRepository.save(any(Invoice.class)))
        .thenAnswer(
            invocation -> {
              Invoice saved = invocation.getArgument(0);
              saved.setId(300L);
              return saved;
            });
    when(quotationRepository.save(any(Quotation.class))).thenAnswer(invocation -> invocation.getArgument(0));

    // When
    Invoice invoice = quotationService.convertToInvoice(OWNER_ID, QUOTATION_ID);

    // Then
    assertEquals("INV-0012", invoice.getInvoiceNumber());
    assertEquals(InvoiceStatus.DRAFT, invoice.getStatus());
    assertEquals(LocalDate.now(), invoice.getInvoiceDate());
    assertNull(invoice.getDueDate());
    assertEquals("Valid for 30 days", invoice.getNotes());
    assertSame(customer, invoice.getCustomer());
    assertEquals(2, invoice.getLines().size());
    assertEquals(new BigDecimal("2500.00"), invoice.getLines().get(0).getLineTotal());
    assertEquals(new BigDecimal("186.00"), invoice.getLines().get(1).getLineTotal());
    assertEquals(new BigDecimal("2686.00"), invoice.getSubtotal());
    assertEquals(new BigDecimal("537.20"), invoice.getTaxTotal());
    assertEquals(new BigDecimal("3223.20"), invoice.getTotal());
    assertEquals(quotation.getTotal(), invoice.getTotal());

    assertEquals(QuotationStatus.CONVERTED, quotation.getStatus());
    assertEquals(300L, quotation.getConvertedInvoiceId());
    verify(auditService)
        .logEvent(eq(OWNER_ID), eq(Action.CONVERT), eq(AuditService.QUOTATION), eq(QUOTATION_ID), anyString());
  }

  @Test
  void convertToInvoice_AlreadyConverted_RejectedWithoutNewInvoice() {
    Quotation quotation = existingQuotation(QuotationStatus.CONVERTED);
    stubQuotationLookup(quotation);

    assertThrows(InvalidStateException.class, () -> quotationService.convertToInvoice(OWNER_ID, QUOTATION_ID));
    verifyNoInteractions(invoiceRepository, numberService);
  }

  @Test
  void convertToInvoice_NoLines_Rejected() {
    Quotation quotation =
        new Quotation(OWNER_ID, customer, "QUO-2026-0005", LocalDate.of(2026, 2, 1), null);
    quotation.setId(QUOTATION_ID);
    stubQuotationLookup(quotation);

    assertThrows(InvalidStateException.class, () -> quotationService.convertToInvoice(OWNER_ID, QUOTATION_ID));
    verifyNoInteractions(invoiceRepository);
  }

  @Test
  void changeStatus_ToConverted_RejectedAsValidation() {
    assertThrows(
        ValidationException.class,
        () -> quotationService.changeStatus(OWNER_ID, QUOTATION_ID, QuotationStatus.CONVERTED));
    verifyNoInteractions(quotationRepository);
  }

  @Test
  void changeStatus_ConvertedQuotation_Rejected() {
    Quotation quotation = existingQuotation(QuotationStatus.CONVERTED);
    stubQuotationLookup(quotation);

    assertThrows(
        InvalidStateException.class,
        () -> quotationService.changeStatus(OWNER_ID, QUOTATION_ID, "draft"));
  }

  @Test
  void changeStatus_SentToAccepted_Saved() {
    Quotation quotation = existingQuotation(QuotationStatus.SENT);
    stubQuotationLookup(quotation);
    when(quotationRepository.save(any(Quotation.class))).thenAnswer(invocation -> invocation.getArgument(0));

    Quotation updated = quotationService.changeStatus(OWNER_ID, QUOTATION_ID, QuotationStatus.ACCEPTED);

    assertEquals(QuotationStatus.ACCEPTED, updated.getStatus());
  }

  @Test
  void addLine_ConvertedQuotation_Rejected() {
    Quotation quotation = existingQuotation(QuotationStatus.CONVERTED);
    stubQuotationLookup(quotation);

    assertThrows(
        InvalidStateException.class,
        () -> quotationService.addLine(
            OWNER_ID, QUOTATION_ID, LineItemRequest.of("Extra", BigDecimal.ONE, BigDecimal.TEN, 20)));
  }

  @Test
  void delete_ConvertedQuotation_Rejected() {
    Quotation quotation = existingQuotation(QuotationStatus.CONVERTED);
    stubQuotationLookup(quotation);

    assertThrows(InvalidStateException.class, () -> quotationService.delete(OWNER_ID, QUOTATION_ID));
    verify(quotationRepository, never()).delete(any());
  }

  @Test
  void removeLine_RecalculatesTotals() {
    Quotation quotation = existingQuotation(QuotationStatus.DRAFT);
    stubQuotationLookup(quotation);
    when(quotationRepository.save(any(Quotation.class))).thenAnswer(invocation -> invocation.getArgument(0));

    Quotation updated = quotationService.removeLine(OWNER_ID, QUOTATION_ID, 1L);

    assertEquals(new BigDecimal("186.00"), updated.getSubtotal());
    assertEquals(new BigDecimal("37.20"), updated.getTaxTotal());
    assertEquals(new BigDecimal("223.20"), updated.getTotal());
  }
}
