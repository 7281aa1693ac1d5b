package com.example.billing.domain;

import com.example.billing.exception.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Represents an invoice issued to a customer.
 * Invoices follow a workflow: DRAFT → SENT → PAID, with DRAFT|SENT → CANCELLED.
 * Totals are cached on the row and always recomputed from the full line set;
 * the paid amount is recomputed from the recorded payments.
 */
@Entity
@Table(name = "invoice", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"owner_id", "invoice_number"})
}, indexes = {
    @Index(name = "idx_invoice_owner_status", columnList = "owner_id, status")
})
public class Invoice {

    public enum InvoiceStatus {
        DRAFT,      // Being prepared
        SENT,       // Delivered to the customer, awaiting payment
        PAID,       // Fully covered by payments
        CANCELLED;  // Withdrawn, accepts no payments

        /**
         * Header fields may only change while the invoice is draft or sent.
         */
        public boolean isEditable() {
            return this == DRAFT || this == SENT;
        }

        /**
         * Manual status changes are unrestricted: any status may be set from any
         * other. Payment reconciliation moves invoices to PAID and back to SENT
         * on its own.
         */
        public boolean canTransitionTo(InvoiceStatus target) {
            return target != null;
        }

        public static InvoiceStatus parse(String value) {
            if (value == null || value.isBlank()) {
                throw new ValidationException("Invoice status is required");
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown invoice status: " + value);
            }
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @NotBlank
    @Size(max = 50)
    @Column(name = "invoice_number", nullable = false, length = 50, updatable = false)
    private String invoiceNumber;

    @NotNull
    @Column(name = "invoice_date", nullable = false)
    private LocalDate invoiceDate;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceStatus status = InvoiceStatus.DRAFT;

    @Size(max = 2000)
    @Column(length = 2000)
    private String notes;

    // Cached totals (recalculated from lines)
    @Column(name = "subtotal", nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal = Money.ZERO;

    @Column(name = "tax_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxTotal = Money.ZERO;

    @Column(name = "total", nullable = false, precision = 19, scale = 2)
    private BigDecimal total = Money.ZERO;

    // Cached sum of payments
    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountPaid = Money.ZERO;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineIndex ASC")
    private List<InvoiceLine> lines = new ArrayList<>();

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("paymentDate DESC, id DESC")
    private List<Payment> payments = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    // Constructors
    public Invoice() {
    }

    public Invoice(Long ownerId, Customer customer, String invoiceNumber,
                   LocalDate invoiceDate, LocalDate dueDate) {
        this.ownerId = ownerId;
        this.customer = customer;
        this.invoiceNumber = invoiceNumber;
        this.invoiceDate = invoiceDate;
        this.dueDate = dueDate;
    }

    // Helper methods
    // Indexes keep increasing after removals so ordering stays unambiguous
    public void addLine(InvoiceLine line) {
        int nextIndex = lines.stream().mapToInt(InvoiceLine::getLineIndex).max().orElse(0) + 1;
        lines.add(line);
        line.setInvoice(this);
        line.setLineIndex(nextIndex);
    }

    public void removeLine(InvoiceLine line) {
        lines.remove(line);
        line.setInvoice(null);
    }

    public Optional<InvoiceLine> findLine(Long lineId) {
        return lines.stream().filter(l -> lineId != null && lineId.equals(l.getId())).findFirst();
    }

    public void addPayment(Payment payment) {
        payments.add(payment);
        payment.setInvoice(this);
    }

    public void removePayment(Payment payment) {
        payments.remove(payment);
        payment.setInvoice(null);
    }

    /**
     * Recalculates totals from the current line items.
     * Must be called after every change to the line set.
     */
    public void recalculateTotals() {
        applyTotals(DocumentTotals.of(lines));
    }

    public void applyTotals(DocumentTotals totals) {
        subtotal = totals.subtotal();
        taxTotal = totals.taxTotal();
        total = totals.total();
    }

    /**
     * Recalculates the paid amount from the recorded payments.
     */
    public void recalculateAmountPaid() {
        BigDecimal sum = Money.ZERO;
        for (Payment payment : payments) {
            sum = sum.add(payment.getAmount());
        }
        amountPaid = sum;
    }

    /**
     * Returns the outstanding balance, never negative.
     */
    public BigDecimal getRemainingAmount() {
        return Money.max(total.subtract(amountPaid), Money.ZERO);
    }

    public boolean isFullyPaid() {
        return amountPaid.compareTo(total) >= 0;
    }

    public boolean isEditable() {
        return status.isEditable();
    }

    public boolean isCancelled() {
        return status == InvoiceStatus.CANCELLED;
    }

    public boolean isOverdue(LocalDate today) {
        return status == InvoiceStatus.SENT && dueDate != null && today.isAfter(dueDate);
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(Long ownerId) {
        this.ownerId = ownerId;
    }

    public Customer getCustomer() {
        return customer;
    }

    public void setCustomer(Customer customer) {
        this.customer = customer;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public void setInvoiceNumber(String invoiceNumber) {
        this.invoiceNumber = invoiceNumber;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(LocalDate invoiceDate) {
        this.invoiceDate = invoiceDate;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public InvoiceStatus getStatus() {
        return status;
    }

    public void setStatus(InvoiceStatus status) {
        this.status = status;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public BigDecimal getTaxTotal() {
        return taxTotal;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public BigDecimal getAmountPaid() {
        return amountPaid;
    }

    public List<InvoiceLine> getLines() {
        return lines;
    }

    public List<Payment> getPayments() {
        return payments;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
