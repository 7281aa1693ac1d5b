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
 * A priced offer sent to a customer. Quotations follow:
 * DRAFT → SENT → ACCEPTED | REJECTED, and any of those → CONVERTED once an
 * invoice has been produced from it. A converted quotation is a read-only record.
 */
@Entity
@Table(name = "quotation", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"owner_id", "quotation_number"})
}, indexes = {
    @Index(name = "idx_quotation_owner_status", columnList = "owner_id, status")
})
public class Quotation {

    public enum QuotationStatus {
        DRAFT,
        SENT,
        ACCEPTED,
        REJECTED,
        CONVERTED;  // Terminal, reachable only through conversion

        public boolean isTerminal() {
            return this == CONVERTED;
        }

        /**
         * Whether a status change request may move a quotation from this status to
         * the target. CONVERTED is never a valid target here.
         */
        public boolean canTransitionTo(QuotationStatus target) {
            return !isTerminal() && target != null && target != CONVERTED;
        }

        public static QuotationStatus parse(String value) {
            if (value == null || value.isBlank()) {
                throw new ValidationException("Quotation status is required");
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown quotation status: " + value);
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
    @Column(name = "quotation_number", nullable = false, length = 50, updatable = false)
    private String quotationNumber;

    @NotNull
    @Column(name = "quotation_date", nullable = false)
    private LocalDate quotationDate;

    @Column(name = "valid_until")
    private LocalDate validUntil;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QuotationStatus status = QuotationStatus.DRAFT;

    @Size(max = 2000)
    @Column(length = 2000)
    private String notes;

    @Column(name = "subtotal", nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal = Money.ZERO;

    @Column(name = "tax_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxTotal = Money.ZERO;

    @Column(name = "total", nullable = false, precision = 19, scale = 2)
    private BigDecimal total = Money.ZERO;

    // Audit link to the invoice produced by conversion
    @Column(name = "converted_invoice_id")
    private Long convertedInvoiceId;

    @Column(name = "converted_at")
    private Instant convertedAt;

    @OneToMany(mappedBy = "quotation", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineIndex ASC")
    private List<QuotationLine> lines = new ArrayList<>();

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

    public Quotation() {
    }

    public Quotation(Long ownerId, Customer customer, String quotationNumber,
                     LocalDate quotationDate, LocalDate validUntil) {
        this.ownerId = ownerId;
        this.customer = customer;
        this.quotationNumber = quotationNumber;
        this.quotationDate = quotationDate;
        this.validUntil = validUntil;
    }

    // Indexes keep increasing after removals so ordering stays unambiguous
    public void addLine(QuotationLine line) {
        int nextIndex = lines.stream().mapToInt(QuotationLine::getLineIndex).max().orElse(0) + 1;
        lines.add(line);
        line.setQuotation(this);
        line.setLineIndex(nextIndex);
    }

    public void removeLine(QuotationLine line) {
        lines.remove(line);
        line.setQuotation(null);
    }

    public Optional<QuotationLine> findLine(Long lineId) {
        return lines.stream().filter(l -> lineId != null && lineId.equals(l.getId())).findFirst();
    }

    public void recalculateTotals() {
        DocumentTotals totals = DocumentTotals.of(lines);
        subtotal = totals.subtotal();
        taxTotal = totals.taxTotal();
        total = totals.total();
    }

    public DocumentTotals getTotals() {
        return new DocumentTotals(subtotal, taxTotal, total);
    }

    /**
     * Marks this quotation as converted into the given invoice.
     */
    public void markConverted(Long invoiceId) {
        this.status = QuotationStatus.CONVERTED;
        this.convertedInvoiceId = invoiceId;
        this.convertedAt = Instant.now();
    }

    public boolean isConverted() {
        return status == QuotationStatus.CONVERTED;
    }

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

    public String getQuotationNumber() {
        return quotationNumber;
    }

    public void setQuotationNumber(String quotationNumber) {
        this.quotationNumber = quotationNumber;
    }

    public LocalDate getQuotationDate() {
        return quotationDate;
    }

    public void setQuotationDate(LocalDate quotationDate) {
        this.quotationDate = quotationDate;
    }

    public LocalDate getValidUntil() {
        return validUntil;
    }

    public void setValidUntil(LocalDate validUntil) {
        this.validUntil = validUntil;
    }

    public QuotationStatus getStatus() {
        return status;
    }

    public void setStatus(QuotationStatus status) {
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

    public Long getConvertedInvoiceId() {
        return convertedInvoiceId;
    }

    public Instant getConvertedAt() {
        return convertedAt;
    }

    public List<QuotationLine> getLines() {
        return lines;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
