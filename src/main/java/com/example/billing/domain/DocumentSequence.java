package com.example.billing.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Per-owner counter for human-readable document numbers.
 * Invoices use year 0 (one sequence per owner); quotations use one sequence per
 * owner and calendar year. Values only ever increase, so numbers freed by
 * deleting a document are never handed out again.
 */
@Entity
@Table(name = "document_sequence", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"owner_id", "document_type", "sequence_year"})
})
public class DocumentSequence {

    public enum DocumentType {
        INVOICE,
        QUOTATION
    }

    public static final int NO_YEAR = 0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false, length = 20)
    private DocumentType documentType;

    @Column(name = "sequence_year", nullable = false)
    private int year;

    @Column(name = "next_value", nullable = false)
    private long nextValue = 1;

    @Version
    private Long version;

    public DocumentSequence() {
    }

    public DocumentSequence(Long ownerId, DocumentType documentType, int year) {
        this.ownerId = ownerId;
        this.documentType = documentType;
        this.year = year;
    }

    /**
     * Returns the current value and advances the counter.
     */
    public long next() {
        return nextValue++;
    }

    public Long getId() {
        return id;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public int getYear() {
        return year;
    }

    public long getNextValue() {
        return nextValue;
    }

    public void setNextValue(long nextValue) {
        this.nextValue = nextValue;
    }
}
