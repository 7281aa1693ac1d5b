package com.example.billing.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;

@Entity
@Table(name = "quotation_line", indexes = {
    @Index(name = "idx_quotation_line_quotation", columnList = "quotation_id")
})
public class QuotationLine extends PricedLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "quotation_id", nullable = false)
    private Quotation quotation;

    public QuotationLine() {
    }

    public QuotationLine(String description, BigDecimal quantity, BigDecimal unitPrice, int taxRate) {
        super(description, quantity, unitPrice, taxRate);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Quotation getQuotation() {
        return quotation;
    }

    public void setQuotation(Quotation quotation) {
        this.quotation = quotation;
    }
}
