package com.example.billing.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;

@Entity
@Table(name = "invoice_line", indexes = {
    @Index(name = "idx_invoice_line_invoice", columnList = "invoice_id")
})
public class InvoiceLine extends PricedLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invoice_id", nullable = false)
    private Invoice invoice;

    public InvoiceLine() {
    }

    public InvoiceLine(String description, BigDecimal quantity, BigDecimal unitPrice, int taxRate) {
        super(description, quantity, unitPrice, taxRate);
    }

    /**
     * Creates an invoice line carrying a quotation line's figures unchanged,
     * including its computed line total and tax amount.
     */
    public static InvoiceLine copyOf(QuotationLine source) {
        InvoiceLine line = new InvoiceLine();
        line.copyPricedFrom(source);
        return line;
    }

    /**
     * Creates an invoice line from a recurring template line, pricing it afresh.
     */
    public static InvoiceLine fromTemplate(ScheduleLine template) {
        InvoiceLine line = new InvoiceLine();
        line.copyDetailsFrom(template);
        line.calculateTotals();
        return line;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Invoice getInvoice() {
        return invoice;
    }

    public void setInvoice(Invoice invoice) {
        this.invoice = invoice;
    }
}
