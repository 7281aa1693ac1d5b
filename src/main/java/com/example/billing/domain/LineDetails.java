package com.example.billing.domain;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Descriptive and pricing fields shared by every kind of line item
 * (invoice, quotation and recurring template lines).
 *
 * The product reference is advisory only: description and price are copied
 * onto the line so that later catalog changes never alter historical documents.
 */
@MappedSuperclass
public abstract class LineDetails {

    public static final int DEFAULT_TAX_RATE = 20;

    @NotBlank
    @Size(max = 255)
    @Column(nullable = false, length = 255)
    private String description;

    @NotNull
    @DecimalMin("0")
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal quantity;

    @NotNull
    @DecimalMin("0")
    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Min(0)
    @Max(100)
    @Column(name = "tax_rate", nullable = false)
    private int taxRate = DEFAULT_TAX_RATE;

    // No foreign key: deleting a product leaves the line untouched
    @Column(name = "product_id")
    private Long productId;

    protected LineDetails() {
    }

    protected LineDetails(String description, BigDecimal quantity, BigDecimal unitPrice, int taxRate) {
        this.description = description;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.taxRate = taxRate;
    }

    protected void copyDetailsFrom(LineDetails other) {
        this.description = other.getDescription();
        this.quantity = other.getQuantity();
        this.unitPrice = other.getUnitPrice();
        this.taxRate = other.getTaxRate();
        this.productId = other.getProductId();
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public void setQuantity(BigDecimal quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public void setUnitPrice(BigDecimal unitPrice) {
        this.unitPrice = unitPrice;
    }

    public int getTaxRate() {
        return taxRate;
    }

    public void setTaxRate(int taxRate) {
        this.taxRate = taxRate;
    }

    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }
}
