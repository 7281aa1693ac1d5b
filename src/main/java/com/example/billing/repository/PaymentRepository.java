package com.example.billing.repository;

import com.example.billing.domain.Invoice;
import com.example.billing.domain.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    List<Payment> findByInvoiceOrderByPaymentDateDescIdDesc(Invoice invoice);

    // Total received across all invoices of an owner
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.invoice.ownerId = :ownerId")
    BigDecimal sumByOwner(@Param("ownerId") Long ownerId);
}
