package com.example.billing.repository;

import com.example.billing.domain.Invoice;
import com.example.billing.domain.Invoice.InvoiceStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    Optional<Invoice> findByIdAndOwnerId(Long id, Long ownerId);

    // Row lock for changes that must see the committed paid amount
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Invoice i WHERE i.id = :id AND i.ownerId = :ownerId")
    Optional<Invoice> findForUpdate(@Param("id") Long id, @Param("ownerId") Long ownerId);

    // Owner listing with optional customer and status filters
    @Query("SELECT i FROM Invoice i WHERE i.ownerId = :ownerId " +
           "AND (:customerId IS NULL OR i.customer.id = :customerId) " +
           "AND (:status IS NULL OR i.status = :status) " +
           "ORDER BY i.invoiceDate DESC, i.id DESC")
    Page<Invoice> search(@Param("ownerId") Long ownerId,
                         @Param("customerId") Long customerId,
                         @Param("status") InvoiceStatus status,
                         Pageable pageable);

    long countByOwnerId(Long ownerId);

    long countByOwnerIdAndStatus(Long ownerId, InvoiceStatus status);

    // Sum of invoice totals, optionally restricted to a set of statuses
    @Query("SELECT COALESCE(SUM(i.total), 0) FROM Invoice i WHERE i.ownerId = :ownerId")
    BigDecimal sumTotalByOwner(@Param("ownerId") Long ownerId);

    @Query("SELECT COALESCE(SUM(i.total), 0) FROM Invoice i WHERE i.ownerId = :ownerId " +
           "AND i.status IN :statuses")
    BigDecimal sumTotalByOwnerAndStatusIn(@Param("ownerId") Long ownerId,
                                          @Param("statuses") List<InvoiceStatus> statuses);
}
