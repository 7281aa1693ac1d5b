package com.example.billing.repository;

import com.example.billing.domain.Quotation;
import com.example.billing.domain.Quotation.QuotationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface QuotationRepository extends JpaRepository<Quotation, Long> {

    Optional<Quotation> findByIdAndOwnerId(Long id, Long ownerId);

    @Query("SELECT q FROM Quotation q WHERE q.ownerId = :ownerId " +
           "AND (:customerId IS NULL OR q.customer.id = :customerId) " +
           "AND (:status IS NULL OR q.status = :status) " +
           "ORDER BY q.quotationDate DESC, q.id DESC")
    Page<Quotation> search(@Param("ownerId") Long ownerId,
                           @Param("customerId") Long customerId,
                           @Param("status") QuotationStatus status,
                           Pageable pageable);
}
