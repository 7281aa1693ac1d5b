package com.example.billing.repository;

import com.example.billing.domain.DocumentSequence;
import com.example.billing.domain.DocumentSequence.DocumentType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DocumentSequenceRepository extends JpaRepository<DocumentSequence, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DocumentSequence s WHERE s.ownerId = :ownerId " +
           "AND s.documentType = :type AND s.year = :year")
    Optional<DocumentSequence> findForUpdate(@Param("ownerId") Long ownerId,
                                             @Param("type") DocumentType type,
                                             @Param("year") int year);

    Optional<DocumentSequence> findByOwnerIdAndDocumentTypeAndYear(Long ownerId, DocumentType documentType, int year);
}
