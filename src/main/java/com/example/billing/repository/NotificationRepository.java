package com.example.billing.repository;

import com.example.billing.domain.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    List<Notification> findByOwnerIdOrderByCreatedAtDesc(Long ownerId, Pageable pageable);

    List<Notification> findByOwnerIdAndReadFalseOrderByCreatedAtDesc(Long ownerId);

    long countByOwnerIdAndReadFalse(Long ownerId);

    Optional<Notification> findByIdAndOwnerId(Long id, Long ownerId);
}
