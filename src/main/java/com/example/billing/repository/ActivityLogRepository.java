package com.example.billing.repository;

import com.example.billing.domain.ActivityLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ActivityLogRepository extends JpaRepository<ActivityLog, Long> {

    List<ActivityLog> findByOwnerIdOrderByCreatedAtDescIdDesc(Long ownerId, Pageable pageable);

    List<ActivityLog> findByOwnerIdAndEntityTypeAndEntityIdOrderByCreatedAtDesc(Long ownerId, String entityType,
                                                                                Long entityId);
}
