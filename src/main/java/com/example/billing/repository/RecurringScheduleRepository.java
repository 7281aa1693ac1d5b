package com.example.billing.repository;

import com.example.billing.domain.RecurringSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecurringScheduleRepository extends JpaRepository<RecurringSchedule, Long> {

    Optional<RecurringSchedule> findByIdAndOwnerId(Long id, Long ownerId);

    List<RecurringSchedule> findByOwnerIdOrderByNextRunDateAsc(Long ownerId);

    List<RecurringSchedule> findByOwnerIdAndActiveOrderByNextRunDateAsc(Long ownerId, boolean active);

    // Ids only: each schedule is reloaded inside its own transaction
    @Query("SELECT rs.id FROM RecurringSchedule rs WHERE rs.active = true " +
           "AND rs.nextRunDate <= :date ORDER BY rs.nextRunDate, rs.id")
    List<Long> findDueScheduleIds(@Param("date") LocalDate date);
}
