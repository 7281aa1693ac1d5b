package com.example.billing.repository;

import com.example.billing.domain.RecurrenceExecutionLog;
import com.example.billing.domain.RecurrenceExecutionLog.Result;
import com.example.billing.domain.RecurringSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecurrenceExecutionLogRepository extends JpaRepository<RecurrenceExecutionLog, Long> {

    List<RecurrenceExecutionLog> findByScheduleOrderByRunAtDesc(RecurringSchedule schedule);

    long countByScheduleAndResult(RecurringSchedule schedule, Result result);

    void deleteBySchedule(RecurringSchedule schedule);
}
