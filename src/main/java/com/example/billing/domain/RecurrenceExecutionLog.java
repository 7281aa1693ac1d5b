package com.example.billing.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Logs each attempt to generate an invoice from a recurring schedule.
 * Tracks success/failure and links the generated invoice.
 */
@Entity
@Table(name = "recurrence_execution_log", indexes = {
    @Index(name = "idx_recurrence_log_schedule", columnList = "schedule_id"),
    @Index(name = "idx_recurrence_log_run_at", columnList = "schedule_id, run_at")
})
public class RecurrenceExecutionLog {

    /**
     * Result of the execution attempt.
     */
    public enum Result {
        CREATED,     // Invoice generated
        DEACTIVATED, // End date already passed, nothing generated
        FAILED       // Generation failed - see error field
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_id", nullable = false)
    private RecurringSchedule schedule;

    @NotNull
    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Result result;

    @Column(name = "invoice_id")
    private Long invoiceId;

    @Size(max = 1000)
    @Column(length = 1000)
    private String error;

    public RecurrenceExecutionLog() {
    }

    public static RecurrenceExecutionLog success(RecurringSchedule schedule, Long invoiceId) {
        RecurrenceExecutionLog log = new RecurrenceExecutionLog();
        log.schedule = schedule;
        log.runAt = Instant.now();
        log.result = Result.CREATED;
        log.invoiceId = invoiceId;
        return log;
    }

    public static RecurrenceExecutionLog deactivated(RecurringSchedule schedule) {
        RecurrenceExecutionLog log = new RecurrenceExecutionLog();
        log.schedule = schedule;
        log.runAt = Instant.now();
        log.result = Result.DEACTIVATED;
        return log;
    }

    public static RecurrenceExecutionLog failure(RecurringSchedule schedule, String error) {
        RecurrenceExecutionLog log = new RecurrenceExecutionLog();
        log.schedule = schedule;
        log.runAt = Instant.now();
        log.result = Result.FAILED;
        log.error = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        return log;
    }

    public Long getId() {
        return id;
    }

    public RecurringSchedule getSchedule() {
        return schedule;
    }

    public Instant getRunAt() {
        return runAt;
    }

    public Result getResult() {
        return result;
    }

    public Long getInvoiceId() {
        return invoiceId;
    }

    public String getError() {
        return error;
    }

    public boolean isSuccess() {
        return result == Result.CREATED;
    }

    public boolean isFailed() {
        return result == Result.FAILED;
    }
}
