package com.example.billing.service;

import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.domain.Customer;
import com.example.billing.domain.RecurrenceExecutionLog;
import com.example.billing.domain.RecurringSchedule;
import com.example.billing.event.RecurringGenerationFailedEvent;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.exception.ValidationException;
import com.example.billing.repository.CustomerRepository;
import com.example.billing.repository.RecurrenceExecutionLogRepository;
import com.example.billing.repository.RecurringScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for managing recurring invoice schedules and running the daily sweep.
 */
@Service
@Transactional
public class RecurringScheduleService {

    private static final Logger log = LoggerFactory.getLogger(RecurringScheduleService.class);

    private final RecurringScheduleRepository scheduleRepository;
    private final RecurrenceExecutionLogRepository executionLogRepository;
    private final CustomerRepository customerRepository;
    private final RecurringInvoiceGenerator generator;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;

    public RecurringScheduleService(RecurringScheduleRepository scheduleRepository,
                                    RecurrenceExecutionLogRepository executionLogRepository,
                                    CustomerRepository customerRepository,
                                    RecurringInvoiceGenerator generator,
                                    AuditService auditService,
                                    ApplicationEventPublisher eventPublisher) {
        this.scheduleRepository = scheduleRepository;
        this.executionLogRepository = executionLogRepository;
        this.customerRepository = customerRepository;
        this.generator = generator;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
    }

    // CRUD Operations

    public RecurringSchedule create(Long ownerId, RecurringScheduleRequest request) {
        if (request.frequency() == null) {
            throw new ValidationException("Frequency is required");
        }
        if (request.startDate() == null) {
            throw new ValidationException("Start date is required");
        }
        validateEndDate(request.startDate(), request.endDate());
        validateLines(request.lines());
        if (request.customerId() == null) {
            throw new ValidationException("Customer is required");
        }
        Customer customer = customerRepository.findByIdAndOwnerId(request.customerId(), ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", request.customerId()));

        RecurringSchedule schedule = new RecurringSchedule(ownerId, customer, request.frequency(),
            request.startDate(), request.endDate());
        schedule.setNotes(request.notes());
        for (LineItemRequest line : request.lines()) {
            schedule.addLine(line.toScheduleLine());
        }
        schedule = scheduleRepository.save(schedule);

        auditService.logEvent(ownerId, Action.CREATE, AuditService.RECURRING_SCHEDULE, schedule.getId(),
            "Created recurring schedule (" + customer.getCompanyName() + ", " + schedule.getFrequency().label() + ")");

        return schedule;
    }

    @Transactional(readOnly = true)
    public RecurringSchedule get(Long ownerId, Long scheduleId) {
        return scheduleRepository.findByIdAndOwnerId(scheduleId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Recurring schedule", scheduleId));
    }

    /**
     * Lists an owner's schedules by next run date.
     *
     * @param active true for active only, false for inactive only, null for all
     */
    @Transactional(readOnly = true)
    public List<RecurringSchedule> list(Long ownerId, Boolean active) {
        if (active == null) {
            return scheduleRepository.findByOwnerIdOrderByNextRunDateAsc(ownerId);
        }
        return scheduleRepository.findByOwnerIdAndActiveOrderByNextRunDateAsc(ownerId, active);
    }

    /**
     * Applies the non-null fields of the update. The schedule cursor is not
     * moved when the frequency changes; the new frequency applies from the
     * next generation on.
     */
    public RecurringSchedule update(Long ownerId, Long scheduleId, RecurringScheduleUpdate update) {
        RecurringSchedule schedule = get(ownerId, scheduleId);

        if (update.endDate() != null) {
            validateEndDate(schedule.getStartDate(), update.endDate());
        }
        if (update.lines() != null) {
            validateLines(update.lines());
        }

        if (update.frequency() != null) {
            schedule.setFrequency(update.frequency());
        }
        if (update.endDate() != null) {
            schedule.setEndDate(update.endDate());
        }
        if (update.active() != null) {
            schedule.setActive(update.active());
        }
        if (update.notes() != null) {
            schedule.setNotes(update.notes());
        }
        if (update.lines() != null) {
            schedule.clearLines();
            for (LineItemRequest line : update.lines()) {
                schedule.addLine(line.toScheduleLine());
            }
        }
        schedule = scheduleRepository.save(schedule);

        auditService.logEvent(ownerId, Action.UPDATE, AuditService.RECURRING_SCHEDULE, schedule.getId(),
            "Updated recurring schedule (" + schedule.getCustomer().getCompanyName() + ")");

        return schedule;
    }

    /**
     * Deletes a schedule and its execution history. Invoices it generated are kept.
     */
    public void delete(Long ownerId, Long scheduleId) {
        RecurringSchedule schedule = get(ownerId, scheduleId);
        String customerName = schedule.getCustomer().getCompanyName();

        executionLogRepository.deleteBySchedule(schedule);
        scheduleRepository.delete(schedule);

        auditService.logEvent(ownerId, Action.DELETE, AuditService.RECURRING_SCHEDULE, scheduleId,
            "Deleted recurring schedule (" + customerName + ")");
    }

    public RecurringSchedule toggleActive(Long ownerId, Long scheduleId) {
        RecurringSchedule schedule = get(ownerId, scheduleId);
        schedule.toggleActive();
        schedule = scheduleRepository.save(schedule);

        auditService.logEvent(ownerId, Action.UPDATE, AuditService.RECURRING_SCHEDULE, schedule.getId(),
            "Recurring schedule " + (schedule.isActive() ? "activated" : "deactivated")
                + " (" + schedule.getCustomer().getCompanyName() + ")");

        return schedule;
    }

    // Execution History

    @Transactional(readOnly = true)
    public List<RecurrenceExecutionLog> getExecutionHistory(Long ownerId, Long scheduleId) {
        return executionLogRepository.findByScheduleOrderByRunAtDesc(get(ownerId, scheduleId));
    }

    // Generation

    /**
     * Generates an invoice from the schedule immediately ("run now").
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public RecurringGenerationResult generateNow(Long ownerId, Long scheduleId) {
        return generator.generateNow(ownerId, scheduleId, LocalDate.now());
    }

    /**
     * Runs due schedules for all owners. Scheduled to run daily at 2:00 AM by default.
     */
    @Scheduled(cron = "${billing.recurring.cron:0 0 2 * * *}")
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void runScheduledRecurrences() {
        log.info("Running scheduled recurring invoice generation");
        processDue(LocalDate.now());
    }

    /**
     * Processes every active schedule whose next run date is on or before {@code today}.
     *
     * Schedules are handled one by one, each in its own transaction. A failure
     * is logged and recorded against its schedule, and the sweep moves on.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public RecurringRunSummary processDue(LocalDate today) {
        List<Long> dueIds = scheduleRepository.findDueScheduleIds(today);
        int generated = 0;
        int deactivated = 0;
        List<Long> failedIds = new ArrayList<>();

        for (Long scheduleId : dueIds) {
            try {
                RecurringGenerationResult result = generator.processDue(scheduleId, today);
                switch (result.outcome()) {
                    case GENERATED -> generated++;
                    case DEACTIVATED -> deactivated++;
                    case SKIPPED -> { }
                }
            } catch (Exception e) {
                log.error("Failed to generate invoice for recurring schedule {}: {}", scheduleId, e.getMessage(), e);
                failedIds.add(scheduleId);
                recordFailure(scheduleId, e);
            }
        }

        log.info("Recurring sweep for {}: {} due, {} generated, {} deactivated, {} failed",
            today, dueIds.size(), generated, deactivated, failedIds.size());
        return new RecurringRunSummary(generated, deactivated, failedIds.size(), List.copyOf(failedIds));
    }

    private void recordFailure(Long scheduleId, Exception cause) {
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            Long ownerId = generator.recordFailure(scheduleId, error);
            eventPublisher.publishEvent(new RecurringGenerationFailedEvent(ownerId, scheduleId, error));
        } catch (RuntimeException e) {
            log.error("Could not record failure of recurring schedule {}: {}", scheduleId, e.getMessage(), e);
        }
    }

    private void validateEndDate(LocalDate startDate, LocalDate endDate) {
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("End date " + endDate + " is before start date " + startDate);
        }
    }

    private void validateLines(List<LineItemRequest> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("A recurring schedule needs at least one line");
        }
        LineItemRequest.validateAll(lines);
    }
}
