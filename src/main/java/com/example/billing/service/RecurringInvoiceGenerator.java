package com.example.billing.service;

import com.example.billing.domain.ActivityLog.Action;
import com.example.billing.domain.Invoice;
import com.example.billing.domain.Invoice.InvoiceStatus;
import com.example.billing.domain.RecurrenceExecutionLog;
import com.example.billing.domain.RecurringSchedule;
import com.example.billing.domain.ScheduleLine;
import com.example.billing.event.RecurringInvoiceGeneratedEvent;
import com.example.billing.exception.InvalidStateException;
import com.example.billing.exception.ResourceNotFoundException;
import com.example.billing.repository.RecurrenceExecutionLogRepository;
import com.example.billing.repository.RecurringScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates invoices from recurring schedules.
 *
 * Each call runs in its own transaction: the invoice, the cursor advance and
 * the execution log entry of one schedule commit or roll back together,
 * independently of any other schedule in the same sweep.
 */
@Service
public class RecurringInvoiceGenerator {

    private static final Logger log = LoggerFactory.getLogger(RecurringInvoiceGenerator.class);

    private final RecurringScheduleRepository scheduleRepository;
    private final RecurrenceExecutionLogRepository executionLogRepository;
    private final InvoiceService invoiceService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final int defaultDueDays;

    public RecurringInvoiceGenerator(RecurringScheduleRepository scheduleRepository,
                                     RecurrenceExecutionLogRepository executionLogRepository,
                                     InvoiceService invoiceService,
                                     AuditService auditService,
                                     ApplicationEventPublisher eventPublisher,
                                     @Value("${billing.recurring.default-due-days:30}") int defaultDueDays) {
        this.scheduleRepository = scheduleRepository;
        this.executionLogRepository = executionLogRepository;
        this.invoiceService = invoiceService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.defaultDueDays = defaultDueDays;
    }

    /**
     * Runs a schedule picked up by the sweep. A schedule whose end date has
     * already passed is deactivated without generating anything.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RecurringGenerationResult processDue(Long scheduleId, LocalDate today) {
        RecurringSchedule schedule = scheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new ResourceNotFoundException("Recurring schedule", scheduleId));

        if (!schedule.isDue(today)) {
            log.debug("Recurring schedule {} is no longer due, skipping", scheduleId);
            return RecurringGenerationResult.skipped(scheduleId);
        }
        if (schedule.hasEndedBefore(today)) {
            schedule.setActive(false);
            scheduleRepository.save(schedule);
            executionLogRepository.save(RecurrenceExecutionLog.deactivated(schedule));
            log.info("Recurring schedule {} ended on {}, deactivated without generating",
                scheduleId, schedule.getEndDate());
            auditService.logEvent(schedule.getOwnerId(), Action.UPDATE, AuditService.RECURRING_SCHEDULE,
                scheduleId, "Recurring schedule deactivated, end date " + schedule.getEndDate() + " passed");
            return RecurringGenerationResult.deactivated(scheduleId);
        }
        return generate(schedule, today);
    }

    /**
     * Generates an invoice right away, whatever the schedule's cursor says.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RecurringGenerationResult generateNow(Long ownerId, Long scheduleId, LocalDate today) {
        RecurringSchedule schedule = scheduleRepository.findByIdAndOwnerId(scheduleId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Recurring schedule", scheduleId));
        return generate(schedule, today);
    }

    /**
     * Writes a FAILED execution log entry for a schedule whose generation was rolled back.
     *
     * @return the owner of the schedule
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long recordFailure(Long scheduleId, String error) {
        RecurringSchedule schedule = scheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new ResourceNotFoundException("Recurring schedule", scheduleId));
        executionLogRepository.save(RecurrenceExecutionLog.failure(schedule, error));
        return schedule.getOwnerId();
    }

    private RecurringGenerationResult generate(RecurringSchedule schedule, LocalDate today) {
        if (schedule.getLines().isEmpty()) {
            throw new InvalidStateException("Recurring schedule " + schedule.getId() + " has no template lines");
        }
        List<LineItemRequest> lines = new ArrayList<>();
        for (ScheduleLine line : schedule.getLines()) {
            lines.add(LineItemRequest.of(line));
        }
        InvoiceRequest request = new InvoiceRequest(schedule.getCustomer().getId(), today,
            today.plusDays(defaultDueDays), InvoiceStatus.DRAFT, generatedNotes(schedule), lines);

        Invoice invoice = invoiceService.create(schedule.getOwnerId(), request);

        boolean deactivated = schedule.recordGeneration(Instant.now());
        scheduleRepository.save(schedule);
        executionLogRepository.save(RecurrenceExecutionLog.success(schedule, invoice.getId()));

        log.info("Recurring schedule {} generated invoice {}, next run {}{}", schedule.getId(),
            invoice.getInvoiceNumber(), schedule.getNextRunDate(), deactivated ? " (schedule ended)" : "");
        auditService.logEvent(schedule.getOwnerId(), Action.GENERATE, AuditService.RECURRING_SCHEDULE,
            schedule.getId(), "Generated invoice " + invoice.getInvoiceNumber() + " from "
                + schedule.getFrequency().label() + " recurring schedule");

        eventPublisher.publishEvent(new RecurringInvoiceGeneratedEvent(schedule.getOwnerId(), schedule.getId(),
            invoice.getId(), invoice.getInvoiceNumber(), invoice.getTotal(), deactivated));

        return RecurringGenerationResult.generated(schedule.getId(), invoice, deactivated);
    }

    private String generatedNotes(RecurringSchedule schedule) {
        String notes = "Auto-generated from " + schedule.getFrequency().label() + " recurring schedule #"
            + schedule.getId();
        if (schedule.getNotes() != null && !schedule.getNotes().isBlank()) {
            notes = notes + "\n" + schedule.getNotes();
        }
        return notes.length() > 2000 ? notes.substring(0, 2000) : notes;
    }
}
