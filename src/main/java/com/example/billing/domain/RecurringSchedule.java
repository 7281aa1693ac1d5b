package com.example.billing.domain;

import com.example.billing.exception.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A recurring invoice schedule. Stores template lines and a cursor
 * ({@code nextRunDate}) that advances by one period every time an invoice
 * is generated from it.
 */
@Entity
@Table(name = "recurring_schedule", indexes = {
    @Index(name = "idx_recurring_schedule_owner", columnList = "owner_id"),
    @Index(name = "idx_recurring_schedule_next_run", columnList = "active, next_run_date")
})
public class RecurringSchedule {

    /**
     * Frequency pattern for recurrence. Month-based periods use calendar
     * arithmetic: the day of month is clamped to the target month's length
     * (Jan 31 + 1 month = Feb 28 or Feb 29).
     */
    public enum Frequency {
        WEEKLY,
        MONTHLY,
        QUARTERLY,
        YEARLY;

        public LocalDate advance(LocalDate date) {
            return switch (this) {
                case WEEKLY -> date.plusWeeks(1);
                case MONTHLY -> date.plusMonths(1);
                case QUARTERLY -> date.plusMonths(3);
                case YEARLY -> date.plusYears(1);
            };
        }

        public String label() {
            return switch (this) {
                case WEEKLY -> "weekly";
                case MONTHLY -> "monthly";
                case QUARTERLY -> "quarterly";
                case YEARLY -> "yearly";
            };
        }

        public static Frequency parse(String value) {
            if (value == null || value.isBlank()) {
                throw new ValidationException("Frequency is required");
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown frequency: " + value);
            }
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Frequency frequency;

    @NotNull
    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate; // null = forever

    @NotNull
    @Column(name = "next_run_date", nullable = false)
    private LocalDate nextRunDate;

    @Column(nullable = false)
    private boolean active = true;

    @Size(max = 2000)
    @Column(length = 2000)
    private String notes;

    @Column(name = "total_generated", nullable = false)
    private int totalGenerated = 0;

    @Column(name = "last_generated_at")
    private Instant lastGeneratedAt;

    @OneToMany(mappedBy = "schedule", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineIndex ASC")
    private List<ScheduleLine> lines = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    // Constructors
    public RecurringSchedule() {
    }

    public RecurringSchedule(Long ownerId, Customer customer, Frequency frequency,
                             LocalDate startDate, LocalDate endDate) {
        this.ownerId = ownerId;
        this.customer = customer;
        this.frequency = frequency;
        this.startDate = startDate;
        this.endDate = endDate;
        this.nextRunDate = startDate;
    }

    // Business methods

    /**
     * Next occurrence after {@code current} for the given frequency.
     */
    public static LocalDate computeNextRun(LocalDate current, Frequency frequency) {
        return frequency.advance(current);
    }

    /**
     * Checks if this schedule is ready to run (active and next run date is today or earlier).
     */
    public boolean isDue(LocalDate today) {
        return active && !nextRunDate.isAfter(today);
    }

    /**
     * Checks whether the end date has already passed relative to {@code today}.
     */
    public boolean hasEndedBefore(LocalDate today) {
        return endDate != null && today.isAfter(endDate);
    }

    /**
     * Called after an invoice has been generated: advances the cursor, bumps the
     * counters and retires the schedule once the cursor moves beyond the end date.
     *
     * @return true if this call deactivated the schedule
     */
    public boolean recordGeneration(Instant generatedAt) {
        totalGenerated++;
        lastGeneratedAt = generatedAt;
        nextRunDate = computeNextRun(nextRunDate, frequency);
        if (endDate != null && nextRunDate.isAfter(endDate) && active) {
            active = false;
            return true;
        }
        return false;
    }

    // Indexes keep increasing after removals so ordering stays unambiguous
    public void addLine(ScheduleLine line) {
        int nextIndex = lines.stream().mapToInt(ScheduleLine::getLineIndex).max().orElse(0) + 1;
        lines.add(line);
        line.setSchedule(this);
        line.setLineIndex(nextIndex);
    }

    public void clearLines() {
        for (ScheduleLine line : lines) {
            line.setSchedule(null);
        }
        lines.clear();
    }

    public void toggleActive() {
        active = !active;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(Long ownerId) {
        this.ownerId = ownerId;
    }

    public Customer getCustomer() {
        return customer;
    }

    public void setCustomer(Customer customer) {
        this.customer = customer;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public void setFrequency(Frequency frequency) {
        this.frequency = frequency;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public LocalDate getNextRunDate() {
        return nextRunDate;
    }

    public void setNextRunDate(LocalDate nextRunDate) {
        this.nextRunDate = nextRunDate;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public int getTotalGenerated() {
        return totalGenerated;
    }

    public void setTotalGenerated(int totalGenerated) {
        this.totalGenerated = totalGenerated;
    }

    public Instant getLastGeneratedAt() {
        return lastGeneratedAt;
    }

    public List<ScheduleLine> getLines() {
        return lines;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
