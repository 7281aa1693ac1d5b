package com.example.billing.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;

/**
 * Template line of a recurring schedule. Holds no derived amounts; those are
 * computed afresh on every generated invoice.
 */
@Entity
@Table(name = "recurring_schedule_line", indexes = {
    @Index(name = "idx_schedule_line_schedule", columnList = "schedule_id")
})
public class ScheduleLine extends LineDetails {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_id", nullable = false)
    private RecurringSchedule schedule;

    @Column(name = "line_index")
    private int lineIndex;

    public ScheduleLine() {
    }

    public ScheduleLine(String description, BigDecimal quantity, BigDecimal unitPrice, int taxRate) {
        super(description, quantity, unitPrice, taxRate);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public RecurringSchedule getSchedule() {
        return schedule;
    }

    public void setSchedule(RecurringSchedule schedule) {
        this.schedule = schedule;
    }

    public int getLineIndex() {
        return lineIndex;
    }

    public void setLineIndex(int lineIndex) {
        this.lineIndex = lineIndex;
    }
}
