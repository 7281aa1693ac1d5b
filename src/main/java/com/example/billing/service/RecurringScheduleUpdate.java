package com.example.billing.service;

import com.example.billing.domain.RecurringSchedule.Frequency;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update of a recurring schedule. Null fields are left unchanged; a
 * non-null {@code lines} list replaces the template lines.
 */
public record RecurringScheduleUpdate(Frequency frequency, LocalDate endDate, Boolean active,
                                      String notes, List<LineItemRequest> lines) {
}
