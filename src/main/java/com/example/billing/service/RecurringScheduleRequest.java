package com.example.billing.service;

import com.example.billing.domain.RecurringSchedule.Frequency;

import java.time.LocalDate;
import java.util.List;

public record RecurringScheduleRequest(Long customerId, Frequency frequency, LocalDate startDate,
                                       LocalDate endDate, String notes, List<LineItemRequest> lines) {
}
