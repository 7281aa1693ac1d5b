package com.example.billing.service;

import java.util.List;

/**
 * Result of one sweep over the due recurring schedules.
 */
public record RecurringRunSummary(int generated, int deactivated, int failed, List<Long> failedScheduleIds) {

    public int processed() {
        return generated + deactivated + failed;
    }
}
