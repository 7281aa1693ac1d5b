package com.example.billing.service;

import com.example.billing.domain.Invoice;

/**
 * Outcome of running one recurring schedule. {@code invoice} is null unless an
 * invoice was generated.
 */
public record RecurringGenerationResult(Long scheduleId, Outcome outcome, Invoice invoice,
                                        boolean scheduleDeactivated) {

    public enum Outcome {
        GENERATED,
        DEACTIVATED,  // End date passed before the run, nothing generated
        SKIPPED       // No longer due when reloaded
    }

    static RecurringGenerationResult generated(Long scheduleId, Invoice invoice, boolean deactivated) {
        return new RecurringGenerationResult(scheduleId, Outcome.GENERATED, invoice, deactivated);
    }

    static RecurringGenerationResult deactivated(Long scheduleId) {
        return new RecurringGenerationResult(scheduleId, Outcome.DEACTIVATED, null, true);
    }

    static RecurringGenerationResult skipped(Long scheduleId) {
        return new RecurringGenerationResult(scheduleId, Outcome.SKIPPED, null, false);
    }
}
