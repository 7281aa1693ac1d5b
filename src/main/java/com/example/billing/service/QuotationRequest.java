package com.example.billing.service;

import java.time.LocalDate;
import java.util.List;

public record QuotationRequest(Long customerId, LocalDate quotationDate, LocalDate validUntil,
                               String notes, List<LineItemRequest> lines) {
}
