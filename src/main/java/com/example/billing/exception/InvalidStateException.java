package com.example.billing.exception;

/**
 * Raised when an operation conflicts with the current state of a document:
 * editing a paid invoice, converting a quotation twice, paying a cancelled
 * invoice or paying more than the outstanding balance.
 */
public class InvalidStateException extends IllegalStateException {

    public InvalidStateException(String message) {
        super(message);
    }
}
