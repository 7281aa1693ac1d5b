package com.example.billing.exception;

/**
 * Raised for malformed input: negative or zero amounts, out-of-range tax rates,
 * missing dates, unknown status values.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
