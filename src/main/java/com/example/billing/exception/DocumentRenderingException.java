package com.example.billing.exception;

/**
 * Raised when an invoice could not be rendered to PDF or XML.
 */
public class DocumentRenderingException extends RuntimeException {

    public DocumentRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
