package com.example.einvoice.service;

/**
 * Infrastructure failure while serialising, parsing or embedding a document.
 */
public class DocumentProcessingException extends RuntimeException {

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
