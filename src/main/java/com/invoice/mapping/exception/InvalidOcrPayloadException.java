package com.invoice.mapping.exception;

/**
 * The OCR payload is missing or unusable. Fails the whole mapping run for the document.
 */
public class InvalidOcrPayloadException extends RuntimeException {

    public InvalidOcrPayloadException(String message) {
        super(message);
    }
}
