package com.chunkanon.application.anonymize;

public class AnonymizationException extends RuntimeException {

    public AnonymizationException(String message) {
        super(message);
    }

    public AnonymizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
