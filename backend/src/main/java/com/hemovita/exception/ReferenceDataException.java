package com.hemovita.exception;

/**
 * Raised when a required reference table cannot be loaded at startup.
 * The application context refuses to start rather than serve partial data.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
