package com.example.vidres.exceptions;

/**
 * A completion probe could not be answered. Treated as transient: the job stays tracked.
 */
public class ProbeException extends RuntimeException {
    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
