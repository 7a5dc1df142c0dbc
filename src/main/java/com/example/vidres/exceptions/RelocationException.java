package com.example.vidres.exceptions;

/**
 * Moving an upload into pipeline-owned storage failed.
 */
public class RelocationException extends RuntimeException {
    public RelocationException(String message) {
        super(message);
    }

    public RelocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
