package com.example.vidres.exceptions;

/**
 * Parking a staged video for the transcoder failed.
 */
public class SchedulingException extends RuntimeException {
    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
