package com.example.vidres.domain;

/**
 * Durable reference to a parked artifact awaiting transcoding.
 */
public record ParkedHandle(String value) {

    public ParkedHandle {
        if (value == null || value.isBlank() || value.contains("/") || value.contains("\\") || value.contains("..")) {
            throw new IllegalArgumentException("Invalid parked handle: " + value);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
