package com.example.vidres.exceptions;

import com.example.vidres.domain.RejectionReason;

/**
 * Raised at the web boundary when a submission ends REJECTED.
 */
public class AdmissionException extends RuntimeException {

    private final RejectionReason reason;

    public AdmissionException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
