package com.example.vidres.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A video that has been admitted and parked and is now awaiting a result.
 */
public record TrackedJob(
        String jobId,
        Owner owner,
        ParkedHandle parkedHandle,
        Instant submittedAt,
        long originalSize,
        int durationSeconds,
        int estimatedMinutes
) {
    public TrackedJob {
        Objects.requireNonNull(jobId, "jobId cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(parkedHandle, "parkedHandle cannot be null");
        Objects.requireNonNull(submittedAt, "submittedAt cannot be null");
    }

    public OwnerKey ownerKey() {
        return owner.key();
    }
}
