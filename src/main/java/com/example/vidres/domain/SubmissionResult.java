package com.example.vidres.domain;

/**
 * Outcome of a submission. Only the fields relevant to the outcome are populated:
 * {@code jobId} and {@code estimatedMinutes} for ACCEPTED, {@code queuePosition} for QUEUED,
 * {@code reason} for REJECTED.
 */
public record SubmissionResult(Outcome outcome, String jobId, int queuePosition, int estimatedMinutes,
                               RejectionReason reason) {

    public enum Outcome {
        ACCEPTED,
        QUEUED,
        REJECTED
    }

    public static SubmissionResult accepted(String jobId, int estimatedMinutes) {
        return new SubmissionResult(Outcome.ACCEPTED, jobId, 0, estimatedMinutes, null);
    }

    public static SubmissionResult queued(int queuePosition) {
        return new SubmissionResult(Outcome.QUEUED, null, queuePosition, 0, null);
    }

    public static SubmissionResult rejected(RejectionReason reason) {
        return new SubmissionResult(Outcome.REJECTED, null, 0, 0, reason);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }

    public boolean isQueued() {
        return outcome == Outcome.QUEUED;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }
}
