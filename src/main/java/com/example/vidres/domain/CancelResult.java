package com.example.vidres.domain;

public record CancelResult(Outcome outcome, String jobId, int remainingInFlight) {

    public enum Outcome {
        CANCELLED,
        NOTHING_TO_CANCEL
    }

    public static CancelResult cancelled(String jobId, int remainingInFlight) {
        return new CancelResult(Outcome.CANCELLED, jobId, remainingInFlight);
    }

    public static CancelResult nothingToCancel() {
        return new CancelResult(Outcome.NOTHING_TO_CANCEL, null, 0);
    }

    public boolean isCancelled() {
        return outcome == Outcome.CANCELLED;
    }
}
