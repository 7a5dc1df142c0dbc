package com.example.vidres.domain;

/**
 * States reported to owners and operators as a job moves through the pipeline.
 */
public enum JobState {
    QUEUED,
    IN_FLIGHT,
    COMPLETED,
    TIMED_OUT,
    CANCELLED,
    FAILED,
    REJECTED
}
