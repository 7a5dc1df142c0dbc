package com.example.vidres.domain;

public enum RejectionReason {
    /** Too many jobs are in flight across the whole system. */
    SYSTEM_BUSY,
    /** In-flight plus queued work has reached the combined limit. */
    QUEUE_FULL,
    TOO_LARGE,
    UNSUPPORTED_FORMAT,
    CHANNEL_NOT_ACTIVE,
    RELOCATION_FAILED,
    SCHEDULING_FAILED
}
