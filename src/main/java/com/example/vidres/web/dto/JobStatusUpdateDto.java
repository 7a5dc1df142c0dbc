package com.example.vidres.web.dto;

import com.example.vidres.domain.JobState;

/**
 * Data Transfer Object for sending job status updates via Server-Sent Events.
 */
public record JobStatusUpdateDto(
        String jobId,
        JobState status,
        String message
) {
}
