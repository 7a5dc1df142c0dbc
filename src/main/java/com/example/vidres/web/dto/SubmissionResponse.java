package com.example.vidres.web.dto;

import com.example.vidres.domain.SubmissionResult;

public record SubmissionResponse(
        SubmissionResult.Outcome status,
        String jobId,
        Integer queuePosition,
        Integer estimatedMinutes,
        String message
) {
    public static SubmissionResponse from(SubmissionResult result, String message) {
        return new SubmissionResponse(
                result.outcome(),
                result.jobId(),
                result.isQueued() ? result.queuePosition() : null,
                result.isAccepted() ? result.estimatedMinutes() : null,
                message
        );
    }
}
