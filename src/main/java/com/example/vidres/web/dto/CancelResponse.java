package com.example.vidres.web.dto;

import com.example.vidres.domain.CancelResult;

public record CancelResponse(
        CancelResult.Outcome status,
        String jobId,
        int remainingInFlight,
        String message
) {
}
