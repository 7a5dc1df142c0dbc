package com.example.vidres.web.dto;

import com.example.vidres.domain.PipelineSnapshot;

import java.time.Instant;

public record PipelineStatusResponse(
        int inFlight,
        int pending,
        int activeOwners,
        Instant timestamp
) {
    public static PipelineStatusResponse from(PipelineSnapshot snapshot, Instant timestamp) {
        return new PipelineStatusResponse(snapshot.inFlight(), snapshot.pending(), snapshot.activeOwners(), timestamp);
    }
}
