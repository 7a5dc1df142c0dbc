package com.example.vidres.domain;

/**
 * Point-in-time counters for the operator view.
 */
public record PipelineSnapshot(int inFlight, int pending, int activeOwners) {
}
