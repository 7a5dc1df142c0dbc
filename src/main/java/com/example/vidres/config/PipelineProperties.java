package com.example.vidres.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for admission, polling and estimates.
 *
 * @param pollInterval   delay between two completion sweeps
 * @param timeout        age after which a tracked job is abandoned
 * @param maxInFlight    submissions are rejected as busy once this many jobs are in flight
 * @param queueSizeLimit submissions are rejected once in-flight plus queued work reaches this
 * @param limits         per-plan concurrency limits
 * @param estimateFactor minutes of processing per minute of video per rendition
 * @param adminId        user id that receives operator reports; {@code null} disables them
 */
@ConfigurationProperties(prefix = "vidres.pipeline")
@Validated
public record PipelineProperties(
        @NotNull Duration pollInterval,
        @NotNull Duration timeout,
        @Positive int maxInFlight,
        @Positive int queueSizeLimit,
        @Valid @NotNull Limits limits,
        @Positive double estimateFactor,
        Long adminId
) {

    public record Limits(
            @Positive int regular,
            @Positive int premium,
            @Positive int channel
    ) {
    }
}
