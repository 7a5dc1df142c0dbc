package com.example.vidres.service;

import com.example.vidres.config.PipelineProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProcessingTimeEstimator Tests")
class ProcessingTimeEstimatorTest {

    private final ProcessingTimeEstimator estimator = new ProcessingTimeEstimator(
            new PipelineProperties(Duration.ofSeconds(30), Duration.ofHours(1), 100, 1000,
                    new PipelineProperties.Limits(1, 5, 5), 0.033, null));

    @ParameterizedTest(name = "{0}p -> {1} renditions")
    @CsvSource({"2160,4", "1080,4", "720,3", "1079,3", "480,2", "0,2"})
    @DisplayName("✅ Rendition count follows the source height")
    void renditionsFor_Height(int height, int expected) {
        assertThat(ProcessingTimeEstimator.renditionsFor(height)).isEqualTo(expected);
    }

    @Test
    @DisplayName("✅ One hour of 1080p takes about eight minutes")
    void estimate_OneHourFullHd() {
        // 0.033 * 60 * 4 = 7.92
        assertThat(estimator.estimateMinutes(3600, 1080)).isEqualTo(8);
    }

    @Test
    @DisplayName("✅ Short clips round up to one minute")
    void estimate_ShortClip_RoundsUp() {
        assertThat(estimator.estimateMinutes(30, 480)).isEqualTo(1);
    }

    @Test
    @DisplayName("✅ Unknown duration estimates zero")
    void estimate_UnknownDuration_Zero() {
        assertThat(estimator.estimateMinutes(0, 720)).isZero();
    }
}
