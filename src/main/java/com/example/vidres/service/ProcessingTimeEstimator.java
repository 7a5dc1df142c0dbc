package com.example.vidres.service;

import com.example.vidres.config.PipelineProperties;
import org.springframework.stereotype.Component;

/**
 * Rough processing time: the transcoder spends about {@code estimateFactor} minutes per minute of
 * video for each rendition it produces, and taller sources produce more renditions.
 */
@Component
public class ProcessingTimeEstimator {

    private final double factor;

    public ProcessingTimeEstimator(PipelineProperties properties) {
        this.factor = properties.estimateFactor();
    }

    public int estimateMinutes(int durationSeconds, int height) {
        double durationMinutes = durationSeconds / 60.0;
        return (int) (factor * durationMinutes * renditionsFor(height) + 0.99);
    }

    static int renditionsFor(int height) {
        if (height >= 1080) {
            return 4;
        }
        if (height >= 720) {
            return 3;
        }
        return 2;
    }
}
