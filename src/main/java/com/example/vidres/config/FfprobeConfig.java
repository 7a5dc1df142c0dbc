package com.example.vidres.config;

import net.bramp.ffmpeg.FFprobe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class FfprobeConfig {

    private static final Logger log = LoggerFactory.getLogger(FfprobeConfig.class);

    @Value("${ffprobe.path:}")
    private String ffprobePath;

    /**
     * FFprobe is optional: without it format detection is skipped and every upload passes the
     * codec check.
     */
    @Bean
    public FFprobe fFprobe() throws IOException {
        if (ffprobePath == null || ffprobePath.isBlank()) {
            log.warn("ffprobe.path is not configured. Codec detection is disabled.");
            return null;
        }
        log.info("Creating FFprobe bean with path: {}", ffprobePath);
        return new FFprobe(ffprobePath);
    }
}
