package com.example.vidres.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An uploaded video waiting to be processed. {@code durationSeconds} and {@code height} are
 * metadata reported by the client; zero means unknown.
 */
public record VideoAsset(Path source, String fileName, long fileSize, int durationSeconds, int height) {

    public VideoAsset {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(fileName, "fileName cannot be null");
        if (fileSize < 0 || durationSeconds < 0 || height < 0) {
            throw new IllegalArgumentException("Size, duration and height cannot be negative");
        }
    }
}
