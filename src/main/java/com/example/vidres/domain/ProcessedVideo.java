package com.example.vidres.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of a finished transcode: the highest-resolution rendition plus the remaining ones.
 */
public record ProcessedVideo(VideoVariant original, List<VideoVariant> alternatives) {

    public ProcessedVideo {
        Objects.requireNonNull(original, "original cannot be null");
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public int variantCount() {
        return 1 + alternatives.size();
    }
}
