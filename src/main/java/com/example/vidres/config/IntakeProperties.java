package com.example.vidres.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Pre-submission checks applied to uploads.
 *
 * @param maxVideoSize   largest accepted upload
 * @param allowedFormats {@code codec:container} pairs, e.g. {@code h264:mp4}
 */
@ConfigurationProperties(prefix = "vidres.intake")
@Validated
public record IntakeProperties(
        @NotNull DataSize maxVideoSize,
        @NotEmpty List<String> allowedFormats
) {

    public boolean isAllowed(String codec, String container) {
        if (codec == null || container == null) {
            return false;
        }
        String format = codec.toLowerCase(Locale.ROOT) + ":" + container.toLowerCase(Locale.ROOT);
        return allowedFormats.stream().anyMatch(allowed -> allowed.equalsIgnoreCase(format));
    }
}
