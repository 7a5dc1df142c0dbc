package com.example.vidres.domain;

import java.nio.file.Path;

/**
 * One rendition produced by the transcoder. {@code height} is 0 when it could not be determined.
 */
public record VideoVariant(Path file, int height, long size) {
}
