package com.example.vidres.service;

import java.nio.file.Path;
import java.util.Optional;

public interface VideoFormatInspector {

    /**
     * @return the codec of the first video stream, or empty if it could not be detected
     */
    Optional<String> detectVideoCodec(Path file);
}
