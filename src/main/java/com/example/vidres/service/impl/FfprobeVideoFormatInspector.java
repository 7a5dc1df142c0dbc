package com.example.vidres.service.impl;

import com.example.vidres.service.VideoFormatInspector;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.probe.FFmpegStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

@Component
public class FfprobeVideoFormatInspector implements VideoFormatInspector {

    private static final Logger log = LoggerFactory.getLogger(FfprobeVideoFormatInspector.class);

    private final FFprobe ffprobe;

    public FfprobeVideoFormatInspector(ObjectProvider<FFprobe> ffprobeProvider) {
        this.ffprobe = ffprobeProvider.getIfAvailable();
    }

    @Override
    public Optional<String> detectVideoCodec(Path file) {
        if (ffprobe == null) {
            log.debug("FFprobe not configured; skipping codec detection for {}", file);
            return Optional.empty();
        }
        try {
            FFmpegProbeResult probeResult = ffprobe.probe(file.toAbsolutePath().toString());
            if (probeResult.getStreams() == null) {
                return Optional.empty();
            }
            for (FFmpegStream stream : probeResult.getStreams()) {
                if (stream.codec_type == FFmpegStream.CodecType.VIDEO && stream.codec_name != null) {
                    return Optional.of(stream.codec_name);
                }
            }
            log.warn("No video stream found in {}", file);
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warn("Codec detection failed for {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
