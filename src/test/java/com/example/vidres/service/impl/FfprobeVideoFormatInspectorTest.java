package com.example.vidres.service.impl;

import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.probe.FFmpegStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
@DisplayName("FfprobeVideoFormatInspector Tests")
class FfprobeVideoFormatInspectorTest {

    @Mock
    private FFprobe ffprobe;

    @Mock
    private ObjectProvider<FFprobe> ffprobeProvider;

    private final Path file = Path.of("clip.mp4");

    private FfprobeVideoFormatInspector inspector() {
        return new FfprobeVideoFormatInspector(ffprobeProvider);
    }

    private static FFmpegStream stream(FFmpegStream.CodecType type, String codecName) {
        FFmpegStream stream = new FFmpegStream();
        stream.codec_type = type;
        stream.codec_name = codecName;
        return stream;
    }

    private static FFmpegProbeResult resultWith(FFmpegStream... streams) {
        FFmpegProbeResult result = new FFmpegProbeResult();
        result.streams = new ArrayList<>(List.of(streams));
        return result;
    }

    @Test
    @DisplayName("⚠️ Missing FFprobe skips detection")
    void detect_NoFfprobe_Empty() {
        given(ffprobeProvider.getIfAvailable()).willReturn(null);

        assertThat(inspector().detectVideoCodec(file)).isEmpty();
    }

    @Test
    @DisplayName("❌ FFprobe failure yields no codec")
    void detect_IoFailure_Empty() throws IOException {
        given(ffprobeProvider.getIfAvailable()).willReturn(ffprobe);
        given(ffprobe.probe(anyString())).willThrow(new IOException("ffprobe exited with 1"));

        assertThat(inspector().detectVideoCodec(file)).isEmpty();
    }

    @Test
    @DisplayName("⚠️ Audio-only file has no video codec")
    void detect_NoVideoStream_Empty() throws IOException {
        given(ffprobeProvider.getIfAvailable()).willReturn(ffprobe);
        given(ffprobe.probe(anyString())).willReturn(resultWith(stream(FFmpegStream.CodecType.AUDIO, "aac")));

        assertThat(inspector().detectVideoCodec(file)).isEmpty();
    }

    @Test
    @DisplayName("✅ Codec of the first video stream is reported")
    void detect_VideoStream_CodecName() throws IOException {
        given(ffprobeProvider.getIfAvailable()).willReturn(ffprobe);
        given(ffprobe.probe(anyString())).willReturn(resultWith(
                stream(FFmpegStream.CodecType.AUDIO, "aac"),
                stream(FFmpegStream.CodecType.VIDEO, "h264")));

        assertThat(inspector().detectVideoCodec(file)).contains("h264");
        then(ffprobe).should().probe(file.toAbsolutePath().toString());
    }
}
