package com.example.vidres.service.impl;

import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.VideoVariant;
import com.example.vidres.exceptions.DeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FilesystemResultDeliveryService Tests")
class FilesystemResultDeliveryServiceTest {

    @TempDir
    Path root;

    private FilesystemResultDeliveryService deliveryService;
    private Path work;

    @BeforeEach
    void setUp() throws IOException {
        deliveryService = new FilesystemResultDeliveryService(root.toString());
        deliveryService.initialize();
        work = Files.createDirectories(root.resolve("work"));
    }

    private VideoVariant variant(String name, int height) throws IOException {
        Path file = Files.write(work.resolve(name), new byte[height / 10]);
        return new VideoVariant(file, height, height / 10);
    }

    @Test
    @DisplayName("✅ User receives the original and every alternative")
    void deliverResult_CopiesAllRenditions() throws IOException {
        ProcessedVideo result = new ProcessedVideo(variant("v-1080p.mp4", 1080),
                List.of(variant("v-720p.mp4", 720), variant("v-480p.mp4", 480)));

        int delivered = deliveryService.deliverResult(5, "job-1", result);

        Path target = root.resolve("outbox/users/5/job-1");
        assertThat(delivered).isEqualTo(3);
        assertThat(target.resolve("original-1080p.mp4")).exists();
        assertThat(target.resolve("alt1-720p.mp4")).exists();
        assertThat(target.resolve("alt2-480p.mp4")).exists();
    }

    @Test
    @DisplayName("⚠️ A missing alternative does not stop the others")
    void deliverResult_OneMissing_PartialDelivery() throws IOException {
        VideoVariant missing = new VideoVariant(work.resolve("gone-720p.mp4"), 720, 0);
        ProcessedVideo result = new ProcessedVideo(variant("v-1080p.mp4", 1080), List.of(missing));

        assertThat(deliveryService.deliverResult(5, "job-1", result)).isEqualTo(1);
    }

    @Test
    @DisplayName("❌ Nothing deliverable raises DeliveryException")
    void deliverResult_NothingDelivered_Throws() {
        ProcessedVideo result = new ProcessedVideo(new VideoVariant(work.resolve("gone.mp4"), 720, 0), List.of());

        assertThatThrownBy(() -> deliveryService.deliverResult(5, "job-1", result))
                .isInstanceOf(DeliveryException.class);
    }

    @Test
    @DisplayName("✅ Channel post is replaced by the original rendition")
    void replaceInPlace_OverwritesPost() throws IOException {
        Path post = Files.createDirectories(root.resolve("outbox/channels/9/77"));
        Files.writeString(post.resolve("video.mp4"), "old");

        deliveryService.replaceInPlace(9, 77, new ProcessedVideo(variant("v-1080p.mp4", 1080), List.of()));

        assertThat(Files.size(post.resolve("video.mp4"))).isEqualTo(108);
        try (var files = Files.list(post)) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    @DisplayName("❌ Missing processed file raises DeliveryException")
    void replaceInPlace_MissingSource_Throws() {
        ProcessedVideo result = new ProcessedVideo(new VideoVariant(work.resolve("gone.mp4"), 720, 0), List.of());

        assertThatThrownBy(() -> deliveryService.replaceInPlace(9, 77, result))
                .isInstanceOf(DeliveryException.class);
    }

    @Test
    @DisplayName("⚠️ Failed replacement leaves no partial file in the post folder")
    void replaceInPlace_CopyFails_NoPartialFileLeft() throws IOException {
        ProcessedVideo result = new ProcessedVideo(new VideoVariant(work.resolve("gone.mp4"), 720, 0), List.of());

        assertThatThrownBy(() -> deliveryService.replaceInPlace(9, 77, result))
                .isInstanceOf(DeliveryException.class);

        Path postDir = root.resolve("outbox").resolve("channels").resolve("9").resolve("77");
        try (Stream<Path> files = Files.list(postDir)) {
            assertThat(files).isEmpty();
        }
    }
}
