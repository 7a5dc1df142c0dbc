package com.example.vidres.service.impl;

import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.VideoVariant;
import com.example.vidres.exceptions.DeliveryException;
import com.example.vidres.exceptions.PipelineStorageException;
import com.example.vidres.service.ResultDeliveryService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes results to {@code outbox/users/<userId>/<jobId>/} and
 * {@code outbox/channels/<channelId>/<messageId>/}.
 */
@Service
public class FilesystemResultDeliveryService implements ResultDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(FilesystemResultDeliveryService.class);

    static final String CHANNEL_VIDEO_NAME = "video";

    private final Path usersOutbox;
    private final Path channelsOutbox;

    public FilesystemResultDeliveryService(@Value("${vidres.storage.root}") String root) {
        Path outbox = Paths.get(root).toAbsolutePath().normalize().resolve("outbox");
        this.usersOutbox = outbox.resolve("users");
        this.channelsOutbox = outbox.resolve("channels");
    }

    @PostConstruct
    void initialize() {
        try {
            Files.createDirectories(usersOutbox);
            Files.createDirectories(channelsOutbox);
        } catch (IOException e) {
            throw new PipelineStorageException("Could not initialize outbox under: " + usersOutbox.getParent(), e);
        }
    }

    @Override
    public int deliverResult(long userId, String jobId, ProcessedVideo result) throws DeliveryException {
        Path target = usersOutbox.resolve(Long.toString(userId)).resolve(jobId);
        try {
            Files.createDirectories(target);
        } catch (IOException e) {
            throw new DeliveryException("Could not create delivery folder for user " + userId, e);
        }

        int delivered = 0;
        if (copyVariant(result.original(), target, "original")) {
            delivered++;
        }
        for (int i = 0; i < result.alternatives().size(); i++) {
            if (copyVariant(result.alternatives().get(i), target, "alt" + (i + 1))) {
                delivered++;
            }
        }
        if (delivered == 0) {
            throw new DeliveryException("No rendition of job " + jobId + " could be delivered to user " + userId);
        }
        log.info("Delivered {} of {} rendition(s) of job {} to user {}", delivered, result.variantCount(), jobId, userId);
        return delivered;
    }

    private boolean copyVariant(VideoVariant variant, Path targetDir, String prefix) {
        String name = prefix + "-" + variant.height() + "p" + extensionOf(variant.file());
        try {
            Files.copy(variant.file(), targetDir.resolve(name), StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            log.warn("Failed to deliver rendition {}: {}", variant.file(), e.getMessage());
            return false;
        }
    }

    @Override
    public void replaceInPlace(long channelId, long messageId, ProcessedVideo result) throws DeliveryException {
        Path postDir = channelsOutbox.resolve(Long.toString(channelId)).resolve(Long.toString(messageId));
        Path source = result.original().file();
        Path temp = null;
        try {
            Files.createDirectories(postDir);
            temp = Files.createTempFile(postDir, CHANNEL_VIDEO_NAME, ".part");
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, postDir.resolve(CHANNEL_VIDEO_NAME + extensionOf(source)), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new DeliveryException("Failed to replace post " + messageId + " in channel " + channelId, e);
        }
        log.info("Replaced post {} in channel {} with processed video", messageId, channelId);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", file, e.getMessage());
        }
    }

    private static String extensionOf(Path file) {
        String extension = StringUtils.getFilenameExtension(file.getFileName().toString());
        return extension == null ? "" : "." + extension;
    }
}
