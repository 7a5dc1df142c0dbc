package com.example.vidres.service.impl;

import com.example.vidres.domain.ParkedHandle;
import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.StagedAsset;
import com.example.vidres.domain.VideoAsset;
import com.example.vidres.domain.VideoVariant;
import com.example.vidres.exceptions.PipelineStorageException;
import com.example.vidres.exceptions.ProbeException;
import com.example.vidres.exceptions.RelocationException;
import com.example.vidres.exceptions.SchedulingException;
import com.example.vidres.service.ProcessingGateway;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Talks to the transcoder through a shared work directory:
 * <pre>
 * staging/&lt;jobId&gt;.&lt;ext&gt;          relocated uploads
 * parked/&lt;handle&gt;/               picked up by the transcoder
 * processed/&lt;handle&gt;/READY        written by the transcoder once all renditions are present
 * processed/&lt;handle&gt;/*-720p.mp4   renditions
 * </pre>
 */
@Service
public class FilesystemProcessingGateway implements ProcessingGateway {

    private static final Logger log = LoggerFactory.getLogger(FilesystemProcessingGateway.class);

    static final String READY_MARKER = "READY";
    private static final Pattern HEIGHT_SUFFIX = Pattern.compile("-(\\d{3,4})p\\.[^.]+$");

    private final Path stagingDir;
    private final Path parkedDir;
    private final Path processedDir;

    public FilesystemProcessingGateway(@Value("${vidres.storage.root}") String root) {
        Path base = Paths.get(root).toAbsolutePath().normalize();
        this.stagingDir = base.resolve("staging");
        this.parkedDir = base.resolve("parked");
        this.processedDir = base.resolve("processed");
    }

    @PostConstruct
    void initialize() {
        for (Path dir : List.of(stagingDir, parkedDir, processedDir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new PipelineStorageException("Could not initialize pipeline directory: " + dir, e);
            }
        }
        log.info("Processing work directories initialized under: {}", stagingDir.getParent());
    }

    @Override
    public StagedAsset relocate(VideoAsset asset) throws RelocationException {
        Path source = asset.source();
        if (!Files.isRegularFile(source)) {
            throw new RelocationException("Upload no longer exists: " + source);
        }
        String jobId = UUID.randomUUID().toString();
        Path target = stagingDir.resolve(jobId + extensionOf(asset.fileName()));
        try {
            Files.move(source, target);
        } catch (IOException e) {
            throw new RelocationException("Failed to move upload into staging: " + source, e);
        }
        log.debug("Relocated '{}' to {}", asset.fileName(), target);
        return new StagedAsset(jobId, target);
    }

    @Override
    public ParkedHandle parkForProcessing(StagedAsset staged) throws SchedulingException {
        ParkedHandle handle = new ParkedHandle(UUID.randomUUID().toString());
        Path dir = parkedDir.resolve(handle.value());
        try {
            Files.createDirectories(dir);
            Files.move(staged.location(), dir.resolve(staged.location().getFileName()));
        } catch (IOException e) {
            deleteQuietly(dir);
            throw new SchedulingException("Failed to park job " + staged.stagingId() + " for processing", e);
        }
        log.debug("Parked job {} as {}", staged.stagingId(), handle);
        return handle;
    }

    @Override
    public Optional<ProcessedVideo> probeCompletion(ParkedHandle handle) throws ProbeException {
        Path dir = processedDir.resolve(handle.value());
        if (!Files.exists(dir.resolve(READY_MARKER))) {
            return Optional.empty();
        }
        List<VideoVariant> variants;
        try (Stream<Path> files = Files.list(dir)) {
            variants = files
                    .filter(Files::isRegularFile)
                    .filter(FilesystemProcessingGateway::isVideoFile)
                    .map(FilesystemProcessingGateway::toVariant)
                    .sorted(Comparator.comparingInt(VideoVariant::height)
                            .thenComparingLong(VideoVariant::size)
                            .reversed())
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new ProbeException("Failed to read processed output for " + handle, e);
        }
        if (variants.isEmpty()) {
            log.warn("Processed output for {} is marked ready but contains no videos", handle);
            return Optional.empty();
        }
        return Optional.of(new ProcessedVideo(variants.get(0), variants.subList(1, variants.size())));
    }

    @Override
    public void cancelParked(ParkedHandle handle) {
        deleteQuietly(parkedDir.resolve(handle.value()));
        deleteQuietly(processedDir.resolve(handle.value()));
        log.debug("Removed parked artifact {}", handle);
    }

    @Override
    public void discardStaged(StagedAsset staged) {
        deleteQuietly(staged.location());
    }

    @Override
    public void releaseSource(VideoAsset asset) {
        deleteQuietly(asset.source());
    }

    private static boolean isVideoFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".mp4") || name.endsWith(".mkv");
    }

    private static VideoVariant toVariant(Path file) {
        Matcher matcher = HEIGHT_SUFFIX.matcher(file.getFileName().toString());
        int height = matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
        try {
            return new VideoVariant(file, height, Files.size(file));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String extensionOf(String fileName) {
        String extension = StringUtils.getFilenameExtension(fileName);
        return extension == null ? "" : "." + extension.toLowerCase(Locale.ROOT);
    }

    private static void deleteQuietly(Path path) {
        try {
            FileSystemUtils.deleteRecursively(path);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
