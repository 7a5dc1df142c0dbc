package com.example.vidres.service.impl;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.exceptions.PipelineStorageException;
import com.example.vidres.service.IncomingVideoStorage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

@Service
public class FilesystemIncomingVideoStorage implements IncomingVideoStorage {

    private static final Logger log = LoggerFactory.getLogger(FilesystemIncomingVideoStorage.class);
    private final Path rootLocation;

    public FilesystemIncomingVideoStorage(@Value("${vidres.storage.root}") String root) {
        this.rootLocation = Paths.get(root).toAbsolutePath().normalize().resolve("incoming");
    }

    @PostConstruct
    void initialize() {
        try {
            Files.createDirectories(rootLocation);
            log.info("Incoming video directory initialized at: {}", this.rootLocation);
        } catch (IOException e) {
            throw new PipelineStorageException("Could not initialize incoming directory: " + this.rootLocation, e);
        }
    }

    @Override
    public Path store(MultipartFile file, OwnerKey owner, String generatedFilename) throws PipelineStorageException {
        if (file.isEmpty()) {
            throw new PipelineStorageException("Failed to store empty file.");
        }
        if (generatedFilename == null || generatedFilename.isBlank()
                || generatedFilename.contains("/") || generatedFilename.contains("\\") || generatedFilename.contains("..")) {
            throw new PipelineStorageException("Invalid generated filename received by storage: " + generatedFilename);
        }

        try {
            Path destinationFile = this.rootLocation.resolve(generatedFilename).normalize().toAbsolutePath();
            if (!rootLocation.equals(destinationFile.getParent())) {
                log.error("SECURITY ALERT: Attempt to store file outside the incoming directory.");
                throw new PipelineStorageException(
                        "Security check failed: Cannot store file outside designated directory.");
            }
            if (Files.exists(destinationFile)) {
                log.warn("Attempted to store file that already exists (UUID collision?): {}", destinationFile);
                throw new PipelineStorageException("File already exists: " + generatedFilename);
            }

            try (var inputStream = file.getInputStream()) {
                Files.copy(inputStream, destinationFile);
            }
            log.info("Stored upload of {} as {}", owner, generatedFilename);
            return destinationFile;
        } catch (IOException e) {
            throw new PipelineStorageException("Failed to store file " + generatedFilename, e);
        } catch (InvalidPathException e) {
            throw new PipelineStorageException("Invalid generated filename provided: " + generatedFilename, e);
        }
    }

    @Override
    public void delete(Path storedFile) {
        if (storedFile == null || !storedFile.toAbsolutePath().normalize().startsWith(rootLocation)) {
            log.warn("Refusing to delete file outside the incoming directory: {}", storedFile);
            return;
        }
        try {
            if (Files.deleteIfExists(storedFile)) {
                log.debug("Deleted incoming file {}", storedFile);
            }
        } catch (IOException e) {
            log.warn("Could not delete incoming file {}: {}", storedFile, e.getMessage());
        }
    }
}
