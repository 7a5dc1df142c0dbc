package com.example.vidres.service;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.exceptions.PipelineStorageException;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;

/**
 * Holds uploads until the pipeline relocates them.
 */
public interface IncomingVideoStorage {

    Path store(MultipartFile file, OwnerKey owner, String generatedFilename) throws PipelineStorageException;

    void delete(Path storedFile);
}
