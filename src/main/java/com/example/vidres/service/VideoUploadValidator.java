package com.example.vidres.service;

import com.example.vidres.exceptions.VideoValidationException;
import org.springframework.web.multipart.MultipartFile;

public interface VideoUploadValidator {

    /**
     * Checks emptiness, file name safety, extension and container signature.
     */
    void validate(MultipartFile file) throws VideoValidationException;
}
