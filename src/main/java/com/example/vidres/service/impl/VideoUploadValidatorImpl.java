package com.example.vidres.service.impl;

import com.example.vidres.exceptions.VideoValidationException;
import com.example.vidres.service.VideoUploadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Locale;

/**
 * Size is not checked here: oversize uploads are a pipeline rejection with its own notice.
 */
@Component
public class VideoUploadValidatorImpl implements VideoUploadValidator {

    private static final Logger log = LoggerFactory.getLogger(VideoUploadValidatorImpl.class);

    private static final byte[] MP4_MAGIC_BYTES_FTYP = new byte[]{0x66, 0x74, 0x79, 0x70};
    private static final int MP4_MAGIC_BYTE_OFFSET = 4;
    private static final byte[] MATROSKA_MAGIC_BYTES_EBML = new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3};
    private static final int MAGIC_BYTE_READ_LENGTH = 8;

    @Override
    public void validate(MultipartFile file) throws VideoValidationException {
        if (file == null || file.isEmpty()) {
            throw new VideoValidationException(HttpStatus.BAD_REQUEST, "File cannot be null or empty");
        }

        String originalFilename = validateAndSanitizeOriginalFilename(file.getOriginalFilename());
        String extension = StringUtils.getFilenameExtension(originalFilename);
        String container = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        if (!container.equals("mp4") && !container.equals("mkv")) {
            throw new VideoValidationException(HttpStatus.BAD_REQUEST,
                    "Invalid file type. Only .mp4 and .mkv files are allowed.");
        }

        try {
            if (!hasMagicBytes(file, container)) {
                log.warn("Upload rejected: File failed magic byte validation. Original Filename: '{}'", originalFilename);
                throw new VideoValidationException(HttpStatus.BAD_REQUEST,
                        "File content does not match its ." + container + " extension.");
            }
        } catch (IOException e) {
            throw new VideoValidationException(HttpStatus.INTERNAL_SERVER_ERROR, "Error reading file for validation.", e);
        }

        log.debug("File validation passed for original filename: '{}'", originalFilename);
    }

    private String validateAndSanitizeOriginalFilename(String originalFilenameRaw) throws VideoValidationException {
        if (originalFilenameRaw == null || originalFilenameRaw.isBlank()) {
            throw new VideoValidationException(HttpStatus.BAD_REQUEST, "Original file name is missing or blank.");
        }
        if (originalFilenameRaw.matches(".*\\p{Cntrl}.*") || originalFilenameRaw.contains("..")
                || originalFilenameRaw.contains("/") || originalFilenameRaw.contains("\\")) {
            log.warn("Upload rejected: Invalid characters detected in original filename: '{}'", originalFilenameRaw);
            throw new VideoValidationException(HttpStatus.BAD_REQUEST, "Invalid characters in original filename.");
        }
        return StringUtils.cleanPath(originalFilenameRaw);
    }

    private boolean hasMagicBytes(MultipartFile file, String container) throws IOException {
        try (InputStream inputStream = file.getInputStream()) {
            byte[] initialBytes = inputStream.readNBytes(MAGIC_BYTE_READ_LENGTH);
            if (container.equals("mkv")) {
                return startsWith(initialBytes, 0, MATROSKA_MAGIC_BYTES_EBML);
            }
            return startsWith(initialBytes, MP4_MAGIC_BYTE_OFFSET, MP4_MAGIC_BYTES_FTYP);
        }
    }

    private static boolean startsWith(byte[] data, int offset, byte[] expected) {
        if (data.length < offset + expected.length) {
            log.warn("Could not read enough bytes ({}) for magic byte check.", data.length);
            return false;
        }
        return Arrays.equals(expected, Arrays.copyOfRange(data, offset, offset + expected.length));
    }
}
