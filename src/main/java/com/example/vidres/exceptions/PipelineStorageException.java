package com.example.vidres.exceptions;

public class PipelineStorageException extends RuntimeException {
    public PipelineStorageException(String message) {
        super(message);
    }

    public PipelineStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
