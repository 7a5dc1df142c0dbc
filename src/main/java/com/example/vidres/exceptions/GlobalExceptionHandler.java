package com.example.vidres.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Global Exception Handler using @RestControllerAdvice.
 * Uses RFC 7807 Problem Details for structured error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TIMESTAMP_PROPERTY = "timestamp";
    private static final String REASON_PROPERTY = "reason";

    // --- Pipeline Exceptions ---

    @ExceptionHandler(AdmissionException.class)
    public ProblemDetail handleAdmissionException(AdmissionException ex, WebRequest request) {
        HttpStatus status = switch (ex.getReason()) {
            case SYSTEM_BUSY, QUEUE_FULL -> HttpStatus.SERVICE_UNAVAILABLE;
            case TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case UNSUPPORTED_FORMAT -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case CHANNEL_NOT_ACTIVE -> HttpStatus.NOT_FOUND;
            case RELOCATION_FAILED, SCHEDULING_FAILED -> HttpStatus.BAD_GATEWAY;
        };
        log.info("Submission rejected for {}: {}", request.getDescription(false), ex.getReason());

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, describe(ex));
        problemDetail.setTitle(status.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(REASON_PROPERTY, ex.getReason().name());
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    private static String describe(AdmissionException ex) {
        return switch (ex.getReason()) {
            case SYSTEM_BUSY, QUEUE_FULL -> "The system is busy right now. Please try again in a few minutes.";
            case TOO_LARGE -> "The video exceeds the maximum allowed size.";
            case UNSUPPORTED_FORMAT -> "This video format is not supported.";
            case CHANNEL_NOT_ACTIVE -> "The channel is not active.";
            case RELOCATION_FAILED, SCHEDULING_FAILED -> "Failed to start processing the video. Please try again.";
        };
    }

    @ExceptionHandler(PipelineStorageException.class)
    public ProblemDetail handlePipelineStorageException(PipelineStorageException ex, WebRequest request) {
        log.error("Pipeline storage operation failed: {}", ex.getMessage(), ex);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to store the video. Please contact support if the problem persists."
        );
        problemDetail.setTitle(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    // --- General Spring Web Exceptions ---

    @Override
    protected ResponseEntity<Object> handleMissingServletRequestParameter(
            @NonNull MissingServletRequestParameterException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Missing request parameter for {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatus(status);
        problemDetail.setTitle(getReasonPhrase(status, "Missing Request Parameter"));
        problemDetail.setDetail(ex.getMessage());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        if (log.isInfoEnabled()) {
            log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                    request.getDescription(false), ex.getStatusCode(), ex.getReason());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        problemDetail.setTitle(getReasonPhrase(ex.getStatusCode()));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    // --- Generic Fallback Handler and Override for Internal Exceptions ---

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Unhandled exception caught by @ExceptionHandler(Exception.class) for request {}:",
                request.getDescription(false), ex);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later or contact support."
        );
        problemDetail.setTitle(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        if (ex instanceof MaxUploadSizeExceededException maxEx) {
            log.warn("Max upload size exceeded: {}", maxEx.getMessage());
            ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                    HttpStatus.PAYLOAD_TOO_LARGE,
                    "Maximum upload size exceeded. " + maxEx.getLocalizedMessage()
            );
            problemDetail.setTitle(HttpStatus.PAYLOAD_TOO_LARGE.getReasonPhrase());
            problemDetail.setInstance(URI.create(request.getDescription(false)));
            problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
            return new ResponseEntity<>(problemDetail, headers, HttpStatus.PAYLOAD_TOO_LARGE);
        }

        ProblemDetail problemDetailToReturn;
        if (body instanceof ProblemDetail pdBody) {
            problemDetailToReturn = pdBody;
            Map<String, Object> properties = problemDetailToReturn.getProperties();
            if (properties == null || !properties.containsKey(TIMESTAMP_PROPERTY)) {
                problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
            }
            if (problemDetailToReturn.getInstance() == null) {
                problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
            }
            if (problemDetailToReturn.getTitle() == null) {
                problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            }
        } else {
            log.warn("Creating basic ProblemDetail in handleExceptionInternal for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            problemDetailToReturn = ProblemDetail.forStatus(statusCode);
            problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            problemDetailToReturn.setDetail(ex.getMessage());
            problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
            problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        }

        return new ResponseEntity<>(problemDetailToReturn, headers, statusCode);
    }

    private String getReasonPhrase(HttpStatusCode statusCode) {
        return getReasonPhrase(statusCode, "Error");
    }

    private String getReasonPhrase(HttpStatusCode statusCode, String fallback) {
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        return status != null ? status.getReasonPhrase() : fallback;
    }
}
