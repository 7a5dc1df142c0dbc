package com.example.vidres.web.controller;

import com.example.vidres.domain.CancelResult;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.SubmissionResult;
import com.example.vidres.exceptions.AdmissionException;
import com.example.vidres.service.LifecycleCoordinator;
import com.example.vidres.service.PipelineMessages;
import com.example.vidres.service.VideoIntakeService;
import com.example.vidres.web.dto.CancelResponse;
import com.example.vidres.web.dto.PipelineStatusResponse;
import com.example.vidres.web.dto.SubmissionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;

@RestController
@RequestMapping("/api")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final VideoIntakeService intakeService;
    private final LifecycleCoordinator coordinator;
    private final Clock clock;

    public PipelineController(VideoIntakeService intakeService, LifecycleCoordinator coordinator, Clock clock) {
        this.intakeService = intakeService;
        this.coordinator = coordinator;
        this.clock = clock;
    }

    @PostMapping(value = "/users/{userId}/videos", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmissionResponse> submitUserVideo(
            @PathVariable long userId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "durationSeconds", defaultValue = "0") int durationSeconds,
            @RequestParam(value = "height", defaultValue = "0") int height) {
        log.info("Video upload from user {}: '{}' ({} bytes)", userId, file.getOriginalFilename(), file.getSize());
        SubmissionResult result = intakeService.submitUserVideo(userId, file, durationSeconds, height);
        return toResponse(result);
    }

    @PostMapping(value = "/channels/{channelId}/posts/{messageId}/video", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmissionResponse> submitChannelVideo(
            @PathVariable long channelId,
            @PathVariable long messageId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "durationSeconds", defaultValue = "0") int durationSeconds,
            @RequestParam(value = "height", defaultValue = "0") int height) {
        log.info("Video post {} in channel {}: '{}'", messageId, channelId, file.getOriginalFilename());
        SubmissionResult result = intakeService.submitChannelVideo(channelId, messageId, file, durationSeconds, height);
        return toResponse(result);
    }

    @DeleteMapping("/users/{userId}/videos/current")
    public ResponseEntity<CancelResponse> cancelCurrentVideo(@PathVariable long userId) {
        CancelResult result = coordinator.cancel(OwnerKey.user(userId));
        String message = result.isCancelled()
                ? PipelineMessages.cancelled(result.remainingInFlight())
                : PipelineMessages.nothingToCancel();
        return ResponseEntity.ok(new CancelResponse(result.outcome(), result.jobId(), result.remainingInFlight(), message));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<PipelineStatusResponse> status() {
        return ResponseEntity.ok(PipelineStatusResponse.from(coordinator.status(), clock.instant()));
    }

    private ResponseEntity<SubmissionResponse> toResponse(SubmissionResult result) {
        if (result.isRejected()) {
            throw new AdmissionException(result.reason(), "Video was not accepted: " + result.reason());
        }
        String message = result.isAccepted()
                ? PipelineMessages.processing(result.estimatedMinutes())
                : PipelineMessages.queuePosition(result.queuePosition());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmissionResponse.from(result, message));
    }
}
