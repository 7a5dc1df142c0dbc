package com.example.vidres.service;

import com.example.vidres.domain.SubmissionResult;
import org.springframework.web.multipart.MultipartFile;

/**
 * Runs the pre-submission checks on an upload, stores it and submits it to the pipeline.
 * The owner is told about the outcome.
 */
public interface VideoIntakeService {

    SubmissionResult submitUserVideo(long userId, MultipartFile file, int durationSeconds, int height);

    SubmissionResult submitChannelVideo(long channelId, long messageId, MultipartFile file,
                                        int durationSeconds, int height);
}
