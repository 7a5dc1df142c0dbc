package com.example.vidres.service.impl;

import com.example.vidres.config.IntakeProperties;
import com.example.vidres.config.PipelineProperties;
import com.example.vidres.domain.JobState;
import com.example.vidres.domain.Owner;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.RejectionReason;
import com.example.vidres.domain.SubmissionResult;
import com.example.vidres.domain.VideoAsset;
import com.example.vidres.service.IncomingVideoStorage;
import com.example.vidres.service.LifecycleCoordinator;
import com.example.vidres.service.OwnerNotifier;
import com.example.vidres.service.PipelineMessages;
import com.example.vidres.service.SubscriptionDirectory;
import com.example.vidres.service.VideoFormatInspector;
import com.example.vidres.service.VideoIntakeService;
import com.example.vidres.service.VideoUploadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class VideoIntakeServiceImpl implements VideoIntakeService {

    private static final Logger log = LoggerFactory.getLogger(VideoIntakeServiceImpl.class);

    private final VideoUploadValidator uploadValidator;
    private final IncomingVideoStorage incomingStorage;
    private final VideoFormatInspector formatInspector;
    private final SubscriptionDirectory subscriptionDirectory;
    private final LifecycleCoordinator coordinator;
    private final OwnerNotifier ownerNotifier;
    private final IntakeProperties intakeProperties;
    private final PipelineProperties pipelineProperties;

    public VideoIntakeServiceImpl(VideoUploadValidator uploadValidator,
                                  IncomingVideoStorage incomingStorage,
                                  VideoFormatInspector formatInspector,
                                  SubscriptionDirectory subscriptionDirectory,
                                  LifecycleCoordinator coordinator,
                                  OwnerNotifier ownerNotifier,
                                  IntakeProperties intakeProperties,
                                  PipelineProperties pipelineProperties) {
        this.uploadValidator = uploadValidator;
        this.incomingStorage = incomingStorage;
        this.formatInspector = formatInspector;
        this.subscriptionDirectory = subscriptionDirectory;
        this.coordinator = coordinator;
        this.ownerNotifier = ownerNotifier;
        this.intakeProperties = intakeProperties;
        this.pipelineProperties = pipelineProperties;
    }

    @Override
    public SubmissionResult submitUserVideo(long userId, MultipartFile file, int durationSeconds, int height) {
        return intake(new Owner.User(userId), file, durationSeconds, height);
    }

    @Override
    public SubmissionResult submitChannelVideo(long channelId, long messageId, MultipartFile file,
                                               int durationSeconds, int height) {
        if (!subscriptionDirectory.isChannelActive(channelId)) {
            log.info("Ignoring video in channel {}: channel is not active", channelId);
            return SubmissionResult.rejected(RejectionReason.CHANNEL_NOT_ACTIVE);
        }
        return intake(new Owner.ChannelPost(channelId, messageId), file, durationSeconds, height);
    }

    private SubmissionResult intake(Owner owner, MultipartFile file, int durationSeconds, int height) {
        OwnerKey key = owner.key();
        uploadValidator.validate(file);

        long maxBytes = intakeProperties.maxVideoSize().toBytes();
        if (file.getSize() > maxBytes) {
            log.info("Rejected upload from {}: {} bytes exceeds the {} byte limit", key, file.getSize(), maxBytes);
            ownerNotifier.notify(key, null, JobState.REJECTED, PipelineMessages.videoTooLarge(maxBytes));
            return SubmissionResult.rejected(RejectionReason.TOO_LARGE);
        }

        String container = StringUtils.getFilenameExtension(file.getOriginalFilename()).toLowerCase(Locale.ROOT);
        Path stored = incomingStorage.store(file, key, UUID.randomUUID() + "." + container);

        Optional<String> codec = formatInspector.detectVideoCodec(stored);
        if (codec.isPresent() && !intakeProperties.isAllowed(codec.get(), container)) {
            log.info("Rejected upload from {}: unsupported format {}/{}", key, codec.get(), container);
            incomingStorage.delete(stored);
            ownerNotifier.notify(key, null, JobState.REJECTED, PipelineMessages.unsupportedFormat());
            return SubmissionResult.rejected(RejectionReason.UNSUPPORTED_FORMAT);
        }

        VideoAsset asset = new VideoAsset(stored, StringUtils.cleanPath(file.getOriginalFilename()),
                file.getSize(), Math.max(durationSeconds, 0), Math.max(height, 0));
        SubmissionResult result = coordinator.submit(owner, asset);
        announce(key, result);
        return result;
    }

    private void announce(OwnerKey key, SubmissionResult result) {
        switch (result.outcome()) {
            case ACCEPTED -> ownerNotifier.notify(key, result.jobId(), JobState.IN_FLIGHT,
                    PipelineMessages.processing(result.estimatedMinutes()));
            case QUEUED -> {
                boolean premium = key.isUser() && subscriptionDirectory.isPremium(key.id());
                ownerNotifier.notify(key, null, JobState.QUEUED, PipelineMessages.queued(
                        result.queuePosition(), premium, pipelineProperties.limits().premium()));
            }
            case REJECTED -> {
                if (result.reason() == RejectionReason.SYSTEM_BUSY || result.reason() == RejectionReason.QUEUE_FULL) {
                    ownerNotifier.notify(key, null, JobState.REJECTED, PipelineMessages.systemBusy());
                }
            }
        }
    }
}
