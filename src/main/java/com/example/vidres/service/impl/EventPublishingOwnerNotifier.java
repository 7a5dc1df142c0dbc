package com.example.vidres.service.impl;

import com.example.vidres.config.PipelineProperties;
import com.example.vidres.domain.JobState;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.events.JobStatusChangedEvent;
import com.example.vidres.service.OwnerNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * User notices and operator reports become {@link JobStatusChangedEvent}s. Channels have no one to
 * talk to, so their notices are only logged.
 */
@Component
public class EventPublishingOwnerNotifier implements OwnerNotifier {

    private static final Logger log = LoggerFactory.getLogger(EventPublishingOwnerNotifier.class);
    private static final Logger operatorLog = LoggerFactory.getLogger("vidres.operator");

    private final ApplicationEventPublisher eventPublisher;
    private final Long adminId;

    public EventPublishingOwnerNotifier(ApplicationEventPublisher eventPublisher, PipelineProperties properties) {
        this.eventPublisher = eventPublisher;
        this.adminId = properties.adminId();
    }

    @Override
    public void notify(OwnerKey owner, String jobId, JobState state, String text) {
        if (!owner.isUser()) {
            log.info("[{}] {} {}: {}", owner, jobId, state, text);
            return;
        }
        publish(owner, jobId, state, text);
    }

    @Override
    public void reportToOperator(String jobId, JobState state, String text) {
        operatorLog.info("{}", text);
        if (adminId != null) {
            publish(OwnerKey.user(adminId), jobId, state, text);
        }
    }

    private void publish(OwnerKey audience, String jobId, JobState state, String text) {
        try {
            eventPublisher.publishEvent(new JobStatusChangedEvent(this, audience, jobId, state, text));
        } catch (RuntimeException e) {
            log.error("Failed to publish {} notice for job {} to {}", state, jobId, audience, e);
        }
    }
}
