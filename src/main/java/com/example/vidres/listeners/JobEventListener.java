package com.example.vidres.listeners;

import com.example.vidres.events.JobStatusChangedEvent;
import com.example.vidres.service.SseService;
import com.example.vidres.web.dto.JobStatusUpdateDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
public class JobEventListener {

    private static final Logger log = LoggerFactory.getLogger(JobEventListener.class);
    static final String SSE_EVENT_NAME = "jobStatusUpdate";

    private final SseService sseService;

    public JobEventListener(SseService sseService) {
        this.sseService = sseService;
    }

    /**
     * Pushes the notice to the audience's SSE subscribers. Runs asynchronously so a slow client
     * never holds up the pipeline loop.
     */
    @Async
    @EventListener
    public void handleJobStatusChange(JobStatusChangedEvent event) {
        JobStatusUpdateDto sseData = new JobStatusUpdateDto(event.getJobId(), event.getState(), event.getMessage());
        try {
            sseService.sendEventToSubscriber(event.getAudience().toString(), sseData, SSE_EVENT_NAME);
            log.debug("Triggered SSE send for event: [JobId: {}, Audience: {}, State: {}]",
                    event.getJobId(), event.getAudience(), event.getState());
        } catch (Exception e) {
            log.error("Unexpected error in JobEventListener while handling event for {}: {}",
                    event.getAudience(), e.getMessage(), e);
        }
    }
}
