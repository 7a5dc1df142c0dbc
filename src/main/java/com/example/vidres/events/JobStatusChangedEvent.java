package com.example.vidres.events;

import com.example.vidres.domain.JobState;
import com.example.vidres.domain.OwnerKey;
import org.springframework.context.ApplicationEvent;

/**
 * Event published whenever an owner or the operator should hear about a job.
 */
public class JobStatusChangedEvent extends ApplicationEvent {

    private final OwnerKey audience;
    private final String jobId;
    private final JobState state;
    private final String message;

    /**
     * @param source   The component that published the event (usually 'this').
     * @param audience Who should receive the notice.
     * @param jobId    The job concerned, or {@code null} when no job was created.
     * @param state    The state being reported.
     * @param message  Human readable text.
     */
    public JobStatusChangedEvent(Object source, OwnerKey audience, String jobId, JobState state, String message) {
        super(source);
        if (audience == null || state == null) {
            throw new IllegalArgumentException("Event details (audience, state) cannot be null");
        }
        this.audience = audience;
        this.jobId = jobId;
        this.state = state;
        this.message = message;
    }

    public OwnerKey getAudience() {
        return audience;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getState() {
        return state;
    }

    public String getMessage() {
        return message;
    }
}
