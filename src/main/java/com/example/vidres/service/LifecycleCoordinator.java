package com.example.vidres.service;

import com.example.vidres.domain.CancelResult;
import com.example.vidres.domain.Owner;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.PipelineSnapshot;
import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.SubmissionResult;
import com.example.vidres.domain.VideoAsset;

import java.time.Duration;

/**
 * Entry point of the pipeline: admission, queueing, cancellation and the single cleanup path
 * every finished job goes through.
 */
public interface LifecycleCoordinator {

    /**
     * Admits, queues or rejects a submission. Collaborator failures come back as REJECTED,
     * never as exceptions.
     */
    SubmissionResult submit(Owner owner, VideoAsset asset);

    /**
     * Cancels the owner's oldest in-flight job.
     */
    CancelResult cancel(OwnerKey owner);

    /**
     * Ends a job: removes it from tracking, releases its slot, cancels the parked artifact and
     * schedules the owner's next queued video. Idempotent.
     *
     * @return {@code true} only for the call that actually ended the job
     */
    boolean cleanup(String jobId);

    void handleCompletion(String jobId, ProcessedVideo result);

    void handleTimeout(String jobId, Duration elapsed);

    boolean isActive(OwnerKey owner);

    PipelineSnapshot status();

    /**
     * Cancels every parked artifact and clears all tracking.
     */
    void shutdown();
}
