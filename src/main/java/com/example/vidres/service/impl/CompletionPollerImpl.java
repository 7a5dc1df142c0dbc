package com.example.vidres.service.impl;

import com.example.vidres.config.AsyncConfig;
import com.example.vidres.config.PipelineProperties;
import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.TrackedJob;
import com.example.vidres.exceptions.ProbeException;
import com.example.vidres.service.CompletionPoller;
import com.example.vidres.service.JobRegistry;
import com.example.vidres.service.LifecycleCoordinator;
import com.example.vidres.service.ProcessingGateway;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Sweeps the tracked jobs on the pipeline loop. For each job the timeout check comes first, so
 * an expired job is never probed; a probe failure leaves the job for the next sweep.
 */
@Service
public class CompletionPollerImpl implements CompletionPoller {

    private static final Logger log = LoggerFactory.getLogger(CompletionPollerImpl.class);

    private final JobRegistry registry;
    private final ProcessingGateway processingGateway;
    private final LifecycleCoordinator coordinator;
    private final TaskScheduler pipelineLoop;
    private final PipelineProperties properties;
    private final Clock clock;

    private ScheduledFuture<?> scheduledSweep;

    public CompletionPollerImpl(JobRegistry registry,
                                ProcessingGateway processingGateway,
                                LifecycleCoordinator coordinator,
                                @Qualifier(AsyncConfig.PIPELINE_LOOP) TaskScheduler pipelineLoop,
                                PipelineProperties properties,
                                Clock clock) {
        this.registry = registry;
        this.processingGateway = processingGateway;
        this.coordinator = coordinator;
        this.pipelineLoop = pipelineLoop;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (scheduledSweep != null) {
            log.debug("Completion poller already running");
            return;
        }
        Duration interval = properties.pollInterval();
        scheduledSweep = pipelineLoop.scheduleWithFixedDelay(this::sweepSafely, clock.instant().plus(interval), interval);
        log.info("Completion poller started (interval {}, timeout {})", interval, properties.timeout());
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        if (scheduledSweep == null) {
            return;
        }
        scheduledSweep.cancel(false);
        scheduledSweep = null;
        log.info("Completion poller stopped");
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Completion sweep failed; retrying on the next tick", e);
        }
    }

    @Override
    public void sweep() {
        List<TrackedJob> jobs = registry.snapshot();
        if (jobs.isEmpty()) {
            log.trace("No tracked jobs to poll");
            return;
        }
        log.debug("Polling {} tracked job(s)", jobs.size());
        Instant now = clock.instant();
        for (TrackedJob job : jobs) {
            try {
                check(job, now);
            } catch (RuntimeException e) {
                log.error("Unexpected error while checking job {}", job.jobId(), e);
            }
        }
    }

    private void check(TrackedJob job, Instant now) {
        if (!registry.contains(job.jobId())) {
            log.debug("Job {} ended during this sweep. Skipping.", job.jobId());
            return;
        }

        Duration elapsed = Duration.between(job.submittedAt(), now);
        if (elapsed.compareTo(properties.timeout()) > 0) {
            coordinator.handleTimeout(job.jobId(), elapsed);
            return;
        }

        Optional<ProcessedVideo> result;
        try {
            result = processingGateway.probeCompletion(job.parkedHandle());
        } catch (ProbeException e) {
            log.warn("Probe of job {} failed, will retry: {}", job.jobId(), e.getMessage());
            return;
        }
        if (result.isEmpty()) {
            log.trace("Job {} is still processing", job.jobId());
            return;
        }

        // The job may have been cancelled while the probe was running.
        if (!registry.contains(job.jobId())) {
            log.info("Job {} ended while its result was being fetched. Discarding result.", job.jobId());
            return;
        }
        log.info("Job {} finished processing", job.jobId());
        coordinator.handleCompletion(job.jobId(), result.get());
    }
}
