package com.example.vidres.service.impl;

import com.example.vidres.config.AsyncConfig;
import com.example.vidres.config.PipelineProperties;
import com.example.vidres.domain.CancelResult;
import com.example.vidres.domain.JobState;
import com.example.vidres.domain.Owner;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.ParkedHandle;
import com.example.vidres.domain.PipelineSnapshot;
import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.QueueEntry;
import com.example.vidres.domain.RejectionReason;
import com.example.vidres.domain.StagedAsset;
import com.example.vidres.domain.SubmissionResult;
import com.example.vidres.domain.TrackedJob;
import com.example.vidres.domain.VideoAsset;
import com.example.vidres.exceptions.DeliveryException;
import com.example.vidres.service.ConcurrencyLedger;
import com.example.vidres.service.ConcurrencyPolicy;
import com.example.vidres.service.JobRegistry;
import com.example.vidres.service.LifecycleCoordinator;
import com.example.vidres.service.OwnerNotifier;
import com.example.vidres.service.PipelineMessages;
import com.example.vidres.service.ProcessingGateway;
import com.example.vidres.service.ProcessingTimeEstimator;
import com.example.vidres.service.ResultDeliveryService;
import com.example.vidres.service.VideoQueueStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owns every compound change to the ledger, the queue store, the registry and the active-owner
 * set. Those changes happen inside {@code stateLock} and never include I/O; collaborator calls
 * happen outside it.
 * <p>
 * Ending a job always starts with a claim: removing it from the registry and releasing its slot
 * in one step. Whoever wins the claim does the rest (cancel the parked artifact, update the
 * active set, schedule the owner's next queued video). Everyone else does nothing.
 */
@Service
public class LifecycleCoordinatorImpl implements LifecycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LifecycleCoordinatorImpl.class);

    private final ConcurrencyLedger ledger;
    private final VideoQueueStore queueStore;
    private final JobRegistry registry;
    private final ConcurrencyPolicy concurrencyPolicy;
    private final ProcessingGateway processingGateway;
    private final ResultDeliveryService resultDeliveryService;
    private final OwnerNotifier ownerNotifier;
    private final ProcessingTimeEstimator estimator;
    private final TaskExecutor pipelineLoop;
    private final PipelineProperties properties;
    private final Clock clock;

    private final Object stateLock = new Object();
    // guarded by stateLock
    private final Set<OwnerKey> activeOwners = new HashSet<>();
    private volatile boolean shuttingDown;

    public LifecycleCoordinatorImpl(ConcurrencyLedger ledger,
                                    VideoQueueStore queueStore,
                                    JobRegistry registry,
                                    ConcurrencyPolicy concurrencyPolicy,
                                    ProcessingGateway processingGateway,
                                    ResultDeliveryService resultDeliveryService,
                                    OwnerNotifier ownerNotifier,
                                    ProcessingTimeEstimator estimator,
                                    @Qualifier(AsyncConfig.PIPELINE_LOOP) TaskExecutor pipelineLoop,
                                    PipelineProperties properties,
                                    Clock clock) {
        this.ledger = ledger;
        this.queueStore = queueStore;
        this.registry = registry;
        this.concurrencyPolicy = concurrencyPolicy;
        this.processingGateway = processingGateway;
        this.resultDeliveryService = resultDeliveryService;
        this.ownerNotifier = ownerNotifier;
        this.estimator = estimator;
        this.pipelineLoop = pipelineLoop;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public SubmissionResult submit(Owner owner, VideoAsset asset) {
        int limit = resolveLimit(owner.key());
        Reservation reservation = reserve(owner, asset, null, limit);
        return start(owner, asset, reservation);
    }

    /**
     * Acts on a reservation: returns the decided outcome, or starts the job when a slot was reserved.
     */
    private SubmissionResult start(Owner owner, VideoAsset asset, Reservation reservation) {
        OwnerKey key = owner.key();
        if (reservation.result() != null) {
            SubmissionResult result = reservation.result();
            if (result.isRejected()) {
                log.info("Rejected video for {}: {}", key, result.reason());
                processingGateway.releaseSource(asset);
            } else if (reservation.drainNow()) {
                scheduleDrain(key);
            }
            return result;
        }

        StagedAsset staged;
        try {
            staged = processingGateway.relocate(asset);
        } catch (RuntimeException e) {
            log.error("Failed to relocate video '{}' for {}: {}", asset.fileName(), key, e.getMessage(), e);
            rollback(key);
            ownerNotifier.notify(key, null, JobState.FAILED, PipelineMessages.startFailed());
            processingGateway.releaseSource(asset);
            return SubmissionResult.rejected(RejectionReason.RELOCATION_FAILED);
        }

        ParkedHandle parked;
        try {
            parked = processingGateway.parkForProcessing(staged);
        } catch (RuntimeException e) {
            log.error("Failed to schedule processing of job {} for {}: {}", staged.stagingId(), key, e.getMessage(), e);
            processingGateway.discardStaged(staged);
            rollback(key);
            ownerNotifier.notify(key, staged.stagingId(), JobState.FAILED, PipelineMessages.startFailed());
            return SubmissionResult.rejected(RejectionReason.SCHEDULING_FAILED);
        }

        int estimate = estimator.estimateMinutes(asset.durationSeconds(), asset.height());
        TrackedJob job = new TrackedJob(staged.stagingId(), owner, parked, clock.instant(),
                asset.fileSize(), asset.durationSeconds(), estimate);
        try {
            registry.track(job);
        } catch (RuntimeException e) {
            log.error("Failed to track job {} for {}: {}", job.jobId(), key, e.getMessage(), e);
            processingGateway.cancelParked(parked);
            rollback(key);
            ownerNotifier.notify(key, job.jobId(), JobState.FAILED, PipelineMessages.startFailed());
            return SubmissionResult.rejected(RejectionReason.SCHEDULING_FAILED);
        }
        if (shuttingDown) {
            abandonAfterShutdown(job);
            return SubmissionResult.rejected(RejectionReason.SYSTEM_BUSY);
        }

        log.info("Job {} for {} is in flight (estimate {} min)", job.jobId(), key, estimate);
        return SubmissionResult.accepted(job.jobId(), estimate);
    }

    /**
     * Decides the fate of a submission in one critical section. A {@code null} result means a slot
     * was reserved and the caller must start the job.
     */
    private Reservation reserve(Owner owner, VideoAsset asset, QueueEntry drained, int limit) {
        OwnerKey key = owner.key();
        synchronized (stateLock) {
            if (shuttingDown) {
                return Reservation.done(SubmissionResult.rejected(RejectionReason.SYSTEM_BUSY));
            }
            boolean fresh = drained == null;
            if (fresh) {
                if (ledger.totalInFlight() + queueStore.totalPending() >= properties.queueSizeLimit()) {
                    return Reservation.done(SubmissionResult.rejected(RejectionReason.QUEUE_FULL));
                }
                if (ledger.totalInFlight() >= properties.maxInFlight()) {
                    return Reservation.done(SubmissionResult.rejected(RejectionReason.SYSTEM_BUSY));
                }
            }

            boolean atCapacity = ledger.count(key) >= limit;
            if (atCapacity || (fresh && queueStore.hasPending(key))) {
                activeOwners.add(key);
                if (fresh) {
                    queueStore.enqueue(key, new QueueEntry(owner, asset, clock.instant()));
                    return new Reservation(SubmissionResult.queued(queueStore.pendingCount(key)), !atCapacity);
                }
                queueStore.returnToFront(key, drained);
                return Reservation.done(SubmissionResult.queued(1));
            }

            ledger.increment(key);
            activeOwners.add(key);
            return new Reservation(null, false);
        }
    }

    private int resolveLimit(OwnerKey key) {
        try {
            return Math.max(1, concurrencyPolicy.limitFor(key));
        } catch (RuntimeException e) {
            log.error("Could not resolve the concurrency limit for {}. Using the regular limit.", key, e);
            return properties.limits().regular();
        }
    }

    /**
     * A job tracked after shutdown took its snapshot would never be cancelled, so it is ended here.
     */
    private void abandonAfterShutdown(TrackedJob job) {
        if (claim(job.jobId()).isEmpty()) {
            return;
        }
        log.warn("Job {} for {} was started during shutdown. Cancelling it.", job.jobId(), job.ownerKey());
        synchronized (stateLock) {
            if (ledger.count(job.ownerKey()) == 0 && !queueStore.hasPending(job.ownerKey())) {
                activeOwners.remove(job.ownerKey());
            }
        }
        try {
            processingGateway.cancelParked(job.parkedHandle());
        } catch (RuntimeException e) {
            log.warn("Failed to cancel parked artifact {} during shutdown: {}", job.parkedHandle(), e.getMessage());
        }
    }

    private void rollback(OwnerKey key) {
        synchronized (stateLock) {
            ledger.decrement(key);
            if (ledger.count(key) == 0 && !queueStore.hasPending(key)) {
                activeOwners.remove(key);
            }
        }
    }

    @Override
    public CancelResult cancel(OwnerKey owner) {
        Optional<String> jobId = registry.lookupByOwner(owner);
        if (jobId.isEmpty()) {
            log.info("Cancel requested by {} but nothing is in flight", owner);
            return CancelResult.nothingToCancel();
        }
        Optional<TrackedJob> claimed = claim(jobId.get());
        if (claimed.isEmpty()) {
            log.info("Job {} of {} ended before it could be cancelled", jobId.get(), owner);
            return CancelResult.nothingToCancel();
        }
        release(claimed.get(), JobState.CANCELLED);
        int remaining = ledger.count(owner);
        log.info("Cancelled job {} for {}. {} job(s) still in flight.", jobId.get(), owner, remaining);
        return CancelResult.cancelled(jobId.get(), remaining);
    }

    @Override
    public boolean cleanup(String jobId) {
        Optional<TrackedJob> claimed = claim(jobId);
        if (claimed.isEmpty()) {
            log.debug("Cleanup of job {} skipped: already ended", jobId);
            return false;
        }
        release(claimed.get(), JobState.CANCELLED);
        return true;
    }

    @Override
    public void handleCompletion(String jobId, ProcessedVideo result) {
        Optional<TrackedJob> claimed = claim(jobId);
        if (claimed.isEmpty()) {
            log.info("Job {} ended before its result could be delivered. Discarding result.", jobId);
            return;
        }
        TrackedJob job = claimed.get();
        try {
            deliver(job, result);
        } catch (RuntimeException e) {
            log.error("Unexpected error while delivering job {}", jobId, e);
        } finally {
            release(job, JobState.COMPLETED);
        }
    }

    private void deliver(TrackedJob job, ProcessedVideo result) {
        Duration actual = Duration.between(job.submittedAt(), clock.instant());
        int delivered = 0;
        boolean succeeded;
        try {
            if (job.owner() instanceof Owner.User user) {
                delivered = resultDeliveryService.deliverResult(user.userId(), job.jobId(), result);
            } else if (job.owner() instanceof Owner.ChannelPost post) {
                resultDeliveryService.replaceInPlace(post.channelId(), post.messageId(), result);
                delivered = 1;
            }
            succeeded = true;
        } catch (DeliveryException e) {
            log.error("Failed to deliver result of job {} to {}: {}", job.jobId(), job.ownerKey(), e.getMessage(), e);
            succeeded = false;
        }

        if (succeeded) {
            ownerNotifier.notify(job.ownerKey(), job.jobId(), JobState.COMPLETED, PipelineMessages.completed(delivered));
        } else {
            ownerNotifier.notify(job.ownerKey(), job.jobId(), JobState.FAILED, PipelineMessages.deliveryFailed());
        }
        ownerNotifier.reportToOperator(job.jobId(), JobState.COMPLETED,
                PipelineMessages.completionReport(job, delivered, succeeded, actual));
    }

    @Override
    public void handleTimeout(String jobId, Duration elapsed) {
        Optional<TrackedJob> claimed = claim(jobId);
        if (claimed.isEmpty()) {
            log.debug("Timeout of job {} ignored: already ended", jobId);
            return;
        }
        TrackedJob job = claimed.get();
        log.warn("Job {} for {} timed out after {}", jobId, job.ownerKey(), elapsed);
        try {
            ownerNotifier.notify(job.ownerKey(), jobId, JobState.TIMED_OUT, PipelineMessages.timedOut(properties.timeout()));
            ownerNotifier.reportToOperator(jobId, JobState.TIMED_OUT, PipelineMessages.timeoutReport(job, elapsed));
        } finally {
            release(job, JobState.TIMED_OUT);
        }
    }

    private Optional<TrackedJob> claim(String jobId) {
        synchronized (stateLock) {
            Optional<TrackedJob> removed = registry.remove(jobId);
            removed.ifPresent(job -> ledger.decrement(job.ownerKey()));
            return removed;
        }
    }

    /**
     * Post-claim steps. Each one runs even if an earlier one failed.
     */
    private void release(TrackedJob job, JobState finalState) {
        OwnerKey key = job.ownerKey();
        try {
            processingGateway.cancelParked(job.parkedHandle());
        } catch (RuntimeException e) {
            log.warn("Failed to cancel parked artifact {} of job {}: {}", job.parkedHandle(), job.jobId(), e.getMessage());
        }
        synchronized (stateLock) {
            if (ledger.count(key) == 0 && !queueStore.hasPending(key)) {
                activeOwners.remove(key);
            }
        }
        log.info("Job {} for {} ended as {}", job.jobId(), key, finalState);
        scheduleDrain(key);
    }

    private void scheduleDrain(OwnerKey key) {
        if (shuttingDown) {
            return;
        }
        try {
            pipelineLoop.execute(() -> drainNext(key));
        } catch (TaskRejectedException e) {
            log.warn("Could not schedule queue drain for {}: {}", key, e.getMessage());
        }
    }

    void drainNext(OwnerKey key) {
        if (shuttingDown) {
            return;
        }
        int limit = resolveLimit(key);
        QueueEntry entry;
        Reservation reservation;
        // dequeue and reserve together so no fresh submission fits in between
        synchronized (stateLock) {
            Optional<QueueEntry> next = queueStore.dequeueNext(key);
            if (next.isEmpty()) {
                log.debug("No queued videos for {}", key);
                return;
            }
            entry = next.get();
            reservation = reserve(entry.owner(), entry.asset(), entry, limit);
        }
        if (log.isInfoEnabled()) {
            log.info("Resubmitting queued video '{}' for {} after waiting {}", entry.asset().fileName(), key,
                    Duration.between(entry.enqueuedAt(), clock.instant()));
        }
        try {
            SubmissionResult result = start(entry.owner(), entry.asset(), reservation);
            if (result.isAccepted()) {
                ownerNotifier.notify(key, result.jobId(), JobState.IN_FLIGHT,
                        PipelineMessages.processing(result.estimatedMinutes()));
            } else if (result.isRejected()) {
                log.warn("Queued video '{}' for {} was rejected on resubmission: {}",
                        entry.asset().fileName(), key, result.reason());
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error while draining the queue of {}", key, e);
        }
    }

    @Override
    public boolean isActive(OwnerKey owner) {
        synchronized (stateLock) {
            return activeOwners.contains(owner);
        }
    }

    @Override
    public PipelineSnapshot status() {
        synchronized (stateLock) {
            return new PipelineSnapshot(registry.size(), queueStore.totalPending(), activeOwners.size());
        }
    }

    @Override
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        List<TrackedJob> remaining = registry.snapshot();
        log.info("Shutting down pipeline. Cancelling {} in-flight job(s).", remaining.size());
        for (TrackedJob job : remaining) {
            Optional<TrackedJob> claimed = claim(job.jobId());
            if (claimed.isEmpty()) {
                continue;
            }
            try {
                processingGateway.cancelParked(job.parkedHandle());
            } catch (RuntimeException e) {
                log.warn("Failed to cancel parked artifact {} during shutdown: {}", job.parkedHandle(), e.getMessage());
            }
        }
        List<QueueEntry> dropped;
        synchronized (stateLock) {
            dropped = queueStore.clear();
            activeOwners.clear();
        }
        for (QueueEntry entry : dropped) {
            processingGateway.releaseSource(entry.asset());
        }
        log.info("Pipeline shutdown complete. Dropped {} queued video(s).", dropped.size());
    }

    private record Reservation(SubmissionResult result, boolean drainNow) {
        static Reservation done(SubmissionResult result) {
            return new Reservation(result, false);
        }
    }
}
