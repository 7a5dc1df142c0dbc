package com.example.vidres.service.impl;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.ParkedHandle;
import com.example.vidres.domain.TrackedJob;
import com.example.vidres.service.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the primary job map and its two indexes under one monitor so they never disagree.
 */
@Component
public class InMemoryJobRegistry implements JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobRegistry.class);

    private final Map<String, TrackedJob> jobs = new LinkedHashMap<>();
    private final Map<ParkedHandle, String> jobIdsByHandle = new HashMap<>();
    private final Map<OwnerKey, Set<String>> jobIdsByOwner = new HashMap<>();

    @Override
    public synchronized void track(TrackedJob job) {
        if (jobs.containsKey(job.jobId())) {
            throw new IllegalStateException("Job is already tracked: " + job.jobId());
        }
        if (jobIdsByHandle.containsKey(job.parkedHandle())) {
            throw new IllegalStateException("Parked handle is already tracked: " + job.parkedHandle());
        }
        jobs.put(job.jobId(), job);
        jobIdsByHandle.put(job.parkedHandle(), job.jobId());
        jobIdsByOwner.computeIfAbsent(job.ownerKey(), k -> new LinkedHashSet<>()).add(job.jobId());
        log.info("Tracking job {} for {} (parked as {})", job.jobId(), job.ownerKey(), job.parkedHandle());
    }

    @Override
    public synchronized Optional<TrackedJob> remove(String jobId) {
        TrackedJob removed = jobs.remove(jobId);
        if (removed == null) {
            return Optional.empty();
        }
        jobIdsByHandle.remove(removed.parkedHandle());
        Set<String> ownerJobs = jobIdsByOwner.get(removed.ownerKey());
        if (ownerJobs != null) {
            ownerJobs.remove(jobId);
            if (ownerJobs.isEmpty()) {
                jobIdsByOwner.remove(removed.ownerKey());
            }
        }
        log.debug("Stopped tracking job {}", jobId);
        return Optional.of(removed);
    }

    @Override
    public synchronized Optional<TrackedJob> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized boolean contains(String jobId) {
        return jobs.containsKey(jobId);
    }

    @Override
    public synchronized Optional<String> lookupByOwner(OwnerKey owner) {
        Set<String> ownerJobs = jobIdsByOwner.get(owner);
        if (ownerJobs == null || ownerJobs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ownerJobs.iterator().next());
    }

    @Override
    public synchronized Optional<String> lookupByParkedHandle(ParkedHandle handle) {
        return Optional.ofNullable(jobIdsByHandle.get(handle));
    }

    @Override
    public synchronized int countByOwner(OwnerKey owner) {
        Set<String> ownerJobs = jobIdsByOwner.get(owner);
        return ownerJobs == null ? 0 : ownerJobs.size();
    }

    @Override
    public synchronized List<TrackedJob> snapshot() {
        return List.copyOf(jobs.values());
    }

    @Override
    public synchronized int size() {
        return jobs.size();
    }
}
