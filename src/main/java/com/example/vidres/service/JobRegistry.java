package com.example.vidres.service;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.ParkedHandle;
import com.example.vidres.domain.TrackedJob;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative set of in-flight jobs with lookups by job id, parked handle and owner.
 * Every lookup reflects the same set of jobs at all times.
 */
public interface JobRegistry {

    /**
     * @throws IllegalStateException if the job id or parked handle is already tracked
     */
    void track(TrackedJob job);

    /**
     * Removes the job from every lookup. Returns empty when the job is not tracked, which makes
     * removal the single point deciding who ends a job.
     */
    Optional<TrackedJob> remove(String jobId);

    Optional<TrackedJob> get(String jobId);

    boolean contains(String jobId);

    /**
     * @return the owner's oldest in-flight job
     */
    Optional<String> lookupByOwner(OwnerKey owner);

    Optional<String> lookupByParkedHandle(ParkedHandle handle);

    int countByOwner(OwnerKey owner);

    /**
     * @return a copy that is safe to iterate while jobs are added and removed
     */
    List<TrackedJob> snapshot();

    int size();
}
