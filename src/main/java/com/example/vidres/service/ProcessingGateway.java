package com.example.vidres.service;

import com.example.vidres.domain.ParkedHandle;
import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.StagedAsset;
import com.example.vidres.domain.VideoAsset;
import com.example.vidres.exceptions.ProbeException;
import com.example.vidres.exceptions.RelocationException;
import com.example.vidres.exceptions.SchedulingException;

import java.util.Optional;

/**
 * Boundary to the external transcoder.
 */
public interface ProcessingGateway {

    /**
     * Moves the upload into pipeline-owned storage.
     */
    StagedAsset relocate(VideoAsset asset) throws RelocationException;

    /**
     * Hands a staged video to the transcoder and returns a durable handle to it.
     */
    ParkedHandle parkForProcessing(StagedAsset staged) throws SchedulingException;

    /**
     * @return the result once the transcoder has finished, otherwise empty
     */
    Optional<ProcessedVideo> probeCompletion(ParkedHandle handle) throws ProbeException;

    /**
     * Best effort. Failures are logged, never thrown.
     */
    void cancelParked(ParkedHandle handle);

    /**
     * Best effort removal of a staged video that could not be parked.
     */
    void discardStaged(StagedAsset staged);

    /**
     * Best effort removal of an upload that will never be processed.
     */
    void releaseSource(VideoAsset asset);
}
