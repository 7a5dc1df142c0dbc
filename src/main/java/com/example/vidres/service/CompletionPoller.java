package com.example.vidres.service;

/**
 * Periodically checks every tracked job for a timeout or a finished result.
 */
public interface CompletionPoller {

    /**
     * Runs one pass over a snapshot of the tracked jobs.
     */
    void sweep();

    void start();

    void stop();
}
