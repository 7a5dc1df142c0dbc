package com.example.vidres.service;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.QueueEntry;

import java.util.List;
import java.util.Optional;

/**
 * Per-owner FIFO of submissions waiting for a free slot.
 */
public interface VideoQueueStore {

    void enqueue(OwnerKey owner, QueueEntry entry);

    Optional<QueueEntry> dequeueNext(OwnerKey owner);

    /**
     * Puts an entry back at the head of the owner's queue so it keeps its turn.
     */
    void returnToFront(OwnerKey owner, QueueEntry entry);

    boolean hasPending(OwnerKey owner);

    int pendingCount(OwnerKey owner);

    int totalPending();

    /**
     * Empties every queue.
     *
     * @return the entries that were pending
     */
    List<QueueEntry> clear();
}
