package com.example.vidres.service.impl;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.QueueEntry;
import com.example.vidres.service.VideoQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
public class InMemoryVideoQueueStore implements VideoQueueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVideoQueueStore.class);

    // Owners without pending entries have no deque.
    private final Map<OwnerKey, Deque<QueueEntry>> queues = new HashMap<>();
    private int total;

    @Override
    public synchronized void enqueue(OwnerKey owner, QueueEntry entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        Deque<QueueEntry> queue = queues.computeIfAbsent(owner, k -> new ArrayDeque<>());
        queue.addLast(entry);
        total++;
        log.info("Queued video for {} at position {}", owner, queue.size());
    }

    @Override
    public synchronized Optional<QueueEntry> dequeueNext(OwnerKey owner) {
        Deque<QueueEntry> queue = queues.get(owner);
        if (queue == null) {
            return Optional.empty();
        }
        QueueEntry next = queue.pollFirst();
        if (queue.isEmpty()) {
            queues.remove(owner);
        }
        if (next != null) {
            total--;
        }
        return Optional.ofNullable(next);
    }

    @Override
    public synchronized void returnToFront(OwnerKey owner, QueueEntry entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        queues.computeIfAbsent(owner, k -> new ArrayDeque<>()).addFirst(entry);
        total++;
        log.debug("Returned video to the front of the queue for {}", owner);
    }

    @Override
    public synchronized boolean hasPending(OwnerKey owner) {
        return queues.containsKey(owner);
    }

    @Override
    public synchronized int pendingCount(OwnerKey owner) {
        Deque<QueueEntry> queue = queues.get(owner);
        return queue == null ? 0 : queue.size();
    }

    @Override
    public synchronized int totalPending() {
        return total;
    }

    @Override
    public synchronized List<QueueEntry> clear() {
        List<QueueEntry> dropped = new ArrayList<>(total);
        queues.values().forEach(dropped::addAll);
        queues.clear();
        total = 0;
        return dropped;
    }
}
