package com.example.vidres.service.impl;

import com.example.vidres.domain.Owner;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.QueueEntry;
import com.example.vidres.domain.VideoAsset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryVideoQueueStore Tests")
class InMemoryVideoQueueStoreTest {

    private final Owner.User alice = new Owner.User(1);
    private final OwnerKey aliceKey = alice.key();
    private InMemoryVideoQueueStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVideoQueueStore();
    }

    private QueueEntry entry(String name) {
        return new QueueEntry(alice, new VideoAsset(Path.of(name), name, 10, 60, 720), Instant.EPOCH);
    }

    @Test
    @DisplayName("✅ Entries come out in the order they went in")
    void dequeue_ReturnsFifoOrder() {
        store.enqueue(aliceKey, entry("a.mp4"));
        store.enqueue(aliceKey, entry("b.mp4"));
        store.enqueue(aliceKey, entry("c.mp4"));

        assertThat(store.dequeueNext(aliceKey).map(e -> e.asset().fileName())).contains("a.mp4");
        assertThat(store.dequeueNext(aliceKey).map(e -> e.asset().fileName())).contains("b.mp4");
        assertThat(store.dequeueNext(aliceKey).map(e -> e.asset().fileName())).contains("c.mp4");
        assertThat(store.dequeueNext(aliceKey)).isEmpty();
    }

    @Test
    @DisplayName("✅ An entry returned to the front is dequeued next")
    void returnToFront_KeepsTurn() {
        store.enqueue(aliceKey, entry("a.mp4"));
        store.enqueue(aliceKey, entry("b.mp4"));
        QueueEntry first = store.dequeueNext(aliceKey).orElseThrow();

        store.returnToFront(aliceKey, first);

        assertThat(store.pendingCount(aliceKey)).isEqualTo(2);
        assertThat(store.dequeueNext(aliceKey)).contains(first);
    }

    @Test
    @DisplayName("✅ Counts reflect pending entries across owners")
    void counts_AreConsistent() {
        OwnerKey channel = OwnerKey.channel(1);
        store.enqueue(aliceKey, entry("a.mp4"));
        store.enqueue(channel, entry("b.mp4"));

        assertThat(store.hasPending(aliceKey)).isTrue();
        assertThat(store.hasPending(OwnerKey.user(99))).isFalse();
        assertThat(store.totalPending()).isEqualTo(2);

        store.dequeueNext(aliceKey);

        assertThat(store.hasPending(aliceKey)).isFalse();
        assertThat(store.pendingCount(aliceKey)).isZero();
        assertThat(store.totalPending()).isEqualTo(1);
    }

    @Test
    @DisplayName("✅ Clear empties every queue and returns what was pending")
    void clear_ReturnsDroppedEntries() {
        store.enqueue(aliceKey, entry("a.mp4"));
        store.enqueue(OwnerKey.user(2), entry("b.mp4"));

        assertThat(store.clear()).hasSize(2);
        assertThat(store.totalPending()).isZero();
        assertThat(store.dequeueNext(aliceKey)).isEmpty();
    }
}
