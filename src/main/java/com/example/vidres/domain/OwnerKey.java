package com.example.vidres.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity used for concurrency accounting and queueing. A channel post is keyed by its
 * channel only, so all posts of one channel share one counter and one queue.
 */
public record OwnerKey(OwnerKind kind, long id) {

    public OwnerKey {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static OwnerKey user(long userId) {
        return new OwnerKey(OwnerKind.USER, userId);
    }

    public static OwnerKey channel(long channelId) {
        return new OwnerKey(OwnerKind.CHANNEL, channelId);
    }

    public boolean isUser() {
        return kind == OwnerKind.USER;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + id;
    }
}
