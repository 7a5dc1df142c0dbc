package com.example.vidres.domain;

import java.time.Instant;

public record QueueEntry(Owner owner, VideoAsset asset, Instant enqueuedAt) {
}
