package com.example.vidres.domain;

/**
 * The two kinds of principal that can own a video job. Users and channels live in
 * separate id spaces: user 42 and channel 42 are unrelated.
 */
public enum OwnerKind {
    USER,
    CHANNEL
}
