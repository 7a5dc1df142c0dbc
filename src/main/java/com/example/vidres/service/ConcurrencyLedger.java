package com.example.vidres.service;

import com.example.vidres.domain.OwnerKey;

/**
 * Counts in-flight jobs per owner. Users and channels are counted independently.
 */
public interface ConcurrencyLedger {

    void increment(OwnerKey owner);

    /**
     * Decrements the owner's count. A decrement at zero leaves the count at zero and is
     * logged as a consistency warning.
     */
    void decrement(OwnerKey owner);

    /**
     * @return the owner's count, or 0 for an owner never seen
     */
    int count(OwnerKey owner);

    int totalInFlight();
}
