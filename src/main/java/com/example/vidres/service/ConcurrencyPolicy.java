package com.example.vidres.service;

import com.example.vidres.domain.OwnerKey;

public interface ConcurrencyPolicy {

    /**
     * @return the maximum number of simultaneous in-flight jobs for the owner, at least 1
     */
    int limitFor(OwnerKey owner);
}
