package com.example.vidres.service.impl;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.OwnerKind;
import com.example.vidres.service.ConcurrencyLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

@Component
public class InMemoryConcurrencyLedger implements ConcurrencyLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConcurrencyLedger.class);

    // One map per kind so user and channel ids never collide. Zero counts are not stored.
    private final Map<OwnerKind, Map<Long, Integer>> counters = new EnumMap<>(OwnerKind.class);
    private int total;

    public InMemoryConcurrencyLedger() {
        for (OwnerKind kind : OwnerKind.values()) {
            counters.put(kind, new HashMap<>());
        }
    }

    @Override
    public synchronized void increment(OwnerKey owner) {
        int updated = countersFor(owner).merge(owner.id(), 1, Integer::sum);
        total++;
        log.debug("In-flight count for {} increased to {}", owner, updated);
    }

    @Override
    public synchronized void decrement(OwnerKey owner) {
        Map<Long, Integer> byId = countersFor(owner);
        Integer current = byId.get(owner.id());
        if (current == null) {
            log.warn("Ledger underflow: decrement requested for {} with no in-flight jobs. Ignoring.", owner);
            return;
        }
        if (current == 1) {
            byId.remove(owner.id());
        } else {
            byId.put(owner.id(), current - 1);
        }
        total--;
        log.debug("In-flight count for {} decreased to {}", owner, current - 1);
    }

    @Override
    public synchronized int count(OwnerKey owner) {
        return countersFor(owner).getOrDefault(owner.id(), 0);
    }

    @Override
    public synchronized int totalInFlight() {
        return total;
    }

    private Map<Long, Integer> countersFor(OwnerKey owner) {
        return counters.get(owner.kind());
    }
}
