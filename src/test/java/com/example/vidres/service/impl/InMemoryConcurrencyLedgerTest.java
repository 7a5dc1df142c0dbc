package com.example.vidres.service.impl;

import com.example.vidres.domain.OwnerKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryConcurrencyLedger Tests")
class InMemoryConcurrencyLedgerTest {

    private InMemoryConcurrencyLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryConcurrencyLedger();
    }

    @Test
    @DisplayName("✅ Unknown owner has a count of zero")
    void count_UnknownOwner_ReturnsZero() {
        assertThat(ledger.count(OwnerKey.user(7))).isZero();
        assertThat(ledger.totalInFlight()).isZero();
    }

    @Test
    @DisplayName("✅ Increment and decrement are tracked per owner")
    void incrementDecrement_TracksPerOwner() {
        OwnerKey alice = OwnerKey.user(1);
        OwnerKey bob = OwnerKey.user(2);

        ledger.increment(alice);
        ledger.increment(alice);
        ledger.increment(bob);
        ledger.decrement(alice);

        assertThat(ledger.count(alice)).isEqualTo(1);
        assertThat(ledger.count(bob)).isEqualTo(1);
        assertThat(ledger.totalInFlight()).isEqualTo(2);
    }

    @Test
    @DisplayName("✅ User and channel with the same id are counted separately")
    void userAndChannel_SameId_AreIndependent() {
        ledger.increment(OwnerKey.user(42));
        ledger.increment(OwnerKey.channel(42));
        ledger.increment(OwnerKey.channel(42));

        assertThat(ledger.count(OwnerKey.user(42))).isEqualTo(1);
        assertThat(ledger.count(OwnerKey.channel(42))).isEqualTo(2);
    }

    @Test
    @DisplayName("⚠️ Decrement at zero stays at zero")
    void decrement_AtZero_IsClamped() {
        OwnerKey owner = OwnerKey.user(3);
        ledger.increment(owner);
        ledger.decrement(owner);

        ledger.decrement(owner);

        assertThat(ledger.count(owner)).isZero();
        assertThat(ledger.totalInFlight()).isZero();
    }
}
