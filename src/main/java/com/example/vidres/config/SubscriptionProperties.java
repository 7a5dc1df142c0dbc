package com.example.vidres.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

@ConfigurationProperties(prefix = "vidres.subscriptions")
public record SubscriptionProperties(Set<Long> premiumUsers, Set<Long> activeChannels) {

    public SubscriptionProperties {
        premiumUsers = premiumUsers == null ? Set.of() : Set.copyOf(premiumUsers);
        activeChannels = activeChannels == null ? Set.of() : Set.copyOf(activeChannels);
    }
}
