package com.example.vidres.service.impl;

import com.example.vidres.config.SubscriptionProperties;
import com.example.vidres.service.SubscriptionDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Subscription data taken from configuration.
 */
@Component
public class ConfiguredSubscriptionDirectory implements SubscriptionDirectory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredSubscriptionDirectory.class);

    private final SubscriptionProperties properties;

    public ConfiguredSubscriptionDirectory(SubscriptionProperties properties) {
        this.properties = properties;
        log.info("Subscription directory loaded: {} premium users, {} active channels",
                properties.premiumUsers().size(), properties.activeChannels().size());
    }

    @Override
    public boolean isPremium(long userId) {
        return properties.premiumUsers().contains(userId);
    }

    @Override
    public boolean isChannelActive(long channelId) {
        return properties.activeChannels().contains(channelId);
    }
}
