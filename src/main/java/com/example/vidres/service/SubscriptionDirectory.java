package com.example.vidres.service;

public interface SubscriptionDirectory {

    boolean isPremium(long userId);

    /**
     * A channel is active once a premium subscriber has connected it.
     */
    boolean isChannelActive(long channelId);
}
