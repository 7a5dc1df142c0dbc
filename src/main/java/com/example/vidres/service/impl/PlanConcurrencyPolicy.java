package com.example.vidres.service.impl;

import com.example.vidres.config.PipelineProperties;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.service.ConcurrencyPolicy;
import com.example.vidres.service.SubscriptionDirectory;
import org.springframework.stereotype.Component;

@Component
public class PlanConcurrencyPolicy implements ConcurrencyPolicy {

    private final SubscriptionDirectory subscriptionDirectory;
    private final PipelineProperties.Limits limits;

    public PlanConcurrencyPolicy(SubscriptionDirectory subscriptionDirectory, PipelineProperties properties) {
        this.subscriptionDirectory = subscriptionDirectory;
        this.limits = properties.limits();
    }

    @Override
    public int limitFor(OwnerKey owner) {
        if (!owner.isUser()) {
            return limits.channel();
        }
        return subscriptionDirectory.isPremium(owner.id()) ? limits.premium() : limits.regular();
    }
}
