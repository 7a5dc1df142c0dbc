package com.example.vidres.service.impl;

import com.example.vidres.config.PipelineProperties;
import com.example.vidres.domain.OwnerKey;
import com.example.vidres.service.SubscriptionDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
@DisplayName("PlanConcurrencyPolicy Tests")
class PlanConcurrencyPolicyTest {

    @Mock
    private SubscriptionDirectory subscriptionDirectory;

    private PlanConcurrencyPolicy policy;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties(Duration.ofSeconds(30), Duration.ofHours(1), 100, 1000,
                new PipelineProperties.Limits(1, 5, 4), 0.033, null);
        policy = new PlanConcurrencyPolicy(subscriptionDirectory, properties);
    }

    @Test
    @DisplayName("✅ Regular user gets the regular limit")
    void limitFor_RegularUser() {
        given(subscriptionDirectory.isPremium(1)).willReturn(false);

        assertThat(policy.limitFor(OwnerKey.user(1))).isEqualTo(1);
    }

    @Test
    @DisplayName("✅ Premium user gets the premium limit")
    void limitFor_PremiumUser() {
        given(subscriptionDirectory.isPremium(2)).willReturn(true);

        assertThat(policy.limitFor(OwnerKey.user(2))).isEqualTo(5);
    }

    @Test
    @DisplayName("✅ Channel gets the channel limit without a subscription lookup")
    void limitFor_Channel() {
        assertThat(policy.limitFor(OwnerKey.channel(2))).isEqualTo(4);
        then(subscriptionDirectory).shouldHaveNoInteractions();
    }
}
