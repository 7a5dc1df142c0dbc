package com.example.vidres.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({PipelineProperties.class, IntakeProperties.class, SubscriptionProperties.class})
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
