package com.thedigest.continuity.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${aws.bedrock.rateLimit:2.0}") // permits per second for paid generation calls
    private double generationRateLimit;

    @Bean("generationRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter generationRateLimiter() {
        return RateLimiter.create(Math.max(0.1, generationRateLimit));
    }
}
