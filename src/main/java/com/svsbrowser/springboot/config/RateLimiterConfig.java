package com.svsbrowser.springboot.config;

import com.google.common.util.concurrent.RateLimiter;
import com.svsbrowser.springboot.service.BackoffSleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.source.rate-limit:2.0}") // requests per second against the source site
    private double sourceRateLimit;
    @Value("${app.ratelimit.embedQps:0}")
    private double embedRateLimit;

    /**
     * Shared by every caller of the source client. A zero warmup period keeps no stored permits,
     * so consecutive requests are always spaced by at least {@code 1 / rate} seconds.
     */
    @Bean("sourceRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter sourceRateLimiter() {
        return RateLimiter.create(Math.max(0.1, sourceRateLimit), Duration.ZERO);
    }

    @Bean("embedRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter embedRateLimiter() {
        double effectiveQps = embedRateLimit > 0 ? embedRateLimit : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.THREAD_SLEEP;
    }
}
