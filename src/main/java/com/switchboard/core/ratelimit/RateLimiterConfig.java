package com.switchboard.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Admits every call unless the application defines its own {@link RateLimiter}.
 */
@Configuration
public class RateLimiterConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterConfig.class);

    @Bean
    @ConditionalOnMissingBean(RateLimiter.class)
    public RateLimiter permissiveRateLimiter() {
        log.info("No RateLimiter configured; admitting all classification requests");
        return (userId, action) -> { };
    }
}
