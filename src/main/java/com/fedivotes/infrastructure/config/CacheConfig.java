package com.fedivotes.infrastructure.config;

import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }
}
