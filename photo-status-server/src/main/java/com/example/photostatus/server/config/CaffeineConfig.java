package com.example.photostatus.server.config;

import com.example.photostatus.server.service.PhotoEventHistory.HistoryEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Deque;

@Configuration
public class CaffeineConfig {

    /**
     * Per-user event history. The TTL restarts on every append, so a user's history
     * disappears once nothing has been published to them for the configured window.
     */
    @Bean
    public Cache<String, Deque<HistoryEntry>> photoEventHistoryCache(AppProperties appProperties) {
        AppProperties.History history = appProperties.getHistory();
        return Caffeine.newBuilder()
                .maximumSize(history.getMaxUsers())
                .expireAfterWrite(history.getTtl())
                .recordStats()
                .build();
    }
}
