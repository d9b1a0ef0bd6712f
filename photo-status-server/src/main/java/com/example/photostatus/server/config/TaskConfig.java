package com.example.photostatus.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

@Configuration
public class TaskConfig {

    /**
     * Timer threads for SSE heartbeats. Daemon threads so an idle server can always shut down.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler heartbeatScheduler() {
        return Schedulers.newParallel("sse-heartbeat", 2, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Supplier<String> eventIdGenerator() {
        return () -> UUID.randomUUID().toString();
    }
}
