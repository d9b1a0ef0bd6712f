package com.example.photostatus.client.config;

import com.example.photostatus.client.backoff.ReconnectBackoff;
import com.example.photostatus.client.coordinator.DeliveryCoordinator;
import com.example.photostatus.client.dedupe.EventDedupeCache;
import com.example.photostatus.client.polling.JobStatusClient;
import com.example.photostatus.client.polling.PollingTaskManager;
import com.example.photostatus.client.polling.WebClientJobStatusClient;
import com.example.photostatus.client.state.PhotoStateStore;
import com.example.photostatus.client.stream.PhotoEventStreamTransport;
import com.example.photostatus.client.stream.StreamConnector;
import com.example.photostatus.client.stream.StreamHealth;
import com.example.photostatus.client.stream.WebClientPhotoEventStreamTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires one photo status session per application context. Call
 * {@link DeliveryCoordinator#start(String)} to open the stream. An application that needs custom
 * authentication on the job-status query supplies its own {@code photoStatusWebClient}.
 */
@AutoConfiguration
@Slf4j
@EnableConfigurationProperties(PhotoStatusClientProperties.class)
public class PhotoStatusClientConfig {

    /**
     * The single thread every client component confines its state to. Daemon, so an idle
     * session never keeps the JVM alive.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler photoStatusClientScheduler() {
        return Schedulers.newSingle("photo-status-client", true);
    }

    @Bean
    @ConditionalOnMissingBean(name = "photoStatusWebClient")
    public WebClient photoStatusWebClient(PhotoStatusClientProperties properties) {
        log.info("Photo status client targeting {}", properties.getBaseUrl());
        return WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public PhotoEventStreamTransport photoEventStreamTransport(@Qualifier("photoStatusWebClient") WebClient webClient,
                                                               PhotoStatusClientProperties properties) {
        return new WebClientPhotoEventStreamTransport(webClient, properties.getEventsPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStatusClient jobStatusClient(@Qualifier("photoStatusWebClient") WebClient webClient,
                                           PhotoStatusClientProperties properties) {
        return new WebClientJobStatusClient(webClient, properties.getStatusRequestTimeout());
    }

    @Bean
    public StreamHealth streamHealth() {
        return new StreamHealth();
    }

    @Bean
    public PhotoStateStore photoStateStore() {
        return new PhotoStateStore();
    }

    @Bean
    public StreamConnector streamConnector(PhotoEventStreamTransport transport,
                                           StreamHealth streamHealth,
                                           @Qualifier("photoStatusClientScheduler") Scheduler scheduler,
                                           PhotoStatusClientProperties properties) {
        PhotoStatusClientProperties.Backoff backoff = properties.getBackoff();
        return new StreamConnector(
                transport,
                new ReconnectBackoff(backoff.getBaseMs(), backoff.getMaxMs(), backoff.getJitterRatio(), null),
                new EventDedupeCache(properties.getDedupeCapacity()),
                streamHealth,
                scheduler,
                properties.getFallbackFailureThreshold());
    }

    @Bean
    public PollingTaskManager pollingTaskManager(JobStatusClient jobStatusClient,
                                                 PhotoStateStore photoStateStore,
                                                 StreamHealth streamHealth,
                                                 @Qualifier("photoStatusClientScheduler") Scheduler scheduler,
                                                 PhotoStatusClientProperties properties) {
        return new PollingTaskManager(jobStatusClient, photoStateStore, streamHealth, scheduler,
                properties.getPolling().toOptions(), properties.getMaxConsecutivePollErrors());
    }

    @Bean(destroyMethod = "close")
    public DeliveryCoordinator deliveryCoordinator(StreamConnector streamConnector,
                                                   PollingTaskManager pollingTaskManager,
                                                   PhotoStateStore photoStateStore,
                                                   @Qualifier("photoStatusClientScheduler") Scheduler scheduler) {
        return new DeliveryCoordinator(streamConnector, pollingTaskManager, photoStateStore, scheduler);
    }
}
