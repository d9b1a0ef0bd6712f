package com.example.photostatus.server.config;

import com.example.photostatus.server.service.RedisPhotoStatusListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Subscribes the status relay to the pipeline's pub/sub channel. Off by default so the
 * service runs without Redis.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "photo-status.relay", name = "redis-enabled", havingValue = "true")
public class RedisRelayConfig {

    @Bean
    public RedisMessageListenerContainer photoStatusListenerContainer(RedisConnectionFactory connectionFactory,
                                                                      Executor redisTaskExecutor,
                                                                      RedisPhotoStatusListener listener,
                                                                      AppProperties appProperties) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(redisTaskExecutor);
        String channel = appProperties.getRelay().getChannel();
        container.addMessageListener(listener, new ChannelTopic(channel));
        log.info("Photo status relay subscribed to Redis channel '{}'", channel);
        return container;
    }

    @Bean
    public Executor redisTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("redis-listener-");
        executor.initialize();
        return executor;
    }
}
