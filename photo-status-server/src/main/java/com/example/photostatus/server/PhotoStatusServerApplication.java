package com.example.photostatus.server;

import com.example.photostatus.server.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the photo status delivery service.
 *
 * Fans photo processing status events out to each user's open SSE connections:
 * - Per-user connection cap with comment heartbeats to keep proxies from idling out
 * - Short in-memory history so reconnecting clients can catch up
 * - Optional Redis pub/sub relay fed by the processing pipeline
 */
@SpringBootApplication
@EnableConfigurationProperties({
    AppProperties.class
})
public class PhotoStatusServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoStatusServerApplication.class, args);
    }
}
