package com.example.photostatus.server.controller;

import com.example.photostatus.server.config.AppProperties;
import com.example.photostatus.server.config.RequestIdFilter;
import com.example.photostatus.server.metrics.RealtimeMetrics;
import com.example.photostatus.server.security.AuthenticatedUserResolver;
import com.example.photostatus.server.service.PhotoEventBroadcaster;
import com.example.photostatus.server.service.PhotoEventBroadcaster.DisconnectReason;
import com.example.photostatus.server.service.PhotoEventHistory;
import com.example.photostatus.server.service.SseConnection;
import com.example.photostatus.server.service.SseFrameFormatter;
import com.example.photostatus.server.service.SubscribeResult;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import com.example.photostatus.shared.dto.RealtimeErrorResponse;
import com.example.photostatus.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class PhotoEventsController {

    private final AppProperties appProperties;
    private final AuthenticatedUserResolver userResolver;
    private final PhotoEventBroadcaster broadcaster;
    private final PhotoEventHistory history;
    private final SseFrameFormatter frameFormatter;
    private final RealtimeMetrics metrics;
    private final ObjectMapper objectMapper;

    /**
     * Opens the authenticated user's photo processing event stream.
     *
     * <p>Refusals are JSON, checked in order: kill switch (503), no user (401), a WebSocket
     * upgrade attempt (426), then the per-user connection cap (429). An accepted stream starts
     * with a {@code : connected} comment followed by any history after {@code since} or the
     * {@code Last-Event-ID} header.
     */
    @GetMapping("/photos")
    public Mono<Void> streamPhotoEvents(@RequestParam(name = "since", required = false) String since,
                                        ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        String requestId = RequestIdFilter.requestId(exchange);

        if (appProperties.getRealtime().isDisabled()) {
            metrics.connectionRejected("disabled");
            return reject(exchange, HttpStatus.SERVICE_UNAVAILABLE, "Real-time events disabled", requestId);
        }

        Optional<String> authenticatedUser = userResolver.resolve(exchange);
        if (authenticatedUser.isEmpty()) {
            metrics.connectionRejected("auth_fail");
            return reject(exchange, HttpStatus.UNAUTHORIZED, "Unauthorized", requestId);
        }
        String userId = authenticatedUser.get();

        if (isWebSocketUpgrade(request)) {
            log.info("[CONNECT_REJECTED] WebSocket upgrade attempted on SSE endpoint. userId='{}', requestId='{}'",
                    userId, requestId);
            metrics.connectionRejected("upgrade_required");
            return reject(exchange, HttpStatus.UPGRADE_REQUIRED, "WebSocket upgrade required", requestId);
        }

        log.info("[CONNECT_START] SSE connection request for userId='{}', requestId='{}', IP='{}'",
                userId, requestId,
                request.getRemoteAddress() != null ? request.getRemoteAddress().getAddress().getHostAddress() : "unknown");

        String resumeFrom = resolveSince(since, request);
        List<String> initialFrames = new ArrayList<>();
        initialFrames.add(frameFormatter.connected());
        List<PhotoStatusUpdate> missed = missedEvents(userId, resumeFrom);
        for (PhotoStatusUpdate update : missed) {
            initialFrames.add(frameFormatter.formatEvent(Constants.PHOTO_PROCESSING_EVENT, update.getEventId(), update));
        }

        SseConnection connection = new SseConnection(appProperties.getSse().getMaxBufferedFrames());
        SubscribeResult result = broadcaster.subscribe(userId, connection, initialFrames);
        if (!result.isOk()) {
            if (result.getReason() == SubscribeResult.RejectReason.CONNECTION_CAP) {
                return reject(exchange, HttpStatus.TOO_MANY_REQUESTS, "Too many connections", requestId);
            }
            return reject(exchange, HttpStatus.SERVICE_UNAVAILABLE, "Real-time events unavailable", requestId);
        }
        if (!missed.isEmpty()) {
            log.info("[CATCH_UP] Replayed {} events for userId='{}' since '{}'", missed.size(), userId, resumeFrom);
        }

        ServerHttpResponse response = exchange.getResponse();
        HttpHeaders headers = response.getHeaders();
        headers.setContentType(MediaType.TEXT_EVENT_STREAM);
        headers.setCacheControl(CacheControl.noCache().getHeaderValue() + ", no-transform");
        headers.set("X-Accel-Buffering", "no");

        DataBufferFactory bufferFactory = response.bufferFactory();
        Flux<Mono<DataBuffer>> frames = connection.asFlux()
                .map(frame -> Mono.just(bufferFactory.wrap(frame.getBytes(StandardCharsets.UTF_8))))
                .doFinally(signal -> broadcaster.unsubscribe(userId, connection,
                        signal == SignalType.ON_ERROR ? DisconnectReason.WRITE_FAILED : DisconnectReason.CLIENT_CLOSE));
        return response.writeAndFlushWith(frames);
    }

    private List<PhotoStatusUpdate> missedEvents(String userId, String since) {
        return since == null ? List.of() : history.getCatchupEvents(userId, since);
    }

    private static String resolveSince(String sinceParam, ServerHttpRequest request) {
        if (sinceParam != null && !sinceParam.isBlank()) {
            return sinceParam.trim();
        }
        String lastEventId = request.getHeaders().getFirst(Constants.Headers.LAST_EVENT_ID);
        if (lastEventId != null && !lastEventId.isBlank()) {
            return lastEventId.trim();
        }
        return null;
    }

    private static boolean isWebSocketUpgrade(ServerHttpRequest request) {
        String upgrade = request.getHeaders().getUpgrade();
        return upgrade != null && upgrade.toLowerCase(Locale.ROOT).contains("websocket");
    }

    private Mono<Void> reject(ServerWebExchange exchange, HttpStatus status, String error, String requestId) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().set(Constants.Headers.REQUEST_ID, requestId);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(RealtimeErrorResponse.of(error, requestId));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }
}
