package com.example.photostatus.server.config;

import com.example.photostatus.shared.util.Constants;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Gives every request one id: the caller's {@code X-Request-Id} if sent, else a fresh UUID. The id
 * is echoed on the response, logged as {@code request_id} and carried in realtime error bodies.
 */
@Component
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";
    static final String REQUEST_ID_MDC_KEY = "request_id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = requestId(exchange);
        exchange.getResponse().getHeaders().set(Constants.Headers.REQUEST_ID, requestId);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        return chain.filter(exchange)
                .doFinally(signalType -> MDC.remove(REQUEST_ID_MDC_KEY));
    }

    /**
     * The exchange's request id, assigned on first call. Handlers reached without this filter in
     * front still get a stable id for the exchange.
     */
    public static String requestId(ServerWebExchange exchange) {
        String existing = exchange.getAttribute(REQUEST_ID_ATTRIBUTE);
        if (existing != null) {
            return existing;
        }
        String header = exchange.getRequest().getHeaders().getFirst(Constants.Headers.REQUEST_ID);
        String requestId = header != null && !header.isBlank() ? header.trim() : UUID.randomUUID().toString();
        exchange.getAttributes().put(REQUEST_ID_ATTRIBUTE, requestId);
        return requestId;
    }
}
