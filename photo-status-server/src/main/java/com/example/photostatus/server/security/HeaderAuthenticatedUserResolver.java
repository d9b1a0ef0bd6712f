package com.example.photostatus.server.security;

import com.example.photostatus.shared.util.Constants;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Reads the user id an authenticating gateway forwarded in {@code X-Authenticated-User-Id}.
 */
public class HeaderAuthenticatedUserResolver implements AuthenticatedUserResolver {

    @Override
    public Optional<String> resolve(ServerWebExchange exchange) {
        String userId = exchange.getRequest().getHeaders().getFirst(Constants.Headers.AUTHENTICATED_USER_ID);
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(userId.trim());
    }
}
