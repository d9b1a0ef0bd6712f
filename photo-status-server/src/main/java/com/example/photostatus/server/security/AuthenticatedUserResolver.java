package com.example.photostatus.server.security;

import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Resolves the user a request was authenticated as. Authentication itself happens upstream; the
 * events endpoint only needs the resulting identity.
 */
@FunctionalInterface
public interface AuthenticatedUserResolver {

    Optional<String> resolve(ServerWebExchange exchange);
}
