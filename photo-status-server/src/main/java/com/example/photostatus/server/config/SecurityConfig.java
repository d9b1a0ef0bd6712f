package com.example.photostatus.server.config;

import com.example.photostatus.server.security.AuthenticatedUserResolver;
import com.example.photostatus.server.security.HeaderAuthenticatedUserResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecurityConfig {

    @Bean
    @ConditionalOnMissingBean(AuthenticatedUserResolver.class)
    public AuthenticatedUserResolver authenticatedUserResolver() {
        return new HeaderAuthenticatedUserResolver();
    }
}
