package com.example.gatekeeper.config;

import com.example.gatekeeper.auth.filter.BearerTokenAuthenticationFilter;
import com.example.gatekeeper.auth.service.TokenService;
import com.example.gatekeeper.authz.filter.PermissionAuthorizationFilter;
import com.example.gatekeeper.authz.service.AuthorizationService;
import com.example.gatekeeper.session.service.SessionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.util.matcher.PathPatternParserServerWebExchangeMatcher;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;

/**
 * Security filter chains. The authentication and permission filters are created here rather than
 * registered as beans so they only run inside the API chain.
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    private final TokenService tokenService;
    private final SessionService sessionService;
    private final AuthorizationService authorizationService;
    private final RequestMappingHandlerMapping handlerMapping;
    private final ObjectMapper objectMapper;

    public SecurityConfig(
            TokenService tokenService,
            SessionService sessionService,
            AuthorizationService authorizationService,
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping,
            ObjectMapper objectMapper) {
        this.tokenService = tokenService;
        this.sessionService = sessionService;
        this.authorizationService = authorizationService;
        this.handlerMapping = handlerMapping;
        this.objectMapper = objectMapper;
    }

    // Public: refresh, JWKS, health - no bearer token
    @Bean
    @Order(1)
    public SecurityWebFilterChain publicSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(ServerWebExchangeMatchers.pathMatchers(
                        "/api/v1/auth/refresh", "/.well-known/jwks.json", "/actuator/health", "/actuator/info"))
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .build();
    }

    // API: /api/v1/** - bearer access token + @RequiresPermission
    @Bean
    @Order(2)
    public SecurityWebFilterChain apiSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(new PathPatternParserServerWebExchangeMatcher("/api/v1/**"))
                .csrf(ServerHttpSecurity.CsrfSpec::disable) // bearer tokens, no cookies
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .addFilterAt(new BearerTokenAuthenticationFilter(tokenService, sessionService, objectMapper),
                        SecurityWebFiltersOrder.AUTHENTICATION)
                .addFilterAfter(new PermissionAuthorizationFilter(handlerMapping, authorizationService, objectMapper),
                        SecurityWebFiltersOrder.AUTHORIZATION)
                .build();
    }

    // Catch-all: deny unmatched paths
    @Bean
    @Order(Integer.MAX_VALUE)
    public SecurityWebFilterChain catchAllSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(ServerWebExchangeMatchers.anyExchange())
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().denyAll())
                .build();
    }
}
