package com.example.gatekeeper.authz.filter;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.authz.annotation.RequiresPermission;
import com.example.gatekeeper.authz.model.AuthorizationRequest;
import com.example.gatekeeper.authz.model.Permission;
import com.example.gatekeeper.authz.service.AuthorizationService;
import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.filter.FilterResponseUtils;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * WebFilter that enforces {@link RequiresPermission} on controller methods.
 *
 * <p>Runs after {@link com.example.gatekeeper.auth.filter.BearerTokenAuthenticationFilter}, which
 * stores the {@link AuthenticatedPrincipal} on the exchange. Handlers without the annotation pass through.
 */
@Slf4j
@RequiredArgsConstructor
public class PermissionAuthorizationFilter implements WebFilter {

    static final String CONTEXT_CLIENT_IP = "client_ip";
    static final String CONTEXT_USER_AGENT = "user_agent";

    private final RequestMappingHandlerMapping handlerMapping;
    private final AuthorizationService authorizationService;
    private final ObjectMapper objectMapper;

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        // Resolve the annotation first: every branch below completes empty
        return handlerMapping.getHandler(exchange)
                .map(handler -> Optional.ofNullable(annotationOf(handler)))
                .defaultIfEmpty(Optional.empty())
                .flatMap(annotation -> annotation
                        .map(required -> authorize(exchange, required, chain))
                        .orElseGet(() -> chain.filter(exchange)));
    }

    @Nullable
    private static RequiresPermission annotationOf(Object handler) {
        if (handler instanceof HandlerMethod handlerMethod) {
            return handlerMethod.getMethodAnnotation(RequiresPermission.class);
        }
        return null;
    }

    private Mono<Void> authorize(ServerWebExchange exchange, RequiresPermission annotation, WebFilterChain chain) {
        AuthenticatedPrincipal principal = exchange.getAttribute(AuthenticatedPrincipal.EXCHANGE_ATTRIBUTE);
        if (principal == null) {
            log.debug("No principal found for @RequiresPermission endpoint");
            return FilterResponseUtils.unauthorized(exchange, ErrorResponse.Codes.TOKEN_MISSING,
                    "Authentication required", objectMapper);
        }

        String resourceId = resourceId(exchange, annotation);
        Map<String, Object> context = new HashMap<>();
        if (principal.ipAddress() != null) {
            context.put(CONTEXT_CLIENT_IP, principal.ipAddress());
        }
        if (principal.userAgent() != null) {
            context.put(CONTEXT_USER_AGENT, principal.userAgent());
        }
        AuthorizationRequest request = new AuthorizationRequest(principal.userId(), principal.tenantId(),
                annotation.resource(), annotation.action(), resourceId, context);

        return authorizationService.isAuthorized(request)
                .flatMap(allowed -> {
                    if (allowed) {
                        return chain.filter(exchange);
                    }
                    String required = Permission.of(annotation.resource(), annotation.action());
                    log.warn("Permission {} denied for user {} on {}", required,
                            StringSanitizer.forLog(principal.userId()),
                            StringSanitizer.forLog(exchange.getRequest().getPath().value()));
                    return FilterResponseUtils.forbidden(exchange, ErrorResponse.Codes.PERMISSION_DENIED,
                            "Permission denied", Map.of("required", required), objectMapper);
                });
    }

    @Nullable
    private String resourceId(ServerWebExchange exchange, RequiresPermission annotation) {
        if (annotation.resourceIdVariable().isEmpty()) {
            return null;
        }
        Map<String, String> variables = exchange.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return variables != null ? variables.get(annotation.resourceIdVariable()) : null;
    }
}
