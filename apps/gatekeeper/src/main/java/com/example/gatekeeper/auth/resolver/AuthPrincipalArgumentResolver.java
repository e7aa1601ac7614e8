package com.example.gatekeeper.auth.resolver;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.auth.exception.AuthenticationException;
import com.example.gatekeeper.common.dto.ErrorResponse;
import org.springframework.core.MethodParameter;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Resolves {@link AuthenticatedPrincipal} parameters in controller methods.
 *
 * <p>The principal is read from the exchange attributes where
 * {@link com.example.gatekeeper.auth.filter.BearerTokenAuthenticationFilter} stored it.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * @GetMapping("/permissions")
 * public Mono<ResponseEntity<EffectivePermissionsResponse>> permissions(AuthenticatedPrincipal principal) {
 *     String tenantId = principal.tenantId();
 *     // ...
 * }
 * }</pre>
 */
@Component
public class AuthPrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(@NonNull MethodParameter parameter) {
        return AuthenticatedPrincipal.class.equals(parameter.getParameterType());
    }

    @Override
    @NonNull
    public Mono<Object> resolveArgument(
            @NonNull MethodParameter parameter,
            @NonNull BindingContext bindingContext,
            @NonNull ServerWebExchange exchange) {

        AuthenticatedPrincipal principal = exchange.getAttribute(AuthenticatedPrincipal.EXCHANGE_ATTRIBUTE);

        if (principal == null) {
            return Mono.error(new AuthenticationException(ErrorResponse.Codes.TOKEN_MISSING,
                    "Authentication required"));
        }

        return Mono.just(principal);
    }
}
