package com.example.gatekeeper.auth.context;

import com.example.gatekeeper.auth.exception.AuthenticationException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

/**
 * Carries the {@link AuthenticatedPrincipal} through the Reactor context of a request.
 */
public final class PrincipalContextHolder {

    private static final String PRINCIPAL_KEY = AuthenticatedPrincipal.class.getName();

    private PrincipalContextHolder() {
        // Utility class
    }

    public static Mono<AuthenticatedPrincipal> getPrincipal() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.error(new AuthenticationException("No authenticated principal in reactive context"));
        });
    }

    public static Mono<AuthenticatedPrincipal> getPrincipalIfPresent() {
        return Mono.deferContextual(ctx -> ctx.hasKey(PRINCIPAL_KEY)
                ? Mono.just(ctx.<AuthenticatedPrincipal>get(PRINCIPAL_KEY))
                : Mono.empty());
    }

    public static Function<Context, Context> withPrincipal(AuthenticatedPrincipal principal) {
        return context -> context.put(PRINCIPAL_KEY, principal);
    }
}
