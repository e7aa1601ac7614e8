package com.example.gatekeeper.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Security metrics. Tag values come from fixed vocabularies (decision sources, revocation
 * reasons) to keep cardinality bounded.
 */
@Component
public class GatekeeperMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;

    private final Counter tokenRefreshSuccess;
    private final Counter tokenRefreshFailure;
    private final Counter tokenReplay;
    private final Counter sessionCreated;
    private final ConcurrentHashMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> revocationCounters = new ConcurrentHashMap<>();

    public GatekeeperMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.tokenRefreshSuccess = Counter.builder("gatekeeper.token.refresh")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Successful refresh token rotations")
                .register(registry);

        this.tokenRefreshFailure = Counter.builder("gatekeeper.token.refresh")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Rejected refresh attempts")
                .register(registry);

        this.tokenReplay = Counter.builder("gatekeeper.token.replay")
                .description("Refresh token replays that revoked a token family")
                .register(registry);

        this.sessionCreated = Counter.builder("gatekeeper.session.created")
                .description("Sessions created on sign-in")
                .register(registry);
    }

    public void recordDecision(boolean allowed, @NonNull String source) {
        String outcome = allowed ? "allow" : "deny";
        decisionCounters.computeIfAbsent(outcome + ":" + source, k ->
                Counter.builder("gatekeeper.authz.decisions")
                        .tag("outcome", outcome)
                        .tag("source", source)
                        .description("Authorization decisions")
                        .register(registry))
                .increment();
    }

    public void recordRefresh(boolean success) {
        (success ? tokenRefreshSuccess : tokenRefreshFailure).increment();
    }

    public void recordReplay() {
        tokenReplay.increment();
    }

    public void recordSessionCreated() {
        sessionCreated.increment();
    }

    public void recordSessionRevoked(@NonNull String reason) {
        revocationCounters.computeIfAbsent(reason, k ->
                Counter.builder("gatekeeper.session.revoked")
                        .tag("reason", reason)
                        .description("Sessions revoked")
                        .register(registry))
                .increment();
    }
}
