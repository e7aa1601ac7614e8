package com.example.gatekeeper.authz.abac.engine;

import com.example.gatekeeper.authz.abac.model.PolicyConditions;
import com.example.gatekeeper.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.web.util.matcher.IpAddressMatcher;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates policy conditions against the request context.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    public static final String CLIENT_IP = "client_ip";
    public static final String MFA_VERIFIED = "mfa_verified";

    private final Clock clock;

    public ConditionEvaluator(@NonNull Clock clock) {
        this.clock = clock;
    }

    /**
     * Name of the first condition that does not hold, or empty when all hold.
     */
    @NonNull
    public Optional<String> firstUnmet(@NonNull PolicyConditions conditions, @NonNull Map<String, Object> context) {
        if (conditions.ipRange() != null && !ipInRange(context.get(CLIENT_IP), conditions.ipRange())) {
            return Optional.of("ip_range");
        }
        if (conditions.timeWindow() != null && !conditions.timeWindow().contains(Instant.now(clock))) {
            return Optional.of("time_window");
        }
        if (Boolean.TRUE.equals(conditions.mfaRequired()) && !isTrue(context.get(MFA_VERIFIED))) {
            return Optional.of("mfa_required");
        }
        if (conditions.attributes() != null) {
            for (Map.Entry<String, Object> expected : conditions.attributes().entrySet()) {
                if (!attributeEquals(expected.getValue(), context.get(expected.getKey()))) {
                    return Optional.of("attributes." + expected.getKey());
                }
            }
        }
        return Optional.empty();
    }

    private boolean ipInRange(@Nullable Object clientIp, @NonNull String range) {
        if (clientIp == null) {
            return false;
        }
        try {
            return new IpAddressMatcher(range).matches(clientIp.toString());
        } catch (IllegalArgumentException e) {
            log.warn("Cannot evaluate ip_range {} for {}: {}", StringSanitizer.forLog(range),
                    StringSanitizer.forLog(clientIp.toString()), e.getMessage());
            return false;
        }
    }

    private static boolean isTrue(@Nullable Object value) {
        return Boolean.TRUE.equals(value) || (value instanceof String s && Boolean.parseBoolean(s));
    }

    private static boolean attributeEquals(@Nullable Object expected, @Nullable Object actual) {
        if (Objects.equals(expected, actual)) {
            return true;
        }
        if (expected instanceof Number && actual instanceof Number) {
            return new BigDecimal(expected.toString()).compareTo(new BigDecimal(actual.toString())) == 0;
        }
        return false;
    }
}
