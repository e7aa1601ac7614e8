package com.example.gatekeeper.authz.abac.engine;

import com.example.gatekeeper.authz.abac.model.PolicyConditions;
import com.example.gatekeeper.authz.abac.model.TimeWindow;
import com.example.gatekeeper.util.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T10:00:00Z");
    private final ConditionEvaluator evaluator = new ConditionEvaluator(clock);

    @Test
    @DisplayName("should pass when no condition is set")
    void shouldPassWithoutConditions() {
        assertThat(evaluator.firstUnmet(PolicyConditions.NONE, Map.of())).isEmpty();
    }

    @Nested
    @DisplayName("ip_range")
    class IpRange {

        private final PolicyConditions office = new PolicyConditions("10.0.0.0/8", null, null, null);

        @Test
        @DisplayName("should pass for an address inside the block")
        void shouldPassInsideRange() {
            assertThat(evaluator.firstUnmet(office, Map.of("client_ip", "10.1.2.3"))).isEmpty();
        }

        @Test
        @DisplayName("should fail for an address outside the block")
        void shouldFailOutsideRange() {
            assertThat(evaluator.firstUnmet(office, Map.of("client_ip", "192.168.1.1"))).contains("ip_range");
        }

        @Test
        @DisplayName("should fail when the client address is unknown")
        void shouldFailWithoutClientIp() {
            assertThat(evaluator.firstUnmet(office, Map.of())).contains("ip_range");
        }
    }

    @Nested
    @DisplayName("time_window")
    class Window {

        @Test
        @DisplayName("should follow the clock")
        void shouldFollowClock() {
            Instant now = clock.instant();
            PolicyConditions conditions = new PolicyConditions(null,
                    new TimeWindow(now.minus(Duration.ofHours(1)), now.plus(Duration.ofHours(1))), null, null);

            assertThat(evaluator.firstUnmet(conditions, Map.of())).isEmpty();

            clock.advance(Duration.ofHours(2));

            assertThat(evaluator.firstUnmet(conditions, Map.of())).contains("time_window");
        }

        @Test
        @DisplayName("should treat missing bounds as open")
        void shouldAllowOpenBounds() {
            PolicyConditions conditions = new PolicyConditions(null, new TimeWindow(clock.instant(), null), null, null);

            assertThat(evaluator.firstUnmet(conditions, Map.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("mfa_required")
    class Mfa {

        private final PolicyConditions mfa = new PolicyConditions(null, null, true, null);

        @Test
        @DisplayName("should accept boolean and string true")
        void shouldAcceptVerified() {
            assertThat(evaluator.firstUnmet(mfa, Map.of("mfa_verified", true))).isEmpty();
            assertThat(evaluator.firstUnmet(mfa, Map.of("mfa_verified", "true"))).isEmpty();
        }

        @Test
        @DisplayName("should fail when not verified")
        void shouldFailUnverified() {
            assertThat(evaluator.firstUnmet(mfa, Map.of("mfa_verified", false))).contains("mfa_required");
            assertThat(evaluator.firstUnmet(mfa, Map.of())).contains("mfa_required");
        }
    }

    @Nested
    @DisplayName("attributes")
    class Attributes {

        @Test
        @DisplayName("should require equal values")
        void shouldRequireEqualValues() {
            PolicyConditions conditions = new PolicyConditions(null, null, null, Map.of("department", "finance"));

            assertThat(evaluator.firstUnmet(conditions, Map.of("department", "finance"))).isEmpty();
            assertThat(evaluator.firstUnmet(conditions, Map.of("department", "sales"))).contains("attributes.department");
            assertThat(evaluator.firstUnmet(conditions, Map.of())).contains("attributes.department");
        }

        @Test
        @DisplayName("should compare numbers by value")
        void shouldCompareNumbersByValue() {
            PolicyConditions conditions = new PolicyConditions(null, null, null, Map.of("clearance", 3));

            assertThat(evaluator.firstUnmet(conditions, Map.of("clearance", 3L))).isEmpty();
            assertThat(evaluator.firstUnmet(conditions, Map.of("clearance", 3.0))).isEmpty();
            assertThat(evaluator.firstUnmet(conditions, Map.of("clearance", "3"))).contains("attributes.clearance");
        }
    }
}
