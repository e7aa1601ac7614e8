package com.example.gatekeeper.audit.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.model.AuditLogEntry;
import com.example.gatekeeper.audit.model.ChainVerificationResult;
import com.example.gatekeeper.audit.model.ChainVerificationResult.FailureType;
import com.example.gatekeeper.util.GatekeeperTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditChainServiceTest {

    private static final String TENANT = "acme";

    private GatekeeperTestHarness harness;
    private AuditChainService service;

    @BeforeEach
    void setUp() {
        harness = new GatekeeperTestHarness();
        service = harness.auditChain;
    }

    private List<AuditLogEntry> appendEntries(String tenantId, int count) {
        List<AuditLogEntry> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entries.add(service.append(tenantId, "u1", AuditEventType.ROLE_CHANGED,
                    Map.of("step", i, "role_id", "r" + i), "10.0.0.1", "junit").block());
            harness.clock.advance(Duration.ofSeconds(1));
        }
        return entries;
    }

    private static AuditLogEntry withEventData(AuditLogEntry entry, Map<String, Object> eventData) {
        return new AuditLogEntry(entry.id(), entry.chainScope(), entry.sequence(), entry.tenantId(), entry.userId(),
                entry.eventType(), eventData, entry.ipAddress(), entry.userAgent(), entry.timestamp(),
                entry.previousHash(), entry.currentHash());
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("should link each entry to its predecessor")
        void shouldLinkEntries() {
            List<AuditLogEntry> entries = appendEntries(TENANT, 3);

            assertThat(entries.get(0).previousHash()).isEqualTo(AuditHasher.GENESIS);
            assertThat(entries.get(0).sequence()).isEqualTo(1L);
            assertThat(entries.get(1).previousHash()).isEqualTo(entries.get(0).currentHash());
            assertThat(entries.get(2).previousHash()).isEqualTo(entries.get(1).currentHash());
            assertThat(entries).extracting(AuditLogEntry::sequence).containsExactly(1L, 2L, 3L);
        }

        @Test
        @DisplayName("should record the event with millisecond timestamps")
        void shouldRecordEvent() {
            harness.clock.set(Instant.parse("2026-03-02T10:00:00.123456Z"));

            AuditLogEntry entry = service.append(TENANT, "u1", AuditEventType.SESSION_CREATED,
                    Map.of("session_id", "s1"), "10.0.0.1", "junit").block();

            assertThat(entry.eventType()).isEqualTo("session_created");
            assertThat(entry.chainScope()).isEqualTo(TENANT);
            assertThat(entry.timestamp()).isEqualTo(Instant.parse("2026-03-02T10:00:00.123Z"));
            assertThat(entry.currentHash()).hasSize(64);
        }

        @Test
        @DisplayName("should keep one chain per tenant plus a global chain")
        void shouldSeparateScopes() {
            appendEntries("acme", 2);
            appendEntries("globex", 1);
            service.append(null, null, AuditEventType.SIGNING_KEY_ROTATED, Map.of("new_kid", "k2"), null, null)
                    .block();

            assertThat(harness.auditStore.findByScope("acme").collectList().block()).hasSize(2);
            AuditLogEntry globexFirst = harness.auditStore.findByScope("globex").blockFirst();
            assertThat(globexFirst.sequence()).isEqualTo(1L);
            assertThat(globexFirst.previousHash()).isEqualTo(AuditHasher.GENESIS);
            assertThat(harness.auditStore.findByScope(AuditChainService.GLOBAL_SCOPE).blockFirst().tenantId())
                    .isNull();
        }

        @Test
        @DisplayName("concurrent appends should never fork the chain")
        void concurrentAppendsShouldNotFork() {
            Flux.range(0, 50)
                    .flatMap(i -> service.append(TENANT, "u" + i, AuditEventType.AUTHORIZATION_CHECKED,
                            Map.of("n", i), null, null), 16)
                    .blockLast(Duration.ofSeconds(30));

            List<AuditLogEntry> chain = harness.auditStore.findByScope(TENANT).collectList().block();
            assertThat(chain).hasSize(50);
            assertThat(chain).extracting(AuditLogEntry::previousHash).doesNotHaveDuplicates();
            assertThat(service.verifyChain(chain).valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("should report an intact chain")
        void shouldReportIntactChain() {
            List<AuditLogEntry> entries = appendEntries(TENANT, 4);

            StepVerifier.create(service.verifyStoredChain(TENANT))
                    .assertNext(result -> {
                        assertThat(result.valid()).isTrue();
                        assertThat(result.checkedCount()).isEqualTo(4);
                        assertThat(result.brokenAtPosition()).isNull();
                        assertThat(result.firstTimestamp()).isEqualTo(entries.get(0).timestamp());
                        assertThat(result.lastTimestamp()).isEqualTo(entries.get(3).timestamp());
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("an empty chain should be valid")
        void emptyChainShouldBeValid() {
            ChainVerificationResult result = service.verifyStoredChain("nobody").block();

            assertThat(result.valid()).isTrue();
            assertThat(result.checkedCount()).isZero();
        }

        @Test
        @DisplayName("should locate edited event data by 1-based position")
        void shouldLocateTamperedEntry() {
            List<AuditLogEntry> entries = new ArrayList<>(appendEntries(TENANT, 5));
            entries.set(2, withEventData(entries.get(2), Map.of("step", 99, "role_id", "r2")));

            ChainVerificationResult result = service.verifyChain(entries);

            assertThat(result.valid()).isFalse();
            assertThat(result.brokenAtIndex()).isEqualTo(2);
            assertThat(result.brokenAtPosition()).isEqualTo(3);
            assertThat(result.failure()).isEqualTo(FailureType.HASH_MISMATCH);
            assertThat(result.entryId()).isEqualTo(entries.get(2).id());
        }

        @Test
        @DisplayName("should detect a re-hashed entry by its broken link")
        void shouldDetectBrokenLink() {
            List<AuditLogEntry> entries = new ArrayList<>(appendEntries(TENANT, 3));
            AuditLogEntry original = entries.get(1);
            String forgedPrevious = "0".repeat(64);
            String rehashed = new AuditHasher().hash(forgedPrevious, original.eventData(), original.eventType(),
                    original.timestamp());
            entries.set(1, new AuditLogEntry(original.id(), original.chainScope(), original.sequence(),
                    original.tenantId(), original.userId(), original.eventType(), original.eventData(),
                    original.ipAddress(), original.userAgent(), original.timestamp(), forgedPrevious, rehashed));

            ChainVerificationResult result = service.verifyChain(entries);

            assertThat(result.failure()).isEqualTo(FailureType.LINK_BROKEN);
            assertThat(result.brokenAtPosition()).isEqualTo(2);
        }

        @Test
        @DisplayName("should detect a deleted entry")
        void shouldDetectDeletion() {
            List<AuditLogEntry> entries = new ArrayList<>(appendEntries(TENANT, 4));
            entries.remove(1);

            ChainVerificationResult result = service.verifyChain(entries);

            assertThat(result.valid()).isFalse();
            assertThat(result.brokenAtPosition()).isEqualTo(2);
        }

        @Test
        @DisplayName("hashing should not depend on map insertion order")
        void hashShouldBeCanonical() {
            Map<String, Object> forward = new LinkedHashMap<>();
            forward.put("a", 1);
            forward.put("b", List.of("x", "y"));
            Map<String, Object> backward = new LinkedHashMap<>();
            backward.put("b", List.of("x", "y"));
            backward.put("a", 1);
            Instant at = Instant.parse("2026-03-02T10:00:00Z");
            AuditHasher hasher = new AuditHasher();

            assertThat(hasher.hash("genesis", forward, "role_changed", at))
                    .isEqualTo(hasher.hash("genesis", backward, "role_changed", at));
        }
    }

    @Nested
    @DisplayName("export")
    class Export {

        @Test
        @DisplayName("should return entries in the half-open range")
        void shouldExportRange() {
            List<AuditLogEntry> entries = appendEntries(TENANT, 4);

            StepVerifier.create(service.export(TENANT, entries.get(1).timestamp(), entries.get(3).timestamp()))
                    .expectNext(entries.get(1), entries.get(2))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject an empty or inverted range")
        void shouldRejectInvertedRange() {
            Instant now = harness.clock.instant();

            StepVerifier.create(service.export(TENANT, now, now))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }
}
