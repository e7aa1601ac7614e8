package com.example.gatekeeper.audit.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.model.AuditLogEntry;
import com.example.gatekeeper.audit.model.AuditRecord;
import com.example.gatekeeper.audit.model.ChainVerificationResult;
import com.example.gatekeeper.audit.model.ChainVerificationResult.FailureType;
import com.example.gatekeeper.audit.store.AuditChainConflictException;
import com.example.gatekeeper.audit.store.AuditLogStore;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.AuditProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-linked audit log.
 *
 * <p>Appends to one chain scope are strictly serialized: within this process by a fair lock
 * per scope, across processes by the store's unique (scope, sequence) constraint, which makes
 * the losing writer re-read the head and try again. Two writers can therefore never link to the
 * same predecessor.
 */
@Slf4j
@Service
public class AuditChainService {

    public static final String GLOBAL_SCOPE = "global";

    private final AuditLogStore store;
    private final AuditHasher hasher;
    private final AuditProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> scopeLocks = new ConcurrentHashMap<>();

    public AuditChainService(
            @NonNull AuditLogStore store,
            @NonNull AuditHasher hasher,
            @NonNull AuditProperties properties,
            @NonNull Clock clock) {
        this.store = store;
        this.hasher = hasher;
        this.properties = properties;
        this.clock = clock;
    }

    @NonNull
    public static String scopeOf(@Nullable String tenantId) {
        return tenantId == null || tenantId.isBlank() ? GLOBAL_SCOPE : tenantId;
    }

    @NonNull
    public Mono<AuditLogEntry> append(
            @Nullable String tenantId,
            @Nullable String userId,
            @NonNull AuditEventType eventType,
            @NonNull Map<String, Object> eventData,
            @Nullable String ipAddress,
            @Nullable String userAgent) {
        return append(new AuditRecord(tenantId, userId, eventType, eventData, ipAddress, userAgent));
    }

    /**
     * Links the record to the head of its chain and stores it.
     */
    @NonNull
    public Mono<AuditLogEntry> append(@NonNull AuditRecord record) {
        String scope = scopeOf(record.tenantId());
        return Mono.fromCallable(() -> appendSerialized(scope, record))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(entry -> log.debug("Audit entry appended: scope={}, seq={}, type={}",
                        StringSanitizer.forLog(scope), entry.sequence(), entry.eventType()))
                .doOnError(e -> log.error("Audit append failed: scope={}, type={}, error={}",
                        StringSanitizer.forLog(scope), record.eventType().wireName(), e.getMessage()));
    }

    private AuditLogEntry appendSerialized(String scope, AuditRecord record) {
        ReentrantLock lock = scopeLocks.computeIfAbsent(scope, k -> new ReentrantLock(true));
        lock.lock();
        try {
            AuditChainConflictException lastConflict = null;
            for (int attempt = 1; attempt <= properties.maxAppendAttempts(); attempt++) {
                AuditLogEntry head = store.findLatest(scope).block(properties.appendTimeout());
                AuditLogEntry entry = link(scope, head, record);
                try {
                    return Objects.requireNonNull(store.insert(entry).block(properties.appendTimeout()));
                } catch (AuditChainConflictException e) {
                    lastConflict = e;
                    log.warn("Audit chain head moved during append (scope={}, attempt={})",
                            StringSanitizer.forLog(scope), attempt);
                }
            }
            throw lastConflict;
        } finally {
            lock.unlock();
        }
    }

    private AuditLogEntry link(String scope, @Nullable AuditLogEntry head, AuditRecord record) {
        String previousHash = head != null ? head.currentHash() : AuditHasher.GENESIS;
        long sequence = head != null ? head.sequence() + 1 : 1L;
        Instant timestamp = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        String eventType = record.eventType().wireName();
        String currentHash = hasher.hash(previousHash, record.eventData(), eventType, timestamp);

        return new AuditLogEntry(
                UUID.randomUUID().toString(),
                scope,
                sequence,
                record.tenantId(),
                record.userId(),
                eventType,
                record.eventData(),
                record.ipAddress(),
                record.userAgent(),
                timestamp,
                previousHash,
                currentHash);
    }

    /**
     * Replays a chain from genesis.
     */
    @NonNull
    public ChainVerificationResult verifyChain(@NonNull List<AuditLogEntry> entries) {
        return verifyChain(entries, AuditHasher.GENESIS);
    }

    /**
     * Replays a chain segment whose first entry must link to {@code anchorHash}. Reports the first
     * entry whose recomputed hash differs from the stored one, or whose link to its predecessor is broken.
     */
    @NonNull
    public ChainVerificationResult verifyChain(@NonNull List<AuditLogEntry> entries, @NonNull String anchorHash) {
        if (entries.isEmpty()) {
            return ChainVerificationResult.intact(0, null, null);
        }
        Instant first = entries.get(0).timestamp();
        String expectedPrevious = anchorHash;

        for (int i = 0; i < entries.size(); i++) {
            AuditLogEntry entry = entries.get(i);
            String recomputed = hasher.hash(entry.previousHash(), entry.eventData(),
                    entry.eventType(), entry.timestamp());
            if (!recomputed.equals(entry.currentHash())) {
                log.warn("Audit chain hash mismatch at position {} (entry={})", i + 1, entry.id());
                return ChainVerificationResult.broken(i, FailureType.HASH_MISMATCH, entry, first);
            }
            if (!expectedPrevious.equals(entry.previousHash())) {
                log.warn("Audit chain link broken at position {} (entry={})", i + 1, entry.id());
                return ChainVerificationResult.broken(i, FailureType.LINK_BROKEN, entry, first);
            }
            expectedPrevious = entry.currentHash();
        }
        return ChainVerificationResult.intact(entries.size(), first, entries.get(entries.size() - 1).timestamp());
    }

    /**
     * Loads and verifies the full stored chain of a tenant (or the global chain).
     */
    @NonNull
    public Mono<ChainVerificationResult> verifyStoredChain(@Nullable String tenantId) {
        return store.findByScope(scopeOf(tenantId))
                .collectList()
                .map(this::verifyChain);
    }

    /**
     * Entries of a tenant chain within {@code [from, to)}, capped at the configured export size.
     */
    @NonNull
    public Flux<AuditLogEntry> export(@Nullable String tenantId, @NonNull Instant from, @NonNull Instant to) {
        if (!from.isBefore(to)) {
            return Flux.error(new IllegalArgumentException("Export range start must precede its end"));
        }
        return store.findByScopeBetween(scopeOf(tenantId), from, to)
                .take(properties.exportMaxEntries());
    }
}
