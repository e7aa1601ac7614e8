package com.example.gatekeeper.audit.store;

import com.example.gatekeeper.audit.model.AuditLogEntry;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only storage for audit chains. There is deliberately no update or delete.
 */
public interface AuditLogStore {

    /**
     * Most recent entry of a scope, or empty for a new chain.
     */
    @NonNull
    Mono<AuditLogEntry> findLatest(@NonNull String chainScope);

    /**
     * Inserts a new entry. Signals {@link AuditChainConflictException} when the
     * (scope, sequence) position is already taken.
     */
    @NonNull
    Mono<AuditLogEntry> insert(@NonNull AuditLogEntry entry);

    /**
     * All entries of a scope in sequence order.
     */
    @NonNull
    Flux<AuditLogEntry> findByScope(@NonNull String chainScope);

    /**
     * Entries of a scope with {@code from <= timestamp < to}, in sequence order.
     */
    @NonNull
    Flux<AuditLogEntry> findByScopeBetween(@NonNull String chainScope, @NonNull Instant from, @NonNull Instant to);
}
