package com.example.gatekeeper.audit.store;

import com.example.gatekeeper.audit.model.AuditLogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

@Slf4j
@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryAuditLogStore implements AuditLogStore {

    private final Map<String, ConcurrentNavigableMap<Long, AuditLogEntry>> chains = new ConcurrentHashMap<>();

    @Override
    @NonNull
    public Mono<AuditLogEntry> findLatest(@NonNull String chainScope) {
        return Mono.fromCallable(() -> {
            ConcurrentNavigableMap<Long, AuditLogEntry> chain = chains.get(chainScope);
            if (chain == null) {
                return null;
            }
            Map.Entry<Long, AuditLogEntry> last = chain.lastEntry();
            return last != null ? last.getValue() : null;
        });
    }

    @Override
    @NonNull
    public Mono<AuditLogEntry> insert(@NonNull AuditLogEntry entry) {
        return Mono.fromCallable(() -> {
            ConcurrentNavigableMap<Long, AuditLogEntry> chain =
                    chains.computeIfAbsent(entry.chainScope(), k -> new ConcurrentSkipListMap<>());
            if (chain.putIfAbsent(entry.sequence(), entry) != null) {
                throw new AuditChainConflictException(entry.chainScope(), entry.sequence());
            }
            return entry;
        });
    }

    @Override
    @NonNull
    public Flux<AuditLogEntry> findByScope(@NonNull String chainScope) {
        return Flux.defer(() -> {
            ConcurrentNavigableMap<Long, AuditLogEntry> chain = chains.get(chainScope);
            return chain == null ? Flux.empty() : Flux.fromIterable(chain.values());
        });
    }

    @Override
    @NonNull
    public Flux<AuditLogEntry> findByScopeBetween(@NonNull String chainScope,
                                                   @NonNull Instant from,
                                                   @NonNull Instant to) {
        return findByScope(chainScope)
                .filter(entry -> !entry.timestamp().isBefore(from) && entry.timestamp().isBefore(to));
    }
}
