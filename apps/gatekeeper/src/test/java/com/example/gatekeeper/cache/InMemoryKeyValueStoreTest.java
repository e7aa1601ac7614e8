package com.example.gatekeeper.cache;

import com.example.gatekeeper.config.properties.MemoryCacheProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

class InMemoryKeyValueStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore(MemoryCacheProperties.defaults(), nanos::get);
    }

    @Test
    @DisplayName("should return stored values until they expire")
    void shouldExpireEntries() {
        store.set("blacklist:j1", "1", Duration.ofSeconds(30)).block();

        StepVerifier.create(store.get("blacklist:j1")).expectNext("1").verifyComplete();

        nanos.addAndGet(Duration.ofSeconds(31).toNanos());

        StepVerifier.create(store.get("blacklist:j1")).verifyComplete();
        StepVerifier.create(store.exists("blacklist:j1")).expectNext(false).verifyComplete();
    }

    @Test
    @DisplayName("should keep per-entry time-to-live")
    void shouldKeepPerEntryTtl() {
        store.set("short", "1", Duration.ofSeconds(5)).block();
        store.set("long", "1", Duration.ofMinutes(5)).block();

        nanos.addAndGet(Duration.ofSeconds(10).toNanos());

        StepVerifier.create(store.exists("short")).expectNext(false).verifyComplete();
        StepVerifier.create(store.exists("long")).expectNext(true).verifyComplete();
    }

    @Test
    @DisplayName("should not store entries with no time left")
    void shouldIgnoreNonPositiveTtl() {
        StepVerifier.create(store.set("k", "v", Duration.ZERO)).expectNext(false).verifyComplete();
        StepVerifier.create(store.exists("k")).expectNext(false).verifyComplete();
    }

    @Test
    @DisplayName("writing the same entry twice should be idempotent")
    void shouldBeIdempotent() {
        store.set("k", "v", Duration.ofMinutes(1)).block();
        store.set("k", "v", Duration.ofMinutes(1)).block();

        StepVerifier.create(store.get("k")).expectNext("v").verifyComplete();
    }

    @Test
    @DisplayName("counters should start at one and never expire")
    void shouldIncrementCounters() {
        StepVerifier.create(store.increment("policy:gen:acme")).expectNext(1L).verifyComplete();
        StepVerifier.create(store.increment("policy:gen:acme")).expectNext(2L).verifyComplete();

        nanos.addAndGet(Duration.ofDays(365).toNanos());

        StepVerifier.create(store.get("policy:gen:acme")).expectNext("2").verifyComplete();
    }

    @Test
    @DisplayName("should delete entries")
    void shouldDelete() {
        store.set("k", "v", Duration.ofMinutes(1)).block();

        StepVerifier.create(store.delete("k")).expectNext(true).verifyComplete();
        StepVerifier.create(store.delete("k")).expectNext(false).verifyComplete();
    }
}
