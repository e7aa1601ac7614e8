package com.example.gatekeeper.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Hit, miss and eviction counters for the role permission cache and the policy decision cache.
 */
@Slf4j
@Service
public class CacheMetricsService {

    private static final String METRIC_PREFIX = "gatekeeper.cache";
    private static final String TAG_CACHE_NAME = "cache";
    private static final String TAG_CACHE_TYPE = "type";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public CacheMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("Cache metrics service initialized");
    }

    public void recordHit(String cacheName, String cacheType) {
        counter("hits", "Number of cache hits", cacheName, cacheType).increment();
    }

    public void recordMiss(String cacheName, String cacheType) {
        counter("misses", "Number of cache misses", cacheName, cacheType).increment();
    }

    public void recordEviction(String cacheName, String cacheType) {
        counter("evictions", "Number of explicit cache invalidations", cacheName, cacheType).increment();
    }

    /**
     * hits / (hits + misses), or 0 before any lookup.
     */
    public double getHitRate(String cacheName, String cacheType) {
        Counter hits = counters.get(key("hits", cacheName, cacheType));
        Counter misses = counters.get(key("misses", cacheName, cacheType));
        double hitCount = hits != null ? hits.count() : 0.0;
        double missCount = misses != null ? misses.count() : 0.0;
        double total = hitCount + missCount;
        return total > 0 ? hitCount / total : 0.0;
    }

    private Counter counter(String metric, String description, String cacheName, String cacheType) {
        return counters.computeIfAbsent(key(metric, cacheName, cacheType), k ->
                Counter.builder(METRIC_PREFIX + "." + metric)
                        .description(description)
                        .tags(TAG_CACHE_NAME, cacheName, TAG_CACHE_TYPE, cacheType)
                        .register(meterRegistry));
    }

    private static String key(String metric, String cacheName, String cacheType) {
        return metric + ":" + cacheName + ":" + cacheType;
    }
}
