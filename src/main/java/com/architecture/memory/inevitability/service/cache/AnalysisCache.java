package com.architecture.memory.inevitability.service.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Shared cache of derived results (solve results, MCS sets, classifications).
 *
 * <p>Recomputation is idempotent, so concurrent misses for the same key may both compute;
 * the last writer wins. Entries are scoped by SCM version and dropped when that version is
 * invalidated.
 */
@Component
@Slf4j
public class AnalysisCache {

    private final Map<CacheKey, Object> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        Object value = entries.get(key);
        if (value == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(type.cast(value));
    }

    public void put(CacheKey key, Object value) {
        entries.put(key, value);
    }

    /**
     * Returns the cached value or computes and stores it. The computation runs outside any
     * lock so long solver calls never block other keys.
     */
    public <T> T getOrCompute(CacheKey key, Class<T> type, Supplier<T> computation) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            log.debug("Cache hit for {} ({})", key.kind(), key.goalId());
            return cached.get();
        }
        T value = computation.get();
        put(key, value);
        return value;
    }

    public void evict(CacheKey key) {
        entries.remove(key);
    }

    public int evictIf(Predicate<CacheKey> predicate) {
        int before = entries.size();
        entries.keySet().removeIf(predicate);
        return before - entries.size();
    }

    /**
     * Drops entries of the given type whose value matches the predicate.
     */
    public <T> int evictValues(Class<T> type, Predicate<T> predicate) {
        int before = entries.size();
        entries.values().removeIf(value -> type.isInstance(value) && predicate.test(type.cast(value)));
        return before - entries.size();
    }

    /**
     * Drops every entry derived from the given SCM version.
     */
    public int invalidate(String scmVersion) {
        int removed = evictIf(key -> key.scmVersion().equals(scmVersion));
        if (removed > 0) {
            log.info("Invalidated {} cached results for SCM version {}", removed, scmVersion);
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }
}
