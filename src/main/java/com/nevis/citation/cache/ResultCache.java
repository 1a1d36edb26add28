package com.nevis.citation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-path memoization for citation artifacts.
 * <p>
 * Every invalidation bumps a generation counter. {@link #getOrLoad} only stores a loaded
 * value when no invalidation ran while the loader was executing, so a reader can never
 * put back data that predates a write which already returned to its caller.
 */
@Slf4j
@Component
public class ResultCache {

    private record Entry(Object value, long ttlNanos) {}

    private final Cache<String, Entry> cache;
    private final Duration defaultTtl;
    private final AtomicLong generation = new AtomicLong();
    private final Object writeLock = new Object();

    public ResultCache(
        @Value("${app.cache.default-ttl:5m}") Duration defaultTtl,
        @Value("${app.cache.maximum-size:10000}") long maximumSize
    ) {
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttlNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttlNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        return lookup(key).map(type::cast);
    }

    public void set(CacheKey key, Object value) {
        set(key, value, defaultTtl);
    }

    public void set(CacheKey key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        Duration effective = ttl == null ? defaultTtl : ttl;
        synchronized (writeLock) {
            cache.put(key.asString(), new Entry(value, effective.toNanos()));
        }
    }

    public <T> T getOrLoad(CacheKey key, Class<T> type, Supplier<T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }

        long observed = generation.get();
        T value = loader.get();
        fill(key, observed, value);
        return value;
    }

    public <E> List<E> getListOrLoad(CacheKey key, Class<E> elementType, Supplier<List<E>> loader) {
        Optional<List<E>> cached = lookup(key)
            .map(value -> ((List<?>) value).stream().map(elementType::cast).toList());
        if (cached.isPresent()) {
            return cached.get();
        }

        long observed = generation.get();
        List<E> value = loader.get();
        fill(key, observed, value);
        return value;
    }

    private Optional<Object> lookup(CacheKey key) {
        Entry entry = cache.getIfPresent(key.asString());
        if (entry == null) {
            log.debug("Cache miss {}", key.asString());
            return Optional.empty();
        }
        log.debug("Cache hit {}", key.asString());
        return Optional.of(entry.value());
    }

    private void fill(CacheKey key, long observedGeneration, Object value) {
        if (value == null) {
            return;
        }
        synchronized (writeLock) {
            if (generation.get() == observedGeneration) {
                cache.put(key.asString(), new Entry(value, defaultTtl.toNanos()));
            } else {
                log.debug("Skipping cache fill for {}: invalidated during load", key.asString());
            }
        }
    }

    /**
     * Drops every entry whose key matches the pattern. Returns the number of entries removed.
     */
    public int invalidate(String keyPattern) {
        KeyPattern pattern = KeyPattern.compile(keyPattern);
        synchronized (writeLock) {
            generation.incrementAndGet();
            List<String> doomed = cache.asMap().keySet().stream()
                .filter(pattern::matches)
                .toList();
            cache.invalidateAll(doomed);
            log.debug("Invalidated {} cache entries for pattern {}", doomed.size(), keyPattern);
            return doomed.size();
        }
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
