package com.nevis.citation.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute plus tokens-per-minute limiter. Blocks the calling thread until both
 * buckets have capacity.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tokenBuckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final int tokensPerMinute;

    public InMemoryDualRateLimiter(int requestsPerMinute, int tokensPerMinute) {
        if (requestsPerMinute <= 0 || tokensPerMinute <= 0) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.tokensPerMinute = tokensPerMinute;
    }

    private static Bucket perMinute(int capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(capacity, Refill.greedy(capacity, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public void acquire(String key, int tokens) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        Bucket tokenBucket = tokenBuckets.computeIfAbsent(key, k -> perMinute(tokensPerMinute));

        // a single request may never ask for more than the whole minute budget
        long wanted = Math.max(1, Math.min(tokens, tokensPerMinute));
        try {
            requests.asBlocking().consume(1);
            tokenBucket.asBlocking().consume(wanted);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit " + key, e);
        }
    }
}
