package com.nevis.citation.infra;

public class InMemoryRpmRateLimiter implements RateLimiter {

    private final InMemoryDualRateLimiter delegate;

    public InMemoryRpmRateLimiter(int requestsPerMinute) {
        this.delegate = new InMemoryDualRateLimiter(requestsPerMinute, Integer.MAX_VALUE);
    }

    @Override
    public void acquire(String key, int permits) {
        delegate.acquire(key, 1);
    }
}
