package com.example.memocache.core;

import java.time.Duration;

/**
 * A caller gave up waiting on another caller's in-flight computation.
 * <p>
 * Only the waiting caller sees this. The computation itself keeps running and still
 * populates the cache for everybody else.
 */
public class CacheTimeoutException extends RuntimeException {

    private final transient Object key;
    private final Duration waited;

    public CacheTimeoutException(Object key, Duration waited) {
        super("Timed out after " + waited + " waiting for in-flight computation of " + key);
        this.key = key;
        this.waited = waited;
    }

    public Object getKey() {
        return key;
    }

    public Duration getWaited() {
        return waited;
    }
}
