package com.example.memocache.core;

/**
 * Point-in-time counters of a {@link MemoizingEngine}. A join counts as a miss.
 */
public record CacheStats(long hits, long misses, long evictions, long expirations, int size, int pending) {

    public long requests() {
        return hits + misses;
    }

    public double hitRate() {
        long requests = requests();
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
