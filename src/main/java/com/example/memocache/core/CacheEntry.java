package com.example.memocache.core;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * A resident cache value. Timestamps are clock readings in nanoseconds.
 */
public final class CacheEntry<K, V> {

    private final K key;
    private final V value;
    private final long insertedAt;
    private final boolean expires;
    private final long expiresAt;

    private CacheEntry(K key, V value, long insertedAt, boolean expires, long expiresAt) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
        this.insertedAt = insertedAt;
        this.expires = expires;
        this.expiresAt = expiresAt;
    }

    public static <K, V> CacheEntry<K, V> of(K key, V value, long insertedAt, OptionalLong expiresAt) {
        return expiresAt.isPresent()
            ? new CacheEntry<>(key, value, insertedAt, true, expiresAt.getAsLong())
            : new CacheEntry<>(key, value, insertedAt, false, 0L);
    }

    public K key() {
        return key;
    }

    public V value() {
        return value;
    }

    public long insertedAt() {
        return insertedAt;
    }

    public OptionalLong expiresAt() {
        return expires ? OptionalLong.of(expiresAt) : OptionalLong.empty();
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", insertedAt=" + insertedAt
            + (expires ? ", expiresAt=" + expiresAt : "") + "}";
    }
}
