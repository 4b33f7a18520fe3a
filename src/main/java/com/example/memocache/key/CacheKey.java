package com.example.memocache.key;

import java.util.List;

/**
 * Canonical key for a memoized call: a 64-bit fingerprint of the argument tuple plus
 * the canonicalized tuple itself.
 * <p>
 * The fingerprint only short-circuits comparisons. Equality is decided on the tuple,
 * so two different argument lists whose fingerprints collide are still distinct keys.
 */
public final class CacheKey {

    private final long fingerprint;
    private final List<Object> components;

    CacheKey(long fingerprint, List<Object> components) {
        this.fingerprint = fingerprint;
        this.components = components;
    }

    public long fingerprint() {
        return fingerprint;
    }

    /** Canonicalized arguments, immutable. */
    public List<Object> components() {
        return components;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        CacheKey other = (CacheKey) o;
        return fingerprint == other.fingerprint && components.equals(other.components);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(fingerprint);
    }

    @Override
    public String toString() {
        return String.format("CacheKey[%016x]%s", fingerprint, components);
    }
}
