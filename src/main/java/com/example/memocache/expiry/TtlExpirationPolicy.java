package com.example.memocache.expiry;

import com.example.memocache.core.CacheConfigException;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Fixed time-to-live measured from insertion. Reads never extend an entry's lifetime.
 */
public final class TtlExpirationPolicy implements ExpirationPolicy {

    private static final TtlExpirationPolicy NONE = new TtlExpirationPolicy(null);

    private final Duration ttl;

    private TtlExpirationPolicy(Duration ttl) {
        this.ttl = ttl;
    }

    /**
     * @param ttl time-to-live, or {@code null} to disable expiry
     * @throws CacheConfigException if {@code ttl} is zero or negative
     */
    public static TtlExpirationPolicy of(Duration ttl) {
        if (ttl == null) {
            return NONE;
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new CacheConfigException("ttl must be positive, was " + ttl);
        }
        return new TtlExpirationPolicy(ttl);
    }

    public static TtlExpirationPolicy none() {
        return NONE;
    }

    public Optional<Duration> ttl() {
        return Optional.ofNullable(ttl);
    }

    @Override
    public OptionalLong expiresAt(long insertedAt) {
        if (ttl == null) {
            return OptionalLong.empty();
        }
        long ttlNanos;
        try {
            ttlNanos = ttl.toNanos();
        } catch (ArithmeticException e) {
            // longer than ~292 years
            return OptionalLong.empty();
        }
        return OptionalLong.of(insertedAt + ttlNanos);
    }

    @Override
    public String toString() {
        return ttl == null ? "TtlExpirationPolicy[none]" : "TtlExpirationPolicy[" + ttl + "]";
    }
}
