package com.example.memocache.expiry;

import com.example.memocache.core.CacheEntry;
import java.util.OptionalLong;

/**
 * Decides when entries stop being servable.
 */
public interface ExpirationPolicy {

    /**
     * @param insertedAt clock reading at which the entry is stored
     * @return the absolute expiry reading, or empty for an entry that never expires
     */
    OptionalLong expiresAt(long insertedAt);

    /**
     * Pure validity check: an entry without expiry is always valid, otherwise it is valid
     * strictly before its expiry reading.
     */
    default boolean isValid(CacheEntry<?, ?> entry, long now) {
        OptionalLong expiresAt = entry.expiresAt();
        // nanoTime-style comparison, safe across overflow
        return expiresAt.isEmpty() || now - expiresAt.getAsLong() < 0;
    }
}
