package com.example.memocache.eviction;

import com.example.memocache.core.CacheEntry;
import com.example.memocache.core.CacheStore;
import com.example.memocache.expiry.ExpirationPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Removes entries from a {@link CacheStore}: least recently used ones to honour capacity,
 * expired ones when they are found.
 * <p>
 * Holds no state; callers must hold whatever lock guards the store.
 */
public class Evictor {

    /**
     * Evicts from the LRU end until the store is within capacity.
     *
     * @return the evicted entries, least recently used first
     */
    public <K, V> List<CacheEntry<K, V>> enforceCapacity(CacheStore<K, V> store) {
        if (store.size() <= store.capacity()) {
            return Collections.emptyList();
        }
        List<CacheEntry<K, V>> evicted = new ArrayList<>(store.size() - store.capacity());
        while (store.size() > store.capacity()) {
            Optional<CacheEntry<K, V>> victim = store.evictLru();
            if (victim.isEmpty()) {
                break;
            }
            evicted.add(victim.get());
        }
        return evicted;
    }

    /**
     * Removes the entry for {@code key} if the policy says it is no longer valid.
     *
     * @return the removed entry; empty if the key was absent or its entry is still valid
     */
    public <K, V> Optional<CacheEntry<K, V>> reapIfExpired(
        CacheStore<K, V> store, K key, long now, ExpirationPolicy policy
    ) {
        Optional<CacheEntry<K, V>> entry = store.get(key);
        if (entry.isPresent() && !policy.isValid(entry.get(), now)) {
            return store.remove(key);
        }
        return Optional.empty();
    }

    /**
     * Full pass removing every expired entry.
     *
     * @return the removed entries
     */
    public <K, V> List<CacheEntry<K, V>> sweepExpired(CacheStore<K, V> store, long now, ExpirationPolicy policy) {
        List<CacheEntry<K, V>> expired = new ArrayList<>();
        for (CacheEntry<K, V> entry : store.entries()) {
            if (!policy.isValid(entry, now)) {
                store.remove(entry.key());
                expired.add(entry);
            }
        }
        return expired;
    }
}
