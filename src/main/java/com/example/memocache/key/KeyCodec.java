package com.example.memocache.key;

/**
 * Derives a canonical cache key from the arguments of a memoized call.
 * <p>
 * Implementations are pure: the same logical arguments always produce equal keys, and
 * nothing is cached or mutated when encoding fails.
 */
public interface KeyCodec {

    /**
     * @param args the call's arguments, in call order
     * @return a key whose {@code equals}/{@code hashCode} identify the argument tuple
     * @throws UnencodableArgumentException if an argument has no stable value representation
     */
    CacheKey encode(Object... args);
}
