package com.example.memocache.clock;

/**
 * Source of "now" for TTL arithmetic.
 * <p>
 * Readings are in nanoseconds and must never decrease between calls. The origin is
 * arbitrary, so a reading is only meaningful relative to another reading from the
 * same source.
 */
@FunctionalInterface
public interface ClockSource {

    long nanoTime();

    static ClockSource system() {
        return SystemClockSource.INSTANCE;
    }
}
