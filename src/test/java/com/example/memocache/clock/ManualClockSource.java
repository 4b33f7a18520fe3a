package com.example.memocache.clock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that only moves when told to.
 */
public class ManualClockSource implements ClockSource {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long nanoTime() {
        return nanos.get();
    }

    public void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /** Moves the clock to {@code millis} after its origin; never backwards. */
    public void setMillis(long millis) {
        long target = Duration.ofMillis(millis).toNanos();
        nanos.accumulateAndGet(target, Math::max);
    }
}
