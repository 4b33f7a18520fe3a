package com.example.memocache.clock;

public final class SystemClockSource implements ClockSource {

    static final SystemClockSource INSTANCE = new SystemClockSource();

    private SystemClockSource() {
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public String toString() {
        return "SystemClockSource";
    }
}
