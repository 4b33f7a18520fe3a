package com.example.memocache.loadgen;

import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Draws item keys with Zipfian popularity, optionally mixed with one-off scan keys that
 * never repeat. Samplers sharing one scan counter never repeat each other's scan keys.
 */
public class ZipfKeySampler {

    private final ZipfDistribution zipf;
    private final RandomGenerator random;
    private final double scanRatio;
    private final AtomicLong scanIndex;

    public ZipfKeySampler(int universeSize, double alpha, double scanRatio, long seed) {
        this(universeSize, alpha, scanRatio, seed, scanCounter(universeSize));
    }

    public ZipfKeySampler(int universeSize, double alpha, double scanRatio, long seed, AtomicLong scanIndex) {
        if (scanRatio < 0.0 || scanRatio > 1.0) {
            throw new IllegalArgumentException("scanRatio must be within [0, 1], was " + scanRatio);
        }
        this.random = new Well19937c(seed);
        this.zipf = new ZipfDistribution(new Well19937c(seed + 1), universeSize, alpha);
        this.scanRatio = scanRatio;
        this.scanIndex = scanIndex;
    }

    /** A scan counter starting outside the key universe. */
    public static AtomicLong scanCounter(int universeSize) {
        return new AtomicLong(universeSize + 10_000L);
    }

    /** Not thread-safe; give each worker its own sampler and share the scan counter. */
    public String next() {
        if (scanRatio > 0.0 && random.nextDouble() < scanRatio) {
            return "scan-" + scanIndex.getAndIncrement();
        }
        return "key-" + zipf.sample();
    }
}
