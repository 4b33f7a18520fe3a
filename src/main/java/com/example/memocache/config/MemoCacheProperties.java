package com.example.memocache.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * {@code memocache.*} settings.
 */
@Validated
@ConfigurationProperties(prefix = "memocache")
public class MemoCacheProperties {

    /** Maximum resident entries. */
    @Min(1)
    private int capacity = 10_000;

    /** Time-to-live from insertion; unset disables expiry. */
    private Duration ttl = Duration.ofSeconds(60);

    /** How long a request waits on another request's in-flight computation. */
    @NotNull
    private Duration joinTimeout = Duration.ofSeconds(5);

    /** Delay between background sweeps of expired entries. */
    @NotNull
    private Duration sweepInterval = Duration.ofSeconds(30);

    /** Simulated latency of the mock backend. */
    @NotNull
    private Duration backendLatency = Duration.ofMillis(500);

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getJoinTimeout() {
        return joinTimeout;
    }

    public void setJoinTimeout(Duration joinTimeout) {
        this.joinTimeout = joinTimeout;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getBackendLatency() {
        return backendLatency;
    }

    public void setBackendLatency(Duration backendLatency) {
        this.backendLatency = backendLatency;
    }
}
