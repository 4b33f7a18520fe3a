package com.example.memocache.backend;

import com.example.memocache.config.MemoCacheProperties;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stands in for an expensive keyed computation: sleeps, counts its invocations and can be
 * switched into a failing mode.
 */
@Component
public class MockBackend {

    private static final Logger log = LoggerFactory.getLogger(MockBackend.class);

    private final AtomicLong requestCount = new AtomicLong();
    private volatile long latencyMillis;
    private volatile boolean failing;

    public MockBackend(MemoCacheProperties properties) {
        this.latencyMillis = properties.getBackendLatency().toMillis();
    }

    // Simulates a slow backend fetch
    public String fetchFromBackend(String key) throws InterruptedException {
        requestCount.incrementAndGet();
        if (latencyMillis > 0) {
            Thread.sleep(latencyMillis);
        }
        if (failing) {
            log.debug("[MockBackend] Failing fetch for key: {}", key);
            throw new BackendUnavailableException("backend unavailable for key " + key);
        }
        return "value-for-" + key;
    }

    public void setLatencyMillis(long ms) {
        this.latencyMillis = ms;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public boolean isFailing() {
        return failing;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }
}
