package com.example.memocache.config;

import com.example.memocache.core.MemoizingEngine;
import com.example.memocache.key.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired entries so they stop occupying capacity. Reads already treat
 * them as absent; this only reclaims space earlier.
 */
@Component
public class ExpiredEntrySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredEntrySweeper.class);

    private final MemoizingEngine<CacheKey, Object> engine;

    public ExpiredEntrySweeper(MemoizingEngine<CacheKey, Object> engine) {
        this.engine = engine;
    }

    @Scheduled(
        initialDelayString = "${memocache.sweep-interval:PT30S}",
        fixedDelayString = "${memocache.sweep-interval:PT30S}"
    )
    public int sweep() {
        int removed = engine.sweepExpired();
        if (removed > 0) {
            log.info("[MemoCache] Sweep removed {} expired entries, {} resident", removed, engine.stats().size());
        }
        return removed;
    }
}
