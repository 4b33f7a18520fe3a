package com.example.memocache.config;

import com.example.memocache.clock.ClockSource;
import com.example.memocache.core.MemoizingEngine;
import com.example.memocache.key.ArgumentKeyCodec;
import com.example.memocache.key.CacheKey;
import com.example.memocache.key.KeyCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the single engine instance shared by every call site.
 */
@Configuration
public class MemoCacheConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MemoCacheConfiguration.class);

    @Bean
    public ClockSource clockSource() {
        return ClockSource.system();
    }

    @Bean
    public KeyCodec keyCodec() {
        return new ArgumentKeyCodec();
    }

    @Bean
    public MemoizingEngine<CacheKey, Object> memoizingEngine(MemoCacheProperties properties, ClockSource clock) {
        MemoizingEngine<CacheKey, Object> engine =
            new MemoizingEngine<>(properties.getCapacity(), properties.getTtl(), clock);
        log.info("[MemoCache] Engine ready: capacity={}, ttl={}, sweepInterval={}", engine.capacity(),
            engine.ttl().map(Object::toString).orElse("none"), properties.getSweepInterval());
        return engine;
    }
}
