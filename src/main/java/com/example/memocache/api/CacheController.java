package com.example.memocache.api;

import com.example.memocache.backend.MockBackend;
import com.example.memocache.config.MemoCacheProperties;
import com.example.memocache.core.CacheStats;
import com.example.memocache.core.MemoizingEngine;
import com.example.memocache.key.CacheKey;
import com.example.memocache.key.KeyCodec;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CacheController {

    private static final String ITEM_NAMESPACE = "item";

    private final MemoizingEngine<CacheKey, Object> engine;
    private final KeyCodec keyCodec;
    private final MockBackend backend;
    private final Duration joinTimeout;

    public CacheController(
        MemoizingEngine<CacheKey, Object> engine,
        KeyCodec keyCodec,
        MockBackend backend,
        MemoCacheProperties properties
    ) {
        this.engine = engine;
        this.keyCodec = keyCodec;
        this.backend = backend;
        this.joinTimeout = properties.getJoinTimeout();
    }

    @GetMapping("/item")
    public Object getItem(@RequestParam String key) throws Exception {
        return engine.getOrCompute(itemKey(key), () -> backend.fetchFromBackend(key), joinTimeout);
    }

    @GetMapping("/peek")
    public ResponseEntity<Object> peekItem(@RequestParam String key) {
        return engine.peek(itemKey(key))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/item")
    public Map<String, Object> invalidateItem(@RequestParam String key) {
        return Map.of("key", key, "invalidated", engine.invalidate(itemKey(key)));
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = engine.stats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hits", stats.hits());
        body.put("misses", stats.misses());
        body.put("evictions", stats.evictions());
        body.put("expirations", stats.expirations());
        body.put("size", stats.size());
        body.put("pending", stats.pending());
        body.put("capacity", engine.capacity());
        body.put("backendRequests", backend.getRequestCount());
        return body;
    }

    @PostMapping("/reset")
    public void reset() {
        backend.resetCount();
        engine.clear();
    }

    @PostMapping("/config")
    public String configure(
        @RequestParam(required = false) Long latency,
        @RequestParam(required = false) Boolean failing
    ) {
        if (latency != null) {
            backend.setLatencyMillis(latency);
        }
        if (failing != null) {
            backend.setFailing(failing);
        }
        return "Backend latency=" + backend.getLatencyMillis() + ", failing=" + backend.isFailing();
    }

    private CacheKey itemKey(String key) {
        return keyCodec.encode(ITEM_NAMESPACE, key);
    }
}
