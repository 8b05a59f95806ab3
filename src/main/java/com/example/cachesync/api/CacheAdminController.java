package com.example.cachesync.api;

import com.example.cachesync.coalesce.RemoteCallException;
import com.example.cachesync.core.CacheEntry;
import com.example.cachesync.core.CacheStats;
import com.example.cachesync.core.ReadOptions;
import com.example.cachesync.core.SyncEngine;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Diagnostics over HTTP. Application code uses {@link SyncEngine} directly.
 */
@RestController
@RequestMapping("/cache")
public class CacheAdminController {

    private final SyncEngine syncEngine;

    public CacheAdminController(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @GetMapping("/stats")
    public CacheStats getStats() {
        return syncEngine.stats();
    }

    /**
     * Read-through lookup: serves {@code key} from the cache or loads it with the remote
     * operation, passing the remaining query parameters to it.
     */
    @GetMapping("/items/{key}")
    public Object getItem(
        @PathVariable String key,
        @RequestParam String operation,
        @RequestParam(defaultValue = "false") boolean skipCache,
        @RequestParam Map<String, String> query
    ) {
        Map<String, String> params = new LinkedHashMap<>(query);
        params.remove("operation");
        params.remove("skipCache");
        return syncEngine.readRemote(key, operation, params, ReadOptions.defaults().withSkipCache(skipCache));
    }

    @GetMapping("/entries/{key}")
    public ResponseEntity<CacheEntry<Object>> getEntry(@PathVariable String key) {
        return syncEngine.peek(key)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/invalidate")
    public Map<String, Object> invalidate(@RequestBody List<String> keys) {
        syncEngine.invalidate(keys);
        return Map.of("invalidated", keys);
    }

    @DeleteMapping("/namespaces/{prefix}")
    public Map<String, Object> invalidateNamespace(@PathVariable String prefix) {
        return Map.of("invalidated", syncEngine.invalidateNamespace(prefix));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        syncEngine.clear();
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(RemoteCallException.class)
    public ResponseEntity<Map<String, Object>> handleRemoteCallFailure(RemoteCallException e) {
        HttpStatus status = e.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(Map.of(
            "error", String.valueOf(e.getMessage()),
            "signature", e.getSignature()
        ));
    }
}
