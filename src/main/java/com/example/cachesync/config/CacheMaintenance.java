package com.example.cachesync.config;

import com.example.cachesync.core.SyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic expiry sweep and durable snapshot.
 */
@Component
public class CacheMaintenance {

    private static final Logger log = LoggerFactory.getLogger(CacheMaintenance.class);

    private final SyncEngine syncEngine;

    public CacheMaintenance(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @Scheduled(fixedDelayString = "${cachesync.maintenance.sweep-interval-ms:60000}",
        initialDelayString = "${cachesync.maintenance.sweep-interval-ms:60000}")
    public void sweepExpired() {
        int swept = syncEngine.sweepExpired();
        if (swept > 0) {
            log.debug("Expiry sweep removed {} entries", swept);
        }
    }

    @Scheduled(fixedDelayString = "${cachesync.maintenance.snapshot-interval-ms:300000}",
        initialDelayString = "${cachesync.maintenance.snapshot-interval-ms:300000}")
    public void snapshot() {
        int saved = syncEngine.snapshot();
        log.debug("Periodic snapshot wrote {} durable entries", saved);
    }
}
