package com.example.cachesync.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code cachesync} prefix.
 *
 * <p>Namespace prefixes containing {@code :} must be bracketed in YAML map keys,
 * e.g. {@code "[chapters:book]"}.
 */
@ConfigurationProperties(prefix = "cachesync")
public class CacheSyncProperties {

    private Policy defaultPolicy = new Policy(Duration.ofMinutes(5), 100, false);
    private Map<String, Policy> namespaces = new LinkedHashMap<>();
    private Duration speculativeTtl = Duration.ofSeconds(5);
    private final Remote remote = new Remote();
    private final Persistence persistence = new Persistence();
    private final Stats stats = new Stats();

    public Policy getDefaultPolicy() {
        return defaultPolicy;
    }

    public void setDefaultPolicy(Policy defaultPolicy) {
        this.defaultPolicy = defaultPolicy;
    }

    public Map<String, Policy> getNamespaces() {
        return namespaces;
    }

    public void setNamespaces(Map<String, Policy> namespaces) {
        this.namespaces = namespaces;
    }

    public Duration getSpeculativeTtl() {
        return speculativeTtl;
    }

    public void setSpeculativeTtl(Duration speculativeTtl) {
        this.speculativeTtl = speculativeTtl;
    }

    public Remote getRemote() {
        return remote;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public Stats getStats() {
        return stats;
    }

    public static class Policy {

        private Duration ttl;
        private int maxSize;
        private boolean durable;
        private List<String> dependents = new ArrayList<>();

        public Policy() {
        }

        public Policy(Duration ttl, int maxSize, boolean durable) {
            this.ttl = ttl;
            this.maxSize = maxSize;
            this.durable = durable;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public List<String> getDependents() {
            return dependents;
        }

        public void setDependents(List<String> dependents) {
            this.dependents = dependents;
        }
    }

    public static class Remote {

        private String baseUrl = "http://localhost:8000/api";
        private Duration timeout = Duration.ofSeconds(10);
        private int poolSize = 64;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    public static class Persistence {

        /** When off, durable entries only survive in memory. */
        private boolean enabled = true;
        private Path directory = Path.of(System.getProperty("java.io.tmpdir"), "cachesync");

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Path getDirectory() {
            return directory;
        }

        public void setDirectory(Path directory) {
            this.directory = directory;
        }
    }

    public static class Stats {

        private int topKeys = 10;

        public int getTopKeys() {
            return topKeys;
        }

        public void setTopKeys(int topKeys) {
            this.topKeys = topKeys;
        }
    }
}
