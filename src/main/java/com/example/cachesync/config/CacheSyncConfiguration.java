package com.example.cachesync.config;

import com.example.cachesync.backend.HttpRemoteDataService;
import com.example.cachesync.backend.RemoteDataService;
import com.example.cachesync.coalesce.CallCoalescer;
import com.example.cachesync.coalesce.RemoteCallExecutor;
import com.example.cachesync.core.SyncEngine;
import com.example.cachesync.persistence.BlobStore;
import com.example.cachesync.persistence.FileBlobStore;
import com.example.cachesync.persistence.InMemoryBlobStore;
import com.example.cachesync.persistence.PersistenceAdapter;
import com.example.cachesync.policy.NamespacePolicy;
import com.example.cachesync.policy.NamespacePolicyTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CacheSyncProperties.class)
public class CacheSyncConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CacheSyncConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NamespacePolicyTable namespacePolicyTable(CacheSyncProperties properties) {
        CacheSyncProperties.Policy defaults = properties.getDefaultPolicy();
        NamespacePolicy defaultPolicy = new NamespacePolicy(NamespacePolicyTable.DEFAULT_NAMESPACE,
            defaults.getTtl(), defaults.getMaxSize(), defaults.isDurable(), defaults.getDependents());

        List<NamespacePolicy> policies = new ArrayList<>();
        for (Map.Entry<String, CacheSyncProperties.Policy> e : properties.getNamespaces().entrySet()) {
            CacheSyncProperties.Policy p = e.getValue();
            policies.add(new NamespacePolicy(e.getKey(), p.getTtl(), p.getMaxSize(), p.isDurable(), p.getDependents()));
        }
        NamespacePolicyTable table = new NamespacePolicyTable(defaultPolicy, policies);
        table.getPolicies().forEach(policy -> log.info("Cache namespace {}", policy));
        return table;
    }

    // Dedicated thread pool so remote calls never run on the common ForkJoinPool
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService remoteCallPool(CacheSyncProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getRemote().getPoolSize(), runnable -> {
            Thread thread = new Thread(runnable, "cachesync-remote-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public RemoteCallExecutor remoteCallExecutor(ExecutorService remoteCallPool, CacheSyncProperties properties) {
        return new RemoteCallExecutor(remoteCallPool, properties.getRemote().getTimeout());
    }

    @Bean
    public CallCoalescer callCoalescer(RemoteCallExecutor remoteCallExecutor) {
        return new CallCoalescer(remoteCallExecutor);
    }

    @Bean
    public BlobStore blobStore(CacheSyncProperties properties) {
        if (!properties.getPersistence().isEnabled()) {
            log.info("Cache persistence disabled, durable entries are kept in memory only");
            return new InMemoryBlobStore();
        }
        log.info("Cache persistence directory: {}", properties.getPersistence().getDirectory());
        return new FileBlobStore(properties.getPersistence().getDirectory());
    }

    @Bean
    public PersistenceAdapter persistenceAdapter(BlobStore blobStore, ObjectMapper objectMapper, Clock clock) {
        return new PersistenceAdapter(blobStore, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RemoteDataService remoteDataService(ObjectMapper objectMapper, CacheSyncProperties properties) {
        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(properties.getRemote().getTimeout())
            .build();
        return new HttpRemoteDataService(client, objectMapper, properties.getRemote().getBaseUrl(),
            properties.getRemote().getTimeout());
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public SyncEngine syncEngine(
        NamespacePolicyTable namespacePolicyTable,
        CallCoalescer callCoalescer,
        RemoteCallExecutor remoteCallExecutor,
        PersistenceAdapter persistenceAdapter,
        RemoteDataService remoteDataService,
        ObjectMapper objectMapper,
        Clock clock,
        CacheSyncProperties properties
    ) {
        return new SyncEngine(namespacePolicyTable, callCoalescer, remoteCallExecutor, persistenceAdapter,
            remoteDataService, objectMapper, clock, properties.getSpeculativeTtl(), properties.getStats().getTopKeys());
    }
}
