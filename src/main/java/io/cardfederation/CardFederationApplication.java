package io.cardfederation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.cardfederation.adapters.PlatformAdapterFactory;
import io.cardfederation.catalog.HttpLocalCardCatalog;
import io.cardfederation.catalog.LocalCardCatalog;
import io.cardfederation.config.FederationConfig;
import io.cardfederation.federation.FederationService;
import io.cardfederation.http.FederationHttpClient;
import io.cardfederation.metrics.MetricsProvider;
import io.cardfederation.reconciliation.ReconciliationPoller;
import io.cardfederation.store.EtcdSettingsStore;
import io.cardfederation.store.EtcdSyncStateStore;
import io.cardfederation.store.SettingsStore;
import io.cardfederation.store.SyncStateStore;
import io.cardfederation.store.SyncStateUpdater;
import io.cardfederation.sync.AdapterCallExecutor;
import io.cardfederation.sync.VersionHasher;
import io.cardfederation.tasks.SyncTaskManager;
import io.cardfederation.tasks.TaskContext;
import io.cardfederation.tasks.impl.PollPlatformsTask;
import io.cardfederation.tasks.impl.ProbeConnectionsTask;
import io.cardfederation.util.JsonUtils;
import io.etcd.jetcd.Client;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;

/**
 * Main Spring Boot application class of the card federation service.
 *
 * Wires the federation subsystem explicitly: etcd-backed stores, the HTTP adapters, the sync
 * engine owned by {@link FederationService}, the reconciliation poller and the background
 * task manager. There is exactly one FederationService per process, created here.
 */
@Slf4j
@SpringBootApplication
public class CardFederationApplication {

    public static void main(String[] args) {
        log.info("Starting Card Federation Application");

        try {
            SpringApplication.run(CardFederationApplication.class, args);
            log.info("Card Federation Application started successfully");
        } catch (Exception e) {
            log.error("Failed to start Card Federation Application: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public FederationConfig config() {
        FederationConfig config = new FederationConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonUtils.createObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public Client etcdClient(FederationConfig config) {
        log.info("Connecting to etcd at {}", String.join(", ", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public SyncStateStore syncStateStore(Client etcdClient, FederationConfig config, ObjectMapper objectMapper) {
        return new EtcdSyncStateStore(etcdClient, config.getEtcdNamespace(), objectMapper,
                config.getEtcdOperationTimeoutSeconds());
    }

    @Bean
    public SettingsStore settingsStore(Client etcdClient, FederationConfig config, ObjectMapper objectMapper) {
        return new EtcdSettingsStore(etcdClient, config.getEtcdNamespace(), objectMapper,
                config.getEtcdOperationTimeoutSeconds());
    }

    @Bean
    public SyncStateUpdater syncStateUpdater(SyncStateStore syncStateStore) {
        return new SyncStateUpdater(syncStateStore);
    }

    @Bean
    public FederationHttpClient federationHttpClient(FederationConfig config, ObjectMapper objectMapper) {
        return new FederationHttpClient(
                Duration.ofSeconds(config.getConnectTimeoutSeconds()),
                Duration.ofSeconds(config.getRequestTimeoutSeconds()),
                objectMapper);
    }

    @Bean
    public LocalCardCatalog localCardCatalog(FederationConfig config, FederationHttpClient httpClient,
                                             ObjectMapper objectMapper) {
        log.info("Using local card catalog at {}", config.getCatalogUrl());
        return new HttpLocalCardCatalog(config.getCatalogUrl(), httpClient, objectMapper);
    }

    @Bean
    public PlatformAdapterFactory platformAdapterFactory(LocalCardCatalog catalog, FederationHttpClient httpClient) {
        return new PlatformAdapterFactory(catalog, httpClient);
    }

    @Bean(destroyMethod = "shutdown")
    public AdapterCallExecutor adapterCallExecutor(FederationConfig config) {
        // one extra second so the HTTP client's own timeout is what normally fires
        Duration timeout = Duration.ofSeconds(config.getRequestTimeoutSeconds() + 1);
        return new AdapterCallExecutor(
                Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                        .setNameFormat("adapter-call-%d").setDaemon(true).build()),
                timeout);
    }

    @Bean
    public VersionHasher versionHasher(ObjectMapper objectMapper, FederationConfig config) {
        return new VersionHasher(objectMapper, config.isSecureHashing());
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, FederationConfig config) {
        return new MetricsProvider(meterRegistry, config.getOriginUrl());
    }

    @Bean(destroyMethod = "shutdown")
    public ReconciliationPoller reconciliationPoller(SyncStateUpdater syncStateUpdater, LocalCardCatalog catalog,
                                                     PlatformAdapterFactory adapterFactory, FederationConfig config,
                                                     Clock clock, MetricsProvider metricsProvider) {
        log.info("Initializing ReconciliationPoller with {} workers", config.getPollPoolSize());
        return new ReconciliationPoller(syncStateUpdater, catalog, adapterFactory, config.getOriginUrl(),
                Executors.newFixedThreadPool(config.getPollPoolSize(), new ThreadFactoryBuilder()
                        .setNameFormat("federation-poll-%d").setDaemon(true).build()),
                clock, metricsProvider);
    }

    /**
     * The single FederationService of this process. Initialization is attempted at startup; when
     * etcd is not reachable yet, operations initialize lazily on first use.
     */
    @Bean
    public FederationService federationService(FederationConfig config, SettingsStore settingsStore,
                                               SyncStateUpdater syncStateUpdater,
                                               PlatformAdapterFactory adapterFactory, VersionHasher versionHasher,
                                               AdapterCallExecutor callExecutor, ReconciliationPoller poller,
                                               MetricsProvider metricsProvider, Clock clock) {
        FederationService service = new FederationService(config.getOriginUrl(), config.getActorId(),
                settingsStore, syncStateUpdater, adapterFactory, versionHasher, callExecutor, poller,
                metricsProvider, clock);
        try {
            service.initialize();
        } catch (RuntimeException e) {
            log.warn("Federation not initialized at startup, will retry on first use: {}", e.getMessage());
        }
        return service;
    }

    @Bean
    public TaskContext taskContext(FederationService federationService, Clock clock) {
        return new TaskContext(federationService, clock);
    }

    @Bean(destroyMethod = "stop")
    public SyncTaskManager syncTaskManager(TaskContext taskContext, FederationConfig config) {
        SyncTaskManager taskManager = new SyncTaskManager(taskContext,
                List.of(new ProbeConnectionsTask(), new PollPlatformsTask()),
                config.getTaskIntervalSeconds());
        taskManager.start();
        log.info("SyncTaskManager started with background processing every {}s", config.getTaskIntervalSeconds());
        return taskManager;
    }
}
