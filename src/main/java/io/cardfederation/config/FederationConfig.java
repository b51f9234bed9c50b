package io.cardfederation.config;

import io.cardfederation.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static io.cardfederation.config.Constants.*;

/**
 * Configuration for the federation service.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class FederationConfig {

    private final String[] etcdEndpoints;
    private final String etcdNamespace;
    private final long etcdOperationTimeoutSeconds;
    private final String originUrl;
    private final String catalogUrl;
    private final boolean secureHashing;
    private final long connectTimeoutSeconds;
    private final long requestTimeoutSeconds;
    private final long taskIntervalSeconds;
    private final int pollPoolSize;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "FEDERATION_CONFIG_FILE";
    // Environment variable overriding the origin URL of this instance
    private static final String ORIGIN_URL_ENV_VAR = "FEDERATION_ORIGIN_URL";
    // Comma separated etcd endpoints
    private static final String ETCD_ENDPOINTS_ENV_VAR = "ETCD_ENDPOINTS";

    public FederationConfig() {
        this(null);
    }

    /**
     * Load configuration from the given classpath resource, or the default
     * lookup order when {@code classpathResource} is null.
     */
    public FederationConfig(String classpathResource) {
        ConfigModel config = loadYamlConfig(classpathResource);

        this.etcdEndpoints = parseEndpoints(config);
        this.etcdNamespace = parseNamespace(config);
        this.etcdOperationTimeoutSeconds = positiveOrDefault(
                config.getEtcd() != null ? config.getEtcd().getOperationTimeoutSeconds() : null,
                DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS);
        this.originUrl = parseOriginUrl(config);
        this.catalogUrl = parseCatalogUrl(config, originUrl);
        this.secureHashing = config.getFederation() != null
                && Boolean.TRUE.equals(config.getFederation().getSecureHashing());
        this.connectTimeoutSeconds = positiveOrDefault(
                config.getHttp() != null ? config.getHttp().getConnectTimeoutSeconds() : null,
                DEFAULT_CONNECT_TIMEOUT_SECONDS);
        this.requestTimeoutSeconds = positiveOrDefault(
                config.getHttp() != null ? config.getHttp().getRequestTimeoutSeconds() : null,
                DEFAULT_REQUEST_TIMEOUT_SECONDS);
        this.taskIntervalSeconds = positiveOrDefault(
                config.getTask() != null ? config.getTask().getIntervalSeconds() : null,
                DEFAULT_TASK_INTERVAL_SECONDS);
        this.pollPoolSize = (int) positiveOrDefault(
                config.getTask() != null && config.getTask().getPollPoolSize() != null
                        ? Long.valueOf(config.getTask().getPollPoolSize()) : null,
                DEFAULT_POLL_POOL_SIZE);

        log.info("Loaded federation config - origin: {}, etcd endpoints: {}, namespace: {}, task interval: {}s",
                originUrl, String.join(", ", etcdEndpoints), etcdNamespace, taskIntervalSeconds);
    }

    /**
     * Actor identity of this instance, used when constructing the sync engine.
     */
    public String getActorId() {
        return originUrl + ACTOR_SUFFIX;
    }

    private ConfigModel loadYamlConfig(String classpathResource) {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, loaderOptions);
        // application.yml also carries Spring keys (server, management) that are not part of this model
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = classpathResource == null ? System.getenv(EXTERNAL_CONFIG_ENV_VAR) : null;
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            String resource = classpathResource != null ? classpathResource : DEFAULT_CONFIG_FILE_CLASSPATH;
            log.info("Loading config from classpath: {}", resource);
            inputStream = getClass().getClassLoader().getResourceAsStream(resource);
            loadedFrom = "classpath (" + resource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", resource);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        List<String> fromEnv = EnvironmentUtils.getEnvList(ETCD_ENDPOINTS_ENV_VAR);
        if (!fromEnv.isEmpty()) {
            log.info("Using etcd endpoints from {}", ETCD_ENDPOINTS_ENV_VAR);
            return fromEnv.toArray(new String[0]);
        }
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
            List<String> endpoints = config.getEtcd().getEndpoints();
            if (!endpoints.isEmpty()) {
                return endpoints.toArray(new String[0]);
            }
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private String parseNamespace(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getNamespace() != null
                && !config.getEtcd().getNamespace().isBlank()) {
            return config.getEtcd().getNamespace().trim();
        }
        return DEFAULT_ETCD_NAMESPACE;
    }

    private String parseOriginUrl(ConfigModel config) {
        String configured = config.getFederation() != null ? config.getFederation().getOriginUrl() : null;
        if (configured == null || configured.isBlank()) {
            configured = DEFAULT_ORIGIN_URL;
        }
        return normalizeUrl(EnvironmentUtils.getEnv(ORIGIN_URL_ENV_VAR, configured));
    }

    private String parseCatalogUrl(ConfigModel config, String origin) {
        String configured = config.getFederation() != null ? config.getFederation().getCatalogUrl() : null;
        if (configured == null || configured.isBlank()) {
            return origin;
        }
        return normalizeUrl(configured);
    }

    private static long positiveOrDefault(Long value, long defaultValue) {
        return value != null && value > 0 ? value : defaultValue;
    }

    /**
     * Strip trailing slashes from a base URL.
     */
    public static String normalizeUrl(String url) {
        if (url == null) {
            return null;
        }
        return url.trim().replaceAll("/+$", "");
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Federation federation;
        private Http http;
        private Task task;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
        private String namespace;
        private Long operationTimeoutSeconds;
    }

    @Data
    public static class Federation {
        private String originUrl;
        private String catalogUrl;
        private Boolean secureHashing;
    }

    @Data
    public static class Http {
        private Long connectTimeoutSeconds;
        private Long requestTimeoutSeconds;
    }

    @Data
    public static class Task {
        private Long intervalSeconds;
        private Integer pollPoolSize;
    }
}
