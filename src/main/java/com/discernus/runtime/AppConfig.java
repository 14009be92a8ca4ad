package com.discernus.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.discernus.gasket.MultipleBlockPolicy;
import com.discernus.health.ModelRegistry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EngineConfig engine = new EngineConfig();
    private RetryConfig retry = new RetryConfig();
    private HealthConfig health = new HealthConfig();
    private GasketConfig gasket = new GasketConfig();
    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    private String modelRegistryPath = "models.yml";
    private List<ModelRegistry.ModelEntry> models = new ArrayList<>();

    public EngineConfig getEngine() {
        return engine;
    }

    public void setEngine(EngineConfig engine) {
        this.engine = engine == null ? new EngineConfig() : engine;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry == null ? new RetryConfig() : retry;
    }

    public HealthConfig getHealth() {
        return health;
    }

    public void setHealth(HealthConfig health) {
        this.health = health == null ? new HealthConfig() : health;
    }

    public GasketConfig getGasket() {
        return gasket;
    }

    public void setGasket(GasketConfig gasket) {
        this.gasket = gasket == null ? new GasketConfig() : gasket;
    }

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public String getModelRegistryPath() {
        return modelRegistryPath;
    }

    public void setModelRegistryPath(String modelRegistryPath) {
        this.modelRegistryPath = modelRegistryPath;
    }

    /** Inline registry entries; when present they take precedence over {@code modelRegistryPath}. */
    public List<ModelRegistry.ModelEntry> getModels() {
        return models;
    }

    public void setModels(List<ModelRegistry.ModelEntry> models) {
        this.models = models == null ? new ArrayList<>() : models;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EngineConfig {
        private String storePath = ".discernus/store";
        private String ledgerPath = ".discernus/run-ledger.jsonl";
        private int workerThreads = 4;

        public String getStorePath() {
            return storePath;
        }

        public void setStorePath(String storePath) {
            this.storePath = storePath;
        }

        public String getLedgerPath() {
            return ledgerPath;
        }

        public void setLedgerPath(String ledgerPath) {
            this.ledgerPath = ledgerPath;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long baseBackoffMs = 1000;
        private long maxBackoffMs = 60000;
        private double jitterRatio = 0.2;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseBackoffMs() {
            return baseBackoffMs;
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = baseBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getJitterRatio() {
            return jitterRatio;
        }

        public void setJitterRatio(double jitterRatio) {
            this.jitterRatio = jitterRatio;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HealthConfig {
        private int degradedAfterFailures = 1;
        private int unavailableAfterFailures = 5;

        public int getDegradedAfterFailures() {
            return degradedAfterFailures;
        }

        public void setDegradedAfterFailures(int degradedAfterFailures) {
            this.degradedAfterFailures = degradedAfterFailures;
        }

        public int getUnavailableAfterFailures() {
            return unavailableAfterFailures;
        }

        public void setUnavailableAfterFailures(int unavailableAfterFailures) {
            this.unavailableAfterFailures = unavailableAfterFailures;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GasketConfig {
        private String protocolName = "DISCERNUS_PAYLOAD";
        private int protocolVersion = 1;
        private MultipleBlockPolicy multipleBlockPolicy = MultipleBlockPolicy.LAST;
        private String secondaryModel;

        public String getProtocolName() {
            return protocolName;
        }

        public void setProtocolName(String protocolName) {
            this.protocolName = protocolName;
        }

        public int getProtocolVersion() {
            return protocolVersion;
        }

        public void setProtocolVersion(int protocolVersion) {
            this.protocolVersion = protocolVersion;
        }

        public MultipleBlockPolicy getMultipleBlockPolicy() {
            return multipleBlockPolicy;
        }

        public void setMultipleBlockPolicy(MultipleBlockPolicy multipleBlockPolicy) {
            this.multipleBlockPolicy = multipleBlockPolicy == null ? MultipleBlockPolicy.LAST : multipleBlockPolicy;
        }

        public String getSecondaryModel() {
            return secondaryModel;
        }

        public void setSecondaryModel(String secondaryModel) {
            this.secondaryModel = secondaryModel;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderConfig {
        private String baseUrl;
        private String apiKeyEnv;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }
    }
}
