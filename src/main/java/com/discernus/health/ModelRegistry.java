package com.discernus.health;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Ordered set of known models. Registry order breaks ties when choosing a
 * substitute.
 */
public class ModelRegistry {
    private final Map<String, ModelDescriptor> models;

    public ModelRegistry(List<ModelDescriptor> descriptors) {
        Map<String, ModelDescriptor> byId = new LinkedHashMap<>();
        for (ModelDescriptor descriptor : descriptors) {
            if (byId.putIfAbsent(descriptor.id(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate model id in registry: " + descriptor.id());
            }
        }
        this.models = Collections.unmodifiableMap(byId);
    }

    /** Reads a YAML (or JSON) registry document with a top-level {@code models} list. */
    public static ModelRegistry load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        RegistryDocument document = mapper.readValue(path.toFile(), RegistryDocument.class);
        return fromEntries(document.getModels());
    }

    public static ModelRegistry fromEntries(List<ModelEntry> entries) {
        List<ModelDescriptor> descriptors = new ArrayList<>();
        for (ModelEntry entry : entries) {
            descriptors.add(entry.toDescriptor());
        }
        return new ModelRegistry(descriptors);
    }

    public Optional<ModelDescriptor> find(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public ModelDescriptor require(String modelId) {
        ModelDescriptor descriptor = models.get(modelId);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown model: " + modelId);
        }
        return descriptor;
    }

    public List<ModelDescriptor> all() {
        return List.copyOf(models.values());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegistryDocument {
        private List<ModelEntry> models = new ArrayList<>();

        public List<ModelEntry> getModels() {
            return models;
        }

        public void setModels(List<ModelEntry> models) {
            this.models = models == null ? new ArrayList<>() : models;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelEntry {
        private String id;
        private String provider;
        private String capability;
        private Integer tpm;
        private Integer rpm;
        private QuotaClass quotaClass;
        private double inputPricePer1M;
        private double outputPricePer1M;
        private long timeoutMs = 120_000;

        ModelDescriptor toDescriptor() {
            boolean hasLimits = tpm != null || rpm != null;
            QuotaClass resolved = hasLimits ? QuotaClass.FIXED : QuotaClass.DYNAMIC_SHARED;
            if (quotaClass != null && quotaClass != resolved) {
                throw new IllegalArgumentException("Model " + id + " declares quotaClass " + quotaClass
                        + (hasLimits ? " but sets tpm/rpm" : " without tpm/rpm"));
            }
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Model " + id + " needs a positive timeoutMs");
            }
            return new ModelDescriptor(
                    id,
                    provider,
                    capability,
                    resolved,
                    hasLimits ? new RateLimits(tpm, rpm) : null,
                    inputPricePer1M,
                    outputPricePer1M,
                    Duration.ofMillis(timeoutMs));
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getCapability() {
            return capability;
        }

        public void setCapability(String capability) {
            this.capability = capability;
        }

        public Integer getTpm() {
            return tpm;
        }

        public void setTpm(Integer tpm) {
            this.tpm = tpm;
        }

        public Integer getRpm() {
            return rpm;
        }

        public void setRpm(Integer rpm) {
            this.rpm = rpm;
        }

        public QuotaClass getQuotaClass() {
            return quotaClass;
        }

        public void setQuotaClass(QuotaClass quotaClass) {
            this.quotaClass = quotaClass;
        }

        public double getInputPricePer1M() {
            return inputPricePer1M;
        }

        public void setInputPricePer1M(double inputPricePer1M) {
            this.inputPricePer1M = inputPricePer1M;
        }

        public double getOutputPricePer1M() {
            return outputPricePer1M;
        }

        public void setOutputPricePer1M(double outputPricePer1M) {
            this.outputPricePer1M = outputPricePer1M;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
