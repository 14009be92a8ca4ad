package com.discernus.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.discernus.gasket.PayloadSchema;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * A pipeline as written in its YAML file: seed inputs plus stages wired to them by
 * id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineDefinition {
    private String name = "pipeline";
    private List<SeedDefinition> seeds = new ArrayList<>();
    private List<StageDefinition> stages = new ArrayList<>();
    private Path baseDir = Path.of(".");

    public static PipelineDefinition load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        PipelineDefinition definition = mapper.readValue(path.toFile(), PipelineDefinition.class);
        Path parent = path.toAbsolutePath().getParent();
        definition.setBaseDir(parent == null ? Path.of(".") : parent);
        definition.validate();
        return definition;
    }

    /** Checks ids, references and acyclicity; throws {@link IllegalArgumentException} on the first problem. */
    public void validate() {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("Pipeline " + name + " declares no stages");
        }
        Set<String> ids = new HashSet<>();
        for (SeedDefinition seed : seeds) {
            requireId(seed.getId(), "seed");
            if (!ids.add(seed.getId())) {
                throw new IllegalArgumentException("Duplicate id: " + seed.getId());
            }
            boolean hasPath = seed.getPath() != null && !seed.getPath().isBlank();
            if (hasPath == (seed.getText() != null)) {
                throw new IllegalArgumentException("Seed " + seed.getId() + " needs exactly one of path or text");
            }
        }
        for (StageDefinition stage : stages) {
            requireId(stage.getId(), "stage");
            if (!ids.add(stage.getId())) {
                throw new IllegalArgumentException("Duplicate id: " + stage.getId());
            }
            if (stage.getModel() == null || stage.getModel().isBlank()) {
                throw new IllegalArgumentException("Stage " + stage.getId() + " needs a model");
            }
            if (stage.getPrompt() == null || stage.getPrompt().isBlank()) {
                throw new IllegalArgumentException("Stage " + stage.getId() + " needs a prompt");
            }
            if (stage.getMaxAttempts() != null && stage.getMaxAttempts() < 1) {
                throw new IllegalArgumentException("Stage " + stage.getId() + " maxAttempts must be >= 1");
            }
        }
        for (StageDefinition stage : stages) {
            for (String input : stage.getInputs()) {
                if (!ids.contains(input)) {
                    throw new IllegalArgumentException("Stage " + stage.getId() + " references unknown input " + input);
                }
            }
        }
        StageGraph.of(this);
    }

    private static void requireId(String id, String kind) {
        if (id == null || !id.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("Invalid " + kind + " id: " + id);
        }
    }

    public StageDefinition stage(String id) {
        for (StageDefinition stage : stages) {
            if (stage.getId().equals(id)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + id);
    }

    public boolean isSeed(String id) {
        for (SeedDefinition seed : seeds) {
            if (seed.getId().equals(id)) {
                return true;
            }
        }
        return false;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<SeedDefinition> getSeeds() {
        return seeds;
    }

    public void setSeeds(List<SeedDefinition> seeds) {
        this.seeds = seeds == null ? new ArrayList<>() : seeds;
    }

    public List<StageDefinition> getStages() {
        return stages;
    }

    public void setStages(List<StageDefinition> stages) {
        this.stages = stages == null ? new ArrayList<>() : stages;
    }

    @JsonIgnore
    public Path getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(Path baseDir) {
        this.baseDir = baseDir;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeedDefinition {
        private String id;
        private String path;
        private String text;

        public SeedDefinition() {
        }

        public SeedDefinition(String id, String path, String text) {
            this.id = id;
            this.path = path;
            this.text = text;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StageDefinition {
        private String id;
        private String model;
        private List<String> inputs = new ArrayList<>();
        private String prompt;
        private SchemaDefinition schema;
        private Map<String, Object> config = new LinkedHashMap<>();
        private Integer maxAttempts;
        private Integer maxTokens;
        private double temperature = 0.0;

        public StageDefinition() {
        }

        public StageDefinition(String id, String model, List<String> inputs, String prompt, SchemaDefinition schema) {
            this.id = id;
            this.model = model;
            setInputs(inputs);
            this.prompt = prompt;
            this.schema = schema;
        }

        public PayloadSchema declaredSchema() {
            if (schema == null) {
                return new PayloadSchema(id, List.of());
            }
            return new PayloadSchema(schema.getName() == null ? id : schema.getName(), schema.getRequiredFields());
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getInputs() {
            return inputs;
        }

        public void setInputs(List<String> inputs) {
            this.inputs = inputs == null ? new ArrayList<>() : new ArrayList<>(inputs);
        }

        public String getPrompt() {
            return prompt;
        }

        public void setPrompt(String prompt) {
            this.prompt = prompt;
        }

        public SchemaDefinition getSchema() {
            return schema;
        }

        public void setSchema(SchemaDefinition schema) {
            this.schema = schema;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public void setConfig(Map<String, Object> config) {
            this.config = config == null ? new LinkedHashMap<>() : config;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SchemaDefinition {
        private String name;
        private List<String> requiredFields = new ArrayList<>();

        public SchemaDefinition() {
        }

        public SchemaDefinition(String name, List<String> requiredFields) {
            this.name = name;
            setRequiredFields(requiredFields);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields == null ? new ArrayList<>() : new ArrayList<>(requiredFields);
        }
    }
}
