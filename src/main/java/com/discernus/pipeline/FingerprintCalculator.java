package com.discernus.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.discernus.gasket.MarkerProtocol;
import com.discernus.gasket.PayloadSchema;
import com.discernus.pipeline.PipelineDefinition.StageDefinition;
import com.discernus.store.Fingerprint;
import com.discernus.store.Hashing;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Hashes a stage id, its ordered input hashes and its canonical configuration.
 * Map keys are sorted at every level so equivalent YAML produces the same key.
 */
public class FingerprintCalculator {
    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public Fingerprint compute(StageDefinition stage, List<String> inputHashes, PayloadSchema schema, MarkerProtocol protocol) {
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("model", stage.getModel());
        configuration.put("prompt", stage.getPrompt());
        configuration.put("schema", Map.of("name", schema.name(), "requiredFields", schema.requiredFields()));
        configuration.put("protocol", protocol.name() + "_V" + protocol.version());
        configuration.put("maxTokens", stage.getMaxTokens());
        configuration.put("temperature", stage.getTemperature());
        configuration.put("config", stage.getConfig());

        Map<String, Object> material = new LinkedHashMap<>();
        material.put("stage", stage.getId());
        material.put("inputs", List.copyOf(inputHashes));
        material.put("configuration", configuration);
        try {
            return new Fingerprint(Hashing.sha256Hex(canonicalMapper.writeValueAsBytes(material)));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stage " + stage.getId() + " has a configuration that cannot be serialized", e);
        }
    }
}
