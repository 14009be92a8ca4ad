package com.discernus.gasket;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discernus.dispatch.CancellationToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Pulls a structured payload out of free-form model output.
 * <p>
 * The primary path reads the interior of the marker pair strictly, then tries a
 * truncation repair of that interior. When markers are missing, unbalanced or
 * rejected, or the interior still does not parse or validate, a lenient heuristic parse runs over balanced-brace substrings and a
 * repaired copy of a truncated tail. If that fails too, the
 * {@link StructuredExtractionClient} is asked to re-extract. Each path reports a
 * distinct {@link ExtractionOutcome}. Numbers are read as exact decimals.
 */
public class GasketExtractor {
    private static final Logger log = LoggerFactory.getLogger(GasketExtractor.class);

    private final MarkerProtocol protocol;
    private final MultipleBlockPolicy multipleBlockPolicy;
    private final StructuredExtractionClient secondaryClient;
    private final ObjectMapper strictMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .build();
    private final ObjectMapper lenientMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .build();

    public GasketExtractor() {
        this(MarkerProtocol.DEFAULT, MultipleBlockPolicy.LAST, StructuredExtractionClient.NONE);
    }

    public GasketExtractor(MarkerProtocol protocol, MultipleBlockPolicy multipleBlockPolicy, StructuredExtractionClient secondaryClient) {
        this.protocol = protocol;
        this.multipleBlockPolicy = multipleBlockPolicy;
        this.secondaryClient = secondaryClient == null ? StructuredExtractionClient.NONE : secondaryClient;
    }

    public MarkerProtocol protocol() {
        return protocol;
    }

    public ExtractionResult extract(String rawText, PayloadSchema schema) {
        return extract(rawText, schema, new CancellationToken());
    }

    /**
     * Extracts a payload, handing {@code cancellation} to the secondary call.
     *
     * @throws java.util.concurrent.CancellationException if cancelled before or during the secondary call
     */
    public ExtractionResult extract(String rawText, PayloadSchema schema, CancellationToken cancellation) {
        if (rawText == null || rawText.isBlank()) {
            log.warn("gasket.failed schema={} reason=empty-response", schema.name());
            return ExtractionResult.failure(ExtractionOutcome.failed(ExtractionOutcome.FailureKind.MALFORMED, "empty response"), "");
        }
        Attempts attempts = new Attempts();
        ExtractionResult local = extractLocally(rawText, schema, attempts);
        if (local != null) {
            return local;
        }

        cancellation.throwIfCancelled();
        Optional<String> secondary = secondaryClient.extract(rawText, schema, protocol, cancellation);
        if (secondary.isPresent()) {
            Attempts secondaryAttempts = new Attempts();
            ExtractionResult recovered = extractLocally(secondary.get(), schema, secondaryAttempts);
            if (recovered != null) {
                log.info("gasket.recovered path=secondary-call schema={} localFailures={}", schema.name(), attempts.summary());
                return ExtractionResult.success(recovered.payload(),
                        ExtractionOutcome.recoveredViaSecondaryCall("local parse failed: " + attempts.summary()));
            }
            attempts.absorb(secondaryAttempts);
        }
        return failure(rawText, schema, attempts);
    }

    private ExtractionResult failure(String rawText, PayloadSchema schema, Attempts attempts) {
        if (attempts.schemaViolation != null) {
            log.warn("gasket.failed schema={} kind=schema-violation reason={}", schema.name(), attempts.summary());
            return ExtractionResult.failure(
                    ExtractionOutcome.failed(ExtractionOutcome.FailureKind.SCHEMA_VIOLATION, attempts.schemaViolationReason),
                    attempts.schemaViolation);
        }
        log.warn("gasket.failed schema={} kind=malformed reason={}", schema.name(), attempts.summary());
        return ExtractionResult.failure(
                ExtractionOutcome.failed(ExtractionOutcome.FailureKind.MALFORMED, attempts.summary()),
                rawText);
    }

    private ExtractionResult extractLocally(String text, PayloadSchema schema, Attempts attempts) {
        MarkerScan scan = scan(text);
        String interior = selectBlock(scan, attempts);
        if (interior != null) {
            String body = JsonCandidates.stripCodeFence(interior);
            JsonNode node = parse(strictMapper, body, schema, attempts, "marker-interior");
            if (node != null) {
                if (scan.blocks.size() > 1) {
                    log.info("gasket.multiple-blocks schema={} count={} policy={}", schema.name(), scan.blocks.size(), multipleBlockPolicy);
                }
                return ExtractionResult.success(node, ExtractionOutcome.clean());
            }
            String repaired = JsonCandidates.repairTruncated(body);
            if (repaired != null) {
                JsonNode recovered = parse(lenientMapper, repaired, schema, attempts, "interior-repair");
                if (recovered != null) {
                    log.info("gasket.recovered path=interior-repair schema={} primaryFailures={}", schema.name(), attempts.summary());
                    return ExtractionResult.success(recovered, ExtractionOutcome.recoveredViaFallback(attempts.summary()));
                }
            }
        }

        String searchable = text.replace(protocol.startMarker(), "\n").replace(protocol.endMarker(), "\n");
        for (String candidate : JsonCandidates.find(JsonCandidates.stripCodeFence(searchable))) {
            JsonNode node = parse(lenientMapper, candidate, schema, attempts, "heuristic");
            if (node != null) {
                log.info("gasket.recovered path=heuristic schema={} primaryFailures={}", schema.name(), attempts.summary());
                return ExtractionResult.success(node, ExtractionOutcome.recoveredViaFallback(attempts.summary()));
            }
        }
        attempts.note("heuristic: no candidate satisfied schema");
        return null;
    }

    private String selectBlock(MarkerScan scan, Attempts attempts) {
        if (scan.unbalanced) {
            attempts.note("markers unbalanced");
        }
        if (scan.blocks.isEmpty()) {
            attempts.note("markers absent");
            return null;
        }
        if (scan.blocks.size() == 1) {
            return scan.blocks.get(0);
        }
        return switch (multipleBlockPolicy) {
            case LAST -> scan.blocks.get(scan.blocks.size() - 1);
            case FIRST -> scan.blocks.get(0);
            case REJECT -> {
                attempts.note("multiple marker blocks rejected (" + scan.blocks.size() + ")");
                yield null;
            }
        };
    }

    private JsonNode parse(ObjectMapper mapper, String text, PayloadSchema schema, Attempts attempts, String path) {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            attempts.note(path + ": " + e.getOriginalMessage());
            return null;
        }
        if (node == null || node.isMissingNode()) {
            attempts.note(path + ": no JSON value");
            return null;
        }
        if (schema.requiresObject() && !node.isObject()) {
            attempts.note(path + ": expected JSON object");
            return null;
        }
        List<String> missing = schema.missingFields(node);
        if (!missing.isEmpty()) {
            attempts.schemaViolation(path + ": missing required fields " + missing, text);
            return null;
        }
        return node;
    }

    private MarkerScan scan(String text) {
        String start = protocol.startMarker();
        String end = protocol.endMarker();
        List<String> blocks = new ArrayList<>();
        boolean unbalanced = false;
        int cursor = 0;
        while (true) {
            int open = text.indexOf(start, cursor);
            if (open < 0) {
                if (text.indexOf(end, cursor) >= 0) {
                    unbalanced = true;
                }
                break;
            }
            int contentStart = open + start.length();
            int close = text.indexOf(end, contentStart);
            if (close < 0) {
                unbalanced = true;
                break;
            }
            int nestedOpen = text.indexOf(start, contentStart);
            if (nestedOpen >= 0 && nestedOpen < close) {
                // restart at the inner marker: the outer one was never closed
                unbalanced = true;
                cursor = nestedOpen;
                continue;
            }
            blocks.add(text.substring(contentStart, close));
            cursor = close + end.length();
        }
        return new MarkerScan(blocks, unbalanced);
    }

    private record MarkerScan(List<String> blocks, boolean unbalanced) {
    }

    private static final class Attempts {
        private final List<String> notes = new ArrayList<>();
        private String schemaViolation;
        private String schemaViolationReason;

        void note(String message) {
            notes.add(message);
        }

        void schemaViolation(String reason, String payload) {
            notes.add(reason);
            if (schemaViolation == null || payload.length() > schemaViolation.length()) {
                schemaViolation = payload;
                schemaViolationReason = reason;
            }
        }

        void absorb(Attempts other) {
            for (String note : other.notes) {
                notes.add("secondary " + note);
            }
            if (other.schemaViolation != null && schemaViolation == null) {
                schemaViolation = other.schemaViolation;
                schemaViolationReason = "secondary " + other.schemaViolationReason;
            }
        }

        String summary() {
            return notes.isEmpty() ? "none" : String.join("; ", notes);
        }
    }
}
