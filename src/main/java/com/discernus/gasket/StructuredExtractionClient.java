package com.discernus.gasket;

import java.util.Optional;

import com.discernus.dispatch.CancellationToken;

/**
 * Last-resort recovery: a second, smaller model call whose only job is to pull a
 * JSON object matching {@code schema} out of free-form text. Returns the raw
 * response text, or empty when no answer could be obtained. Implementations stop
 * waiting once {@code cancellation} fires.
 */
@FunctionalInterface
public interface StructuredExtractionClient {
    StructuredExtractionClient NONE = (rawText, schema, protocol, cancellation) -> Optional.empty();

    Optional<String> extract(String rawText, PayloadSchema schema, MarkerProtocol protocol, CancellationToken cancellation);
}
