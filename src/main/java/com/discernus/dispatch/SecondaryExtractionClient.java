package com.discernus.dispatch;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discernus.gasket.MarkerProtocol;
import com.discernus.gasket.PayloadSchema;
import com.discernus.gasket.StructuredExtractionClient;

/** Routes gasket recovery calls to a small model through the dispatcher. */
public class SecondaryExtractionClient implements StructuredExtractionClient {
    private static final Logger log = LoggerFactory.getLogger(SecondaryExtractionClient.class);

    private final ModelDispatcher dispatcher;
    private final String modelId;

    public SecondaryExtractionClient(ModelDispatcher dispatcher, String modelId) {
        this.dispatcher = dispatcher;
        this.modelId = modelId;
    }

    @Override
    public Optional<String> extract(String rawText, PayloadSchema schema, MarkerProtocol protocol, CancellationToken cancellation) {
        String prompt = "The text below was meant to contain a JSON result but it could not be parsed.\n"
                + "Extract the intended JSON object without changing any values.\n\n"
                + protocol.instructions(schema)
                + "\n--- TEXT ---\n"
                + rawText;
        DispatchOutcome outcome = dispatcher.dispatch(modelId, ModelRequest.of(prompt), 1, cancellation);
        if (!outcome.isSuccess()) {
            log.warn("gasket.secondary.failed model={} class={} detail={}", modelId, outcome.failureClass(), outcome.detail());
            return Optional.empty();
        }
        return Optional.of(outcome.response().text());
    }
}
