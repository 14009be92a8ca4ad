package com.discernus.dispatch;

import com.discernus.health.ModelDescriptor;

/** One blocking completion call. Failures are thrown as {@link ModelCallException}. */
public interface ModelClient {
    ModelResponse complete(ModelDescriptor model, ModelRequest request);
}
