package com.discernus.gasket;

public class SchemaViolationException extends RuntimeException {
    private final String schemaName;
    private final String rawPayload;

    public SchemaViolationException(PayloadSchema schema, String reason, String rawPayload) {
        super("Payload violates schema " + schema.name() + ": " + reason);
        this.schemaName = schema.name();
        this.rawPayload = rawPayload;
    }

    public String schemaName() {
        return schemaName;
    }

    public String rawPayload() {
        return rawPayload;
    }
}
