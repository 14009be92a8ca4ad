package com.discernus.gasket;

public class ExtractionException extends RuntimeException {
    private final String schemaName;

    public ExtractionException(PayloadSchema schema, String reason) {
        super("Unable to extract payload for schema " + schema.name() + ": " + reason);
        this.schemaName = schema.name();
    }

    public String schemaName() {
        return schemaName;
    }
}
