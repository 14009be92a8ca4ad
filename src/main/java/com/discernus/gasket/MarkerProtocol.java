package com.discernus.gasket;

/**
 * Versioned start/end sentinel pair wrapped around a structured payload, e.g.
 * {@code <<<DISCERNUS_PAYLOAD_V1>>> ... <<<END_DISCERNUS_PAYLOAD_V1>>>}.
 */
public record MarkerProtocol(String name, int version) {
    public static final MarkerProtocol DEFAULT = new MarkerProtocol("DISCERNUS_PAYLOAD", 1);

    public MarkerProtocol {
        if (name == null || !name.matches("[A-Z][A-Z0-9_]*")) {
            throw new IllegalArgumentException("Marker protocol name must be upper snake case: " + name);
        }
        if (version < 1) {
            throw new IllegalArgumentException("Marker protocol version must be >= 1");
        }
    }

    public String startMarker() {
        return "<<<" + name + "_V" + version + ">>>";
    }

    public String endMarker() {
        return "<<<END_" + name + "_V" + version + ">>>";
    }

    public String wrap(String payload) {
        return startMarker() + "\n" + payload + "\n" + endMarker();
    }

    public String instructions(PayloadSchema schema) {
        StringBuilder builder = new StringBuilder();
        builder.append("Return your result as a single JSON object for schema '")
                .append(schema.name())
                .append("'.");
        if (!schema.requiredFields().isEmpty()) {
            builder.append(" Required fields: ")
                    .append(String.join(", ", schema.requiredFields()))
                    .append('.');
        }
        builder.append("\nYour response MUST place the JSON between these markers, each on its own line:\n")
                .append(startMarker())
                .append('\n')
                .append("{ ... }\n")
                .append(endMarker())
                .append('\n');
        return builder.toString();
    }
}
