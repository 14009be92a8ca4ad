package com.discernus.dispatch;

public record ModelRequest(String prompt, Integer maxTokens, double temperature) {
    private static final int CHARS_PER_TOKEN = 4;

    public ModelRequest {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt is required");
        }
    }

    public static ModelRequest of(String prompt) {
        return new ModelRequest(prompt, null, 0.0);
    }

    /** Rough token estimate used for local admission before the real count is known. */
    public int estimatedTokens() {
        int promptTokens = (prompt.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
        return promptTokens + (maxTokens == null ? 0 : maxTokens);
    }
}
