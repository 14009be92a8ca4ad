package com.discernus.dispatch;

public record ModelResponse(String text, int promptTokens, int completionTokens) {
    public ModelResponse {
        text = text == null ? "" : text;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
