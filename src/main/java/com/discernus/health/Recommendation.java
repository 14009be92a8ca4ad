package com.discernus.health;

public record Recommendation(Action action, String modelId, ModelDescriptor substitute, String reason) {

    public enum Action {
        PROCEED,
        SUBSTITUTE,
        CANCEL
    }

    public static Recommendation proceed(String modelId) {
        return new Recommendation(Action.PROCEED, modelId, null, "");
    }

    public static Recommendation substitute(String modelId, ModelDescriptor substitute, String reason) {
        return new Recommendation(Action.SUBSTITUTE, modelId, substitute, reason);
    }

    public static Recommendation cancel(String modelId, String reason) {
        return new Recommendation(Action.CANCEL, modelId, null, reason);
    }
}
