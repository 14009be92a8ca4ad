package com.discernus.health;

public record RateLimits(Integer tokensPerMinute, Integer requestsPerMinute) {
    public RateLimits {
        if (tokensPerMinute == null && requestsPerMinute == null) {
            throw new IllegalArgumentException("Fixed rate limits need tokensPerMinute or requestsPerMinute");
        }
        if ((tokensPerMinute != null && tokensPerMinute <= 0) || (requestsPerMinute != null && requestsPerMinute <= 0)) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
    }
}
