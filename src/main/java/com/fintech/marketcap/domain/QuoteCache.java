package com.fintech.marketcap.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Cached swap quote with its own validity window, stored under
 * {@code quote:{input}:{output}:{amount}}.
 */
public record QuoteCache(
    JsonNode quote,
    @JsonProperty("cached_at") long cachedAt,
    @JsonProperty("expires_at") long expiresAt
) {

    public boolean isValidAt(long epochMillis) {
        return epochMillis < expiresAt;
    }
}
