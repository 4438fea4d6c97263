package com.fintech.marketcap.domain;

import java.util.Objects;

/**
 * Identifies one candle stream: a token at a timeframe.
 * Ordered by token, then timeframe width.
 */
public record AggregatorKey(
    String tokenAddress,
    Timeframe timeframe
) implements Comparable<AggregatorKey> {

    public AggregatorKey {
        Objects.requireNonNull(tokenAddress, "Token address cannot be null");
        Objects.requireNonNull(timeframe, "Timeframe cannot be null");
    }

    @Override
    public int compareTo(AggregatorKey other) {
        int tokenCompare = tokenAddress.compareTo(other.tokenAddress);
        if (tokenCompare != 0) {
            return tokenCompare;
        }
        return timeframe.compareTo(other.timeframe);
    }

    @Override
    public String toString() {
        return tokenAddress + ":" + timeframe.label();
    }
}
