package com.fintech.marketcap.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached circulating supply of a token.
 *
 * @param supply Circulating supply (raw token units)
 * @param refreshedAt When the value was last confirmed
 */
public record SupplyRecord(long supply, Instant refreshedAt) {

    /** Returns true once the record is older than {@code ttl} at {@code now}. */
    public boolean isStale(Instant now, Duration ttl) {
        return refreshedAt.plus(ttl).isBefore(now);
    }
}
