package com.fintech.marketcap.aggregation;

import com.fintech.marketcap.domain.SupplyRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known circulating supply per token. Entries older than the TTL are
 * treated as missing and removed by {@link #evictStale()}.
 */
public class SupplyCache {

    private final Map<String, SupplyRecord> records = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public SupplyCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /** Returns the supply if known and fresh. */
    public OptionalLong get(String tokenAddress) {
        SupplyRecord record = records.get(tokenAddress);
        if (record == null || record.isStale(clock.instant(), ttl)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(record.supply());
    }

    public void put(String tokenAddress, long supply) {
        records.put(tokenAddress, new SupplyRecord(supply, clock.instant()));
    }

    /** Stores the supply only when nothing fresh is cached for the token. */
    public void putIfAbsent(String tokenAddress, long supply) {
        Instant now = clock.instant();
        records.compute(tokenAddress, (token, existing) ->
            existing == null || existing.isStale(now, ttl) ? new SupplyRecord(supply, now) : existing);
    }

    public void remove(String tokenAddress) {
        records.remove(tokenAddress);
    }

    /** @return number of stale records removed */
    public int evictStale() {
        Instant now = clock.instant();
        int before = records.size();
        records.values().removeIf(record -> record.isStale(now, ttl));
        return Math.max(0, before - records.size());
    }

    public int size() {
        return records.size();
    }

    public Duration ttl() {
        return ttl;
    }
}
