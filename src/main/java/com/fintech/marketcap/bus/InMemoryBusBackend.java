package com.fintech.marketcap.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process fallback used when no broker is reachable.
 * Publishing dispatches synchronously on the caller's thread, so per-channel
 * publish order is the delivery order. Nothing crosses the process boundary.
 */
public class InMemoryBusBackend implements BusBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBusBackend.class);

    private final MessageHandler dispatcher;
    private final Clock clock;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    public InMemoryBusBackend(MessageHandler dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "in-memory";
    }

    @Override
    public void publish(String channel, String payload) {
        dispatcher.onMessage(channel, payload);
    }

    @Override
    public void subscribeChannel(String channel) {
        log.debug("Subscribed to channel (memory): {}", channel);
    }

    @Override
    public void unsubscribeChannel(String channel) {
        log.debug("Unsubscribed from channel (memory): {}", channel);
    }

    @Override
    public void cacheSet(String key, String value, Duration ttl) {
        cache.put(key, new CacheEntry(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<String> cacheGet(String key) {
        CacheEntry entry = cache.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.remove(key, entry);
            log.trace("Cache expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Removes every expired entry. Reads already ignore expired values; this
     * only bounds memory for keys that are never read again.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.entrySet().removeIf(e -> e.getValue().isExpired(now));
        return Math.max(0, before - cache.size());
    }

    @Override
    public void close() {
        cache.clear();
    }

    private record CacheEntry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
