package com.fintech.marketcap.bus;

import java.time.Duration;
import java.util.Optional;

/**
 * Transport behind {@link MessageBus}. Two implementations exist: the Redis
 * broker and the in-process fallback. Both hand received messages back to the
 * bus, which owns the handler registry.
 */
public interface BusBackend {

    /** Short name for logs and metrics ("redis", "in-memory"). */
    String name();

    void publish(String channel, String payload);

    /** Starts receiving messages for a channel that gained its first handler. */
    void subscribeChannel(String channel);

    /** Stops receiving messages for a channel that lost its last handler. */
    void unsubscribeChannel(String channel);

    void cacheSet(String key, String value, Duration ttl);

    Optional<String> cacheGet(String key);

    /** Releases connections and listener threads. Safe to call twice. */
    void close();
}
