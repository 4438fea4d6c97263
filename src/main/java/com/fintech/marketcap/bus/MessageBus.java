package com.fintech.marketcap.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketcap.domain.CandleUpdate;
import com.fintech.marketcap.domain.QuoteCache;
import com.fintech.marketcap.domain.SupplyChange;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Named-channel publish/subscribe with a short-TTL cache.
 *
 * <p>Backed by Redis when a broker URL is configured and reachable, otherwise
 * by an in-process fallback with the same contract. Publishing is
 * fire-and-forget: no acknowledgment, no buffering for channels that have no
 * subscriber yet. Nothing in here throws at the caller for broker problems.
 *
 * <p>The handler registry lives here rather than in the backend so both
 * modes share subscribe/unsubscribe semantics.
 */
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    static final Duration QUOTE_TTL = Duration.ofSeconds(1);
    static final Duration TOKEN_INFO_TTL = Duration.ofSeconds(60);

    private final String brokerUrl;
    private final BrokerConnector brokerConnector;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // Channel -> handlers in registration order; COW keeps dispatch lock-free
    private final Map<String, CopyOnWriteArraySet<MessageHandler>> subscriptions = new ConcurrentHashMap<>();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile BusBackend backend;
    private volatile boolean fallbackMode;

    private final AtomicLong messagesPublished = new AtomicLong(0);
    private final AtomicLong publishFailures = new AtomicLong(0);
    private final AtomicLong handlerFailures = new AtomicLong(0);

    public MessageBus(
            String brokerUrl,
            BrokerConnector brokerConnector,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.brokerUrl = brokerUrl;
        this.brokerConnector = brokerConnector;
        this.objectMapper = objectMapper;
        this.clock = clock;

        meterRegistry.gauge("marketcap.bus.published", messagesPublished);
        meterRegistry.gauge("marketcap.bus.publish.failures", publishFailures);
        meterRegistry.gauge("marketcap.bus.handler.failures", handlerFailures);
    }

    /**
     * Connects to the broker, or switches to the in-memory fallback if no
     * broker is configured or it cannot be reached. Never throws.
     */
    public void connect() {
        lifecycleLock.lock();
        try {
            if (backend != null) {
                return;
            }
            if (brokerUrl == null || brokerUrl.isBlank()) {
                log.warn("No broker URL configured. Using in-memory message bus (no cross-process fan-out).");
                useFallback();
                return;
            }
            try {
                backend = brokerConnector.connect(brokerUrl, this::dispatch);
                fallbackMode = false;
                subscriptions.keySet().forEach(this::subscribeOnBackend);
            } catch (Exception e) {
                log.warn("Failed to connect to broker: {}. Switching to in-memory fallback.", e.getMessage());
                useFallback();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void useFallback() {
        backend = new InMemoryBusBackend(this::dispatch, clock);
        fallbackMode = true;
    }

    /**
     * Stops listeners, closes the broker connection and forgets every
     * subscription. Safe to call when not connected.
     */
    public void disconnect() {
        lifecycleLock.lock();
        try {
            BusBackend current = backend;
            backend = null;
            fallbackMode = false;
            subscriptions.clear();
            if (current != null) {
                try {
                    current.close();
                } catch (RuntimeException e) {
                    log.warn("Error closing {} message bus backend: {}", current.name(), e.getMessage());
                }
                log.info("Message bus disconnected ({})", current.name());
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    // ============ Pub/Sub ============

    /**
     * Publishes a message. Strings are sent as-is, anything else is
     * serialized to JSON. Failures are logged and counted, never thrown.
     */
    public void publish(String channel, Object message) {
        BusBackend current = backend;
        if (current == null) {
            log.debug("Message bus not connected, dropping message for {}", channel);
            return;
        }

        String payload;
        try {
            payload = message instanceof String text ? text : objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            publishFailures.incrementAndGet();
            log.error("Failed to serialize message for {}: {}", channel, e.getMessage());
            return;
        }

        try {
            current.publish(channel, payload);
            messagesPublished.incrementAndGet();
            if (log.isTraceEnabled()) {
                log.trace("Published to {}: {}", channel, payload);
            }
        } catch (RuntimeException e) {
            publishFailures.incrementAndGet();
            log.error("Failed to publish to {}: {}", channel, e.getMessage());
        }
    }

    /** Publishes a candle on {@code candles:{token}:{timeframe}}. */
    public void publishCandle(CandleUpdate update) {
        publish(Channels.CANDLES_PREFIX + update.token() + ":" + update.timeframe(), update);
    }

    /** Publishes a supply notice on {@code supply_change:{token}}. */
    public void publishSupplyChange(SupplyChange change) {
        publish(Channels.supplyChange(change.token()), change);
    }

    /** Publishes arbitrary data on any channel (migration and indicator collaborators). */
    public void publishRaw(String channel, Map<String, ?> data) {
        publish(channel, data);
    }

    /**
     * Registers a handler. Registering the same handler twice on a channel is
     * a no-op.
     *
     * @return true if the handler was newly added
     */
    public boolean subscribe(String channel, MessageHandler handler) {
        lifecycleLock.lock();
        try {
            CopyOnWriteArraySet<MessageHandler> handlers =
                subscriptions.computeIfAbsent(channel, c -> new CopyOnWriteArraySet<>());
            boolean added = handlers.add(handler);
            if (added && handlers.size() == 1) {
                subscribeOnBackend(channel);
            }
            return added;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Removes one handler; the channel is released once its last handler goes.
     */
    public void unsubscribe(String channel, MessageHandler handler) {
        lifecycleLock.lock();
        try {
            Set<MessageHandler> handlers = subscriptions.get(channel);
            if (handlers == null || !handlers.remove(handler)) {
                return;
            }
            if (handlers.isEmpty()) {
                subscriptions.remove(channel);
                unsubscribeOnBackend(channel);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /** Removes every handler of a channel. */
    public void unsubscribe(String channel) {
        lifecycleLock.lock();
        try {
            if (subscriptions.remove(channel) != null) {
                unsubscribeOnBackend(channel);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void subscribeOnBackend(String channel) {
        BusBackend current = backend;
        if (current == null) {
            return;
        }
        try {
            current.subscribeChannel(channel);
        } catch (RuntimeException e) {
            log.error("Failed to subscribe to {} on {}: {}", channel, current.name(), e.getMessage());
        }
    }

    private void unsubscribeOnBackend(String channel) {
        BusBackend current = backend;
        if (current == null) {
            return;
        }
        try {
            current.unsubscribeChannel(channel);
        } catch (RuntimeException e) {
            log.error("Failed to unsubscribe from {} on {}: {}", channel, current.name(), e.getMessage());
        }
    }

    /**
     * Delivers a received message to every handler of its channel, in
     * registration order. One failing handler does not stop the others.
     */
    void dispatch(String channel, String payload) {
        Set<MessageHandler> handlers = subscriptions.get(channel);
        if (handlers == null) {
            return;
        }
        for (MessageHandler handler : handlers) {
            try {
                handler.onMessage(channel, payload);
            } catch (RuntimeException e) {
                handlerFailures.incrementAndGet();
                log.error("Handler error for {}: {}", channel, e.getMessage(), e);
            }
        }
    }

    // ============ Cache ============

    /** Stores a value with a TTL. Failures are logged, never thrown. */
    public void cacheSet(String key, String value, Duration ttl) {
        BusBackend current = backend;
        if (current == null) {
            return;
        }
        try {
            current.cacheSet(key, value, ttl);
        } catch (RuntimeException e) {
            log.error("Failed to cache {}: {}", key, e.getMessage());
        }
    }

    /** Stores a value serialized as JSON. */
    public void cacheSetJson(String key, Object value, Duration ttl) {
        try {
            cacheSet(key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize cache value for {}: {}", key, e.getMessage());
        }
    }

    /** Returns the cached value if present and not expired. */
    public Optional<String> cacheGet(String key) {
        BusBackend current = backend;
        if (current == null) {
            return Optional.empty();
        }
        try {
            return current.cacheGet(key);
        } catch (RuntimeException e) {
            log.error("Failed to read cache {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /** Reads a JSON cache entry; malformed entries read as absent. */
    public <T> Optional<T> cacheGetJson(String key, Class<T> type) {
        return cacheGet(key).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, type));
            } catch (JsonProcessingException e) {
                log.warn("Ignoring malformed cache entry {}: {}", key, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    /** Caches a swap quote for {@link #QUOTE_TTL}. */
    public void cacheQuote(String inputMint, String outputMint, long amount, JsonNode quote) {
        long now = clock.millis();
        QuoteCache entry = new QuoteCache(quote, now, now + QUOTE_TTL.toMillis());
        cacheSetJson(Channels.quoteKey(inputMint, outputMint, amount), entry, QUOTE_TTL);
    }

    /** Returns the cached quote while its validity window is open. */
    public Optional<JsonNode> getCachedQuote(String inputMint, String outputMint, long amount) {
        long now = clock.millis();
        return cacheGetJson(Channels.quoteKey(inputMint, outputMint, amount), QuoteCache.class)
            .filter(entry -> entry.isValidAt(now))
            .map(QuoteCache::quote);
    }

    public void cacheTokenInfo(String tokenAddress, JsonNode info) {
        cacheSetJson(Channels.tokenInfoKey(tokenAddress), info, TOKEN_INFO_TTL);
    }

    public Optional<JsonNode> getCachedTokenInfo(String tokenAddress) {
        return cacheGetJson(Channels.tokenInfoKey(tokenAddress), JsonNode.class);
    }

    /** Drops expired in-memory cache entries; no-op in broker mode. */
    public int sweepExpiredCache() {
        if (backend instanceof InMemoryBusBackend memory) {
            int removed = memory.sweepExpired();
            if (removed > 0) {
                log.debug("Swept {} expired cache entries", removed);
            }
            return removed;
        }
        return 0;
    }

    // ============ Introspection ============

    public boolean isConnected() {
        return backend != null;
    }

    public boolean isFallbackMode() {
        return fallbackMode;
    }

    public int subscriberCount(String channel) {
        Set<MessageHandler> handlers = subscriptions.get(channel);
        return handlers == null ? 0 : handlers.size();
    }

    /** Returns tokens that currently have at least one token-scoped subscription. */
    public Set<String> activeTokens() {
        Set<String> tokens = new TreeSet<>();
        subscriptions.keySet().forEach(channel -> Channels.tokenOf(channel).ifPresent(tokens::add));
        return tokens;
    }

    public long getMessagesPublished() {
        return messagesPublished.get();
    }

    public long getPublishFailures() {
        return publishFailures.get();
    }
}
