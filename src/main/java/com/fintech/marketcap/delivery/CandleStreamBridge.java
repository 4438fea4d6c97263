package com.fintech.marketcap.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.marketcap.bus.Channels;
import com.fintech.marketcap.bus.MessageBus;
import com.fintech.marketcap.bus.MessageHandler;
import com.fintech.marketcap.domain.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Relays bus channels to client connections through the
 * {@link BackpressureController}.
 *
 * <p>Holds a single bus subscription per channel no matter how many
 * connections listen on it, and wraps each relayed payload as
 * {@code {"type", "data", "timestamp"}}. Closed candles go out as CRITICAL,
 * open candles as NORMAL, supply changes, trades and status messages as HIGH.
 */
public class CandleStreamBridge implements ConnectionTerminationListener {

    private static final Logger log = LoggerFactory.getLogger(CandleStreamBridge.class);

    private final MessageBus messageBus;
    private final BackpressureController controller;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // One instance so repeated bus subscriptions stay idempotent
    private final MessageHandler relay = this::relay;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    // channel -> connection ids
    private final Map<String, Set<String>> channelListeners = new ConcurrentHashMap<>();
    // connection id -> channels
    private final Map<String, Set<String>> connectionChannels = new ConcurrentHashMap<>();
    private final ReentrantLock subscriptionLock = new ReentrantLock();

    public CandleStreamBridge(
            MessageBus messageBus,
            BackpressureController controller,
            ObjectMapper objectMapper,
            Clock clock) {
        this.messageBus = messageBus;
        this.controller = controller;
        this.objectMapper = objectMapper;
        this.clock = clock;
        controller.addTerminationListener(this);
    }

    /**
     * Registers the connection for delivery and queues the welcome status.
     *
     * @return false if the connection id is already in use
     */
    public boolean connect(ClientConnection connection) {
        if (!controller.register(connection)) {
            return false;
        }
        connections.put(connection.id(), connection);
        connectionChannels.put(connection.id(), ConcurrentHashMap.newKeySet());

        ObjectNode status = objectMapper.createObjectNode();
        status.put("status", "connected");
        status.put("message", "Connected to market-cap candle stream");
        send(connection.id(), "status", status, MessagePriority.HIGH);
        return true;
    }

    /**
     * Starts relaying candles of the given timeframes, plus the token's supply
     * changes, to a connection.
     *
     * @return false if the connection is not connected
     */
    public boolean subscribeCandles(String connectionId, String tokenAddress, Collection<Timeframe> timeframes) {
        subscriptionLock.lock();
        try {
            if (!connections.containsKey(connectionId)) {
                return false;
            }
            for (Timeframe timeframe : timeframes) {
                listen(connectionId, Channels.candles(tokenAddress, timeframe));
            }
            listen(connectionId, Channels.supplyChange(tokenAddress));
            log.debug("Connection {} subscribed to {} {}", connectionId, tokenAddress, timeframes);
            return true;
        } finally {
            subscriptionLock.unlock();
        }
    }

    /**
     * Stops relaying the given timeframes. Supply changes stop once no candle
     * channel of the token is left for this connection.
     */
    public void unsubscribeCandles(String connectionId, String tokenAddress, Collection<Timeframe> timeframes) {
        subscriptionLock.lock();
        try {
            for (Timeframe timeframe : timeframes) {
                unlisten(connectionId, Channels.candles(tokenAddress, timeframe));
            }
            String tokenCandlePrefix = Channels.CANDLES_PREFIX + tokenAddress + ":";
            Set<String> remaining = connectionChannels.getOrDefault(connectionId, Set.of());
            if (remaining.stream().noneMatch(channel -> channel.startsWith(tokenCandlePrefix))) {
                unlisten(connectionId, Channels.supplyChange(tokenAddress));
            }
        } finally {
            subscriptionLock.unlock();
        }
    }

    /** Starts relaying executed swaps of a token. */
    public boolean subscribeTrades(String connectionId, String tokenAddress) {
        subscriptionLock.lock();
        try {
            if (!connections.containsKey(connectionId)) {
                return false;
            }
            listen(connectionId, Channels.swaps(tokenAddress));
            return true;
        } finally {
            subscriptionLock.unlock();
        }
    }

    public void unsubscribeTrades(String connectionId, String tokenAddress) {
        subscriptionLock.lock();
        try {
            unlisten(connectionId, Channels.swaps(tokenAddress));
        } finally {
            subscriptionLock.unlock();
        }
    }

    /**
     * Drops every subscription of the connection, unregisters it from
     * delivery and closes its transport. Unknown ids are ignored.
     */
    public void disconnect(String connectionId) {
        ClientConnection connection;
        subscriptionLock.lock();
        try {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return;
            }
            Set<String> channels = connectionChannels.remove(connectionId);
            if (channels != null) {
                for (String channel : List.copyOf(channels)) {
                    release(connectionId, channel);
                }
            }
        } finally {
            subscriptionLock.unlock();
        }

        controller.unregister(connectionId);
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.debug("Error closing connection {}: {}", connectionId, e.getMessage());
        }
        log.info("Connection {} disconnected ({} remaining)", connectionId, connections.size());
    }

    @Override
    public void onUnhealthy(ClientConnection connection, ConnectionStats finalStats) {
        log.warn("Tearing down unhealthy connection {}: health={}, delivered={}, dropped={}",
                connection.id(), finalStats.healthScore(), finalStats.delivered(), finalStats.dropped());
        disconnect(connection.id());
    }

    // Caller holds subscriptionLock
    private void listen(String connectionId, String channel) {
        connectionChannels.computeIfAbsent(connectionId, id -> ConcurrentHashMap.newKeySet()).add(channel);
        channelListeners.computeIfAbsent(channel, c -> ConcurrentHashMap.newKeySet()).add(connectionId);
        messageBus.subscribe(channel, relay);
    }

    // Caller holds subscriptionLock
    private void unlisten(String connectionId, String channel) {
        Set<String> channels = connectionChannels.get(connectionId);
        if (channels != null && channels.remove(channel)) {
            release(connectionId, channel);
        }
    }

    // Caller holds subscriptionLock
    private void release(String connectionId, String channel) {
        Set<String> listeners = channelListeners.get(channel);
        if (listeners == null) {
            return;
        }
        listeners.remove(connectionId);
        if (listeners.isEmpty()) {
            channelListeners.remove(channel);
            messageBus.unsubscribe(channel, relay);
        }
    }

    /** Bus handler: wraps the payload and enqueues it for every listener of the channel. */
    void relay(String channel, String payload) {
        Set<String> listeners = channelListeners.get(channel);
        if (listeners == null || listeners.isEmpty()) {
            return;
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable payload on {}: {}", channel, e.getOriginalMessage());
            return;
        }

        String kind;
        MessagePriority priority;
        JsonNode body;
        if (channel.startsWith(Channels.CANDLES_PREFIX) && data.isObject()) {
            kind = "candle";
            priority = data.path("is_closed").asBoolean(false) ? MessagePriority.CRITICAL : MessagePriority.NORMAL;
            body = candleBody((ObjectNode) data);
        } else if (channel.startsWith(Channels.SUPPLY_CHANGE_PREFIX)) {
            kind = "supply_change";
            priority = MessagePriority.HIGH;
            body = data;
        } else if (channel.startsWith(Channels.SWAPS_PREFIX)) {
            kind = "trade";
            priority = MessagePriority.HIGH;
            body = data;
        } else {
            kind = "message";
            priority = MessagePriority.NORMAL;
            body = data;
        }

        String envelope;
        try {
            envelope = envelope(kind, body);
        } catch (JsonProcessingException e) {
            log.error("Failed to build {} envelope for {}: {}", kind, channel, e.getMessage());
            return;
        }
        for (String connectionId : listeners) {
            controller.enqueue(connectionId, envelope, priority, kind);
        }
    }

    /** {token, timeframe, candle: {time, open, high, low, close, volume, trades, is_closed}} */
    private ObjectNode candleBody(ObjectNode update) {
        ObjectNode candle = update.deepCopy();
        candle.remove(List.of("token", "timeframe"));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("token", update.path("token").asText());
        body.put("timeframe", update.path("timeframe").asText());
        body.set("candle", candle);
        return body;
    }

    private String envelope(String kind, JsonNode data) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", kind);
        root.set("data", data);
        root.put("timestamp", clock.millis());
        return objectMapper.writeValueAsString(root);
    }

    private void send(String connectionId, String kind, JsonNode data, MessagePriority priority) {
        try {
            controller.enqueue(connectionId, envelope(kind, data), priority, kind);
        } catch (JsonProcessingException e) {
            log.error("Failed to build {} envelope for {}: {}", kind, connectionId, e.getMessage());
        }
    }

    public boolean isConnected(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public int connectionCount() {
        return connections.size();
    }

    public int listenerCount(String channel) {
        Set<String> listeners = channelListeners.get(channel);
        return listeners == null ? 0 : listeners.size();
    }

    public Set<String> channelsOf(String connectionId) {
        return new TreeSet<>(connectionChannels.getOrDefault(connectionId, Set.of()));
    }
}
