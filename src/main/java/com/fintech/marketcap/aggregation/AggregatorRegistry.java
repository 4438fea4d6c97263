package com.fintech.marketcap.aggregation;

import com.fintech.marketcap.bus.Channels;
import com.fintech.marketcap.bus.MessageBus;
import com.fintech.marketcap.domain.AggregatorKey;
import com.fintech.marketcap.domain.Candle;
import com.fintech.marketcap.domain.CandleUpdate;
import com.fintech.marketcap.domain.SwapEvent;
import com.fintech.marketcap.domain.Timeframe;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the live {@link MarketCapAggregator}s and the token supply cache.
 * Fans each swap out to every configured timeframe and pushes supply
 * mutations to all aggregators of the affected token.
 */
public class AggregatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(AggregatorRegistry.class);

    private final MessageBus messageBus;
    private final SupplyCache supplyCache;
    private final List<Timeframe> timeframes;
    private final int historySize;
    private final long defaultSupply;
    private final List<ClosedCandleListener> closeListeners;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<AggregatorKey, MarketCapAggregator> aggregators = new ConcurrentHashMap<>();

    private final AtomicLong swapsProcessed = new AtomicLong(0);
    private final AtomicLong swapsRejected = new AtomicLong(0);
    private final AtomicLong supplyMutationsRejected = new AtomicLong(0);

    public AggregatorRegistry(
            MessageBus messageBus,
            SupplyCache supplyCache,
            List<Timeframe> timeframes,
            int historySize,
            long defaultSupply,
            List<ClosedCandleListener> closeListeners,
            Clock clock,
            MeterRegistry meterRegistry) {
        if (timeframes.isEmpty()) {
            throw new IllegalArgumentException("At least one timeframe must be configured");
        }
        this.messageBus = messageBus;
        this.supplyCache = supplyCache;
        this.timeframes = List.copyOf(timeframes);
        this.historySize = historySize;
        this.defaultSupply = defaultSupply;
        this.closeListeners = List.copyOf(closeListeners);
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("marketcap.aggregator.swaps.processed", swapsProcessed);
        meterRegistry.gauge("marketcap.aggregator.swaps.rejected", swapsRejected);
        meterRegistry.gauge("marketcap.aggregator.supply.rejected", supplyMutationsRejected);
        meterRegistry.gauge("marketcap.aggregator.active", aggregators, Map::size);
        meterRegistry.gauge("marketcap.aggregator.candles.closed", this,
            registry -> registry.aggregators.values().stream().mapToLong(MarketCapAggregator::getCandlesClosed).sum());
        meterRegistry.gauge("marketcap.aggregator.late.events.rejected", this,
            registry -> registry.aggregators.values().stream().mapToLong(MarketCapAggregator::getLateSwapsRejected).sum());

        log.info("Aggregator registry initialized: timeframes={}, historySize={}, defaultSupply={}",
                this.timeframes, historySize, defaultSupply);
    }

    /**
     * Returns the aggregator for (token, timeframe), creating it on first use.
     * A new aggregator starts from {@code supplyHint}, else the cached supply,
     * else the configured default. An existing aggregator is returned as is,
     * whatever hint is passed.
     */
    public MarketCapAggregator getOrCreate(String tokenAddress, Timeframe timeframe, Long supplyHint) {
        AggregatorKey key = new AggregatorKey(tokenAddress, timeframe);
        MarketCapAggregator existing = aggregators.get(key);
        if (existing != null) {
            return existing;
        }

        // Resolved outside computeIfAbsent: the broker cache read may block
        long supply = resolveSupply(tokenAddress, supplyHint);
        return aggregators.computeIfAbsent(key, k -> {
            log.debug("Created aggregator: key={}, supply={}", k, supply);
            return new MarketCapAggregator(
                tokenAddress, timeframe, supply, historySize, messageBus, closeListeners, clock);
        });
    }

    private long resolveSupply(String tokenAddress, Long supplyHint) {
        if (supplyHint != null && supplyHint > 0) {
            supplyCache.putIfAbsent(tokenAddress, supplyHint);
            return supplyHint;
        }

        OptionalLong cached = supplyCache.get(tokenAddress);
        if (cached.isPresent()) {
            return cached.getAsLong();
        }

        Optional<Long> shared = messageBus.cacheGet(Channels.tokenSupplyKey(tokenAddress))
            .flatMap(AggregatorRegistry::parseSupply);
        if (shared.isPresent()) {
            supplyCache.put(tokenAddress, shared.get());
            return shared.get();
        }

        return defaultSupply;
    }

    private static Optional<Long> parseSupply(String value) {
        try {
            long supply = Long.parseLong(value.trim());
            return supply > 0 ? Optional.of(supply) : Optional.empty();
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed cached supply '{}'", value);
            return Optional.empty();
        }
    }

    /** Applies a swap to every configured timeframe. */
    public List<CandleUpdate> processSwap(SwapEvent swap) {
        return processSwap(swap, timeframes);
    }

    /**
     * Applies a swap to each of the given timeframes independently. A swap
     * that at least one timeframe accepted is relayed on {@code swaps:{token}}.
     *
     * @return the open candle of each timeframe that accepted the swap
     */
    public List<CandleUpdate> processSwap(SwapEvent swap, Collection<Timeframe> selectedTimeframes) {
        if (swap == null || !swap.isValid()) {
            swapsRejected.incrementAndGet();
            log.debug("Invalid swap received, skipping: {}", swap);
            return List.of();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<CandleUpdate> updates = new ArrayList<>(selectedTimeframes.size());
            for (Timeframe timeframe : selectedTimeframes) {
                getOrCreate(swap.tokenAddress(), timeframe, null)
                    .processSwap(swap)
                    .ifPresent(updates::add);
            }
            swapsProcessed.incrementAndGet();
            if (!updates.isEmpty()) {
                messageBus.publish(Channels.swaps(swap.tokenAddress()), swap);
            }
            return updates;
        } finally {
            sample.stop(meterRegistry.timer("marketcap.aggregator.swap.processing.time"));
        }
    }

    /**
     * Records a mint/burn driven supply change and rescales every aggregator
     * of the token. Non-positive supplies are rejected and counted.
     *
     * @return false if the supply was rejected
     */
    public boolean onSupplyMutation(String tokenAddress, long newSupply) {
        if (newSupply <= 0) {
            supplyMutationsRejected.incrementAndGet();
            log.warn("Rejected supply mutation for {}: supply must be positive, got {}", tokenAddress, newSupply);
            return false;
        }

        supplyCache.put(tokenAddress, newSupply);
        messageBus.cacheSet(Channels.tokenSupplyKey(tokenAddress), Long.toString(newSupply), supplyCache.ttl());

        int updated = 0;
        for (MarketCapAggregator aggregator : aggregatorsFor(tokenAddress)) {
            aggregator.setSupply(newSupply);
            updated++;
        }
        log.info("Supply changed for {}: {} ({} aggregators updated)", tokenAddress, newSupply, updated);
        return true;
    }

    /**
     * Drops every aggregator and the cached supply of a token. Data already
     * published downstream is unaffected.
     *
     * @return number of aggregators removed
     */
    public int removeToken(String tokenAddress) {
        List<AggregatorKey> keys = aggregators.keySet().stream()
            .filter(key -> key.tokenAddress().equals(tokenAddress))
            .toList();
        keys.forEach(aggregators::remove);
        supplyCache.remove(tokenAddress);
        log.info("Removed token {} ({} aggregators)", tokenAddress, keys.size());
        return keys.size();
    }

    public Optional<MarketCapAggregator> find(String tokenAddress, Timeframe timeframe) {
        return Optional.ofNullable(aggregators.get(new AggregatorKey(tokenAddress, timeframe)));
    }

    /** Closed candles followed by the open one; empty for unknown streams. */
    public List<Candle> getCandles(String tokenAddress, Timeframe timeframe) {
        return find(tokenAddress, timeframe).map(MarketCapAggregator::allCandles).orElse(List.of());
    }

    public List<MarketCapAggregator> aggregatorsFor(String tokenAddress) {
        return aggregators.entrySet().stream()
            .filter(entry -> entry.getKey().tokenAddress().equals(tokenAddress))
            .map(Map.Entry::getValue)
            .toList();
    }

    public Set<String> trackedTokens() {
        Set<String> tokens = new TreeSet<>();
        aggregators.keySet().forEach(key -> tokens.add(key.tokenAddress()));
        return tokens;
    }

    public int aggregatorCount() {
        return aggregators.size();
    }

    public List<Timeframe> timeframes() {
        return timeframes;
    }

    /** @return number of stale supply records removed */
    public int evictStaleSupplies() {
        int removed = supplyCache.evictStale();
        if (removed > 0) {
            log.debug("Evicted {} stale supply records", removed);
        }
        return removed;
    }

    public long getSwapsProcessed() {
        return swapsProcessed.get();
    }

    public long getSwapsRejected() {
        return swapsRejected.get();
    }

    public long getSupplyMutationsRejected() {
        return supplyMutationsRejected.get();
    }
}
