package com.fintech.marketcap.aggregation;

import com.fintech.marketcap.bus.MessageBus;
import com.fintech.marketcap.domain.Candle;
import com.fintech.marketcap.domain.CandleUpdate;
import com.fintech.marketcap.domain.ChartCandle;
import com.fintech.marketcap.domain.SupplyChange;
import com.fintech.marketcap.domain.SwapEvent;
import com.fintech.marketcap.domain.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Builds market-cap OHLCV candles for one token at one timeframe.
 *
 * <p>Market cap is {@code priceUsd x supply} unless the swap carries its own
 * positive market-cap figure. All state changes happen under one lock, so
 * swaps for this stream are applied in the order they reach the lock while
 * other streams proceed in parallel.
 *
 * <p>Swaps whose bucket precedes the open bucket are rejected: a closed
 * candle that has already been published is never revised.
 */
public class MarketCapAggregator {

    private static final Logger log = LoggerFactory.getLogger(MarketCapAggregator.class);

    private final String tokenAddress;
    private final Timeframe timeframe;
    private final int historySize;
    private final MessageBus messageBus;
    private final List<ClosedCandleListener> closeListeners;
    private final Clock clock;

    // Fair: same-stream callers are served in arrival order
    private final ReentrantLock lock = new ReentrantLock(true);

    // Guarded by lock
    private OpenCandle current;
    private final Deque<Candle> history = new ArrayDeque<>();
    private double lastPriceUsd;
    private double lastMarketCap;
    private long supply;

    private final AtomicLong swapsApplied = new AtomicLong(0);
    private final AtomicLong candlesClosed = new AtomicLong(0);
    private final AtomicLong lateSwapsRejected = new AtomicLong(0);

    public MarketCapAggregator(
            String tokenAddress,
            Timeframe timeframe,
            long supply,
            int historySize,
            MessageBus messageBus,
            List<ClosedCandleListener> closeListeners,
            Clock clock) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("History size must be positive, got " + historySize);
        }
        this.tokenAddress = tokenAddress;
        this.timeframe = timeframe;
        this.supply = supply;
        this.historySize = historySize;
        this.messageBus = messageBus;
        this.closeListeners = List.copyOf(closeListeners);
        this.clock = clock;
    }

    /**
     * Applies a swap and publishes the resulting candles: the closed candle
     * and any gap fills first, then the open candle.
     *
     * <p>State is committed only once every candle the swap produces has been
     * built, and publishing happens after the lock is released. Publish order
     * per stream follows call order as long as one thread feeds each token,
     * which the ingestion sharding guarantees.
     *
     * @return the open candle after this swap, or empty if the swap was
     *         rejected (non-positive price, late bucket)
     */
    public Optional<CandleUpdate> processSwap(SwapEvent swap) {
        if (swap == null || !swap.isValid()) {
            return Optional.empty();
        }

        List<CandleUpdate> outbound = new ArrayList<>(2);
        CandleUpdate closedUpdate = null;
        CandleUpdate update;

        lock.lock();
        try {
            long bucketStart = timeframe.alignTimestamp(swap.timestamp());

            if (current != null && bucketStart < current.bucketStart) {
                lateSwapsRejected.incrementAndGet();
                log.debug("Rejected late swap: token={}, timeframe={}, swap_bucket={}, open_bucket={}",
                         tokenAddress, timeframe, bucketStart, current.bucketStart);
                return Optional.empty();
            }

            double marketCap = swap.hasMarketCapOverride()
                ? swap.marketCapUsd()
                : swap.priceUsd() * supply;
            double volumeUsd = swap.volumeUsd();

            OpenCandle next;
            if (current == null) {
                next = new OpenCandle(bucketStart, marketCap, volumeUsd);
                update = CandleUpdate.of(tokenAddress, timeframe, next.snapshot(false));
                log.debug("Started candle: token={}, timeframe={}, bucket={}", tokenAddress, timeframe, bucketStart);
            } else if (bucketStart > current.bucketStart) {
                Candle closed = current.snapshot(true);
                List<Candle> gaps = gapsBetween(closed, bucketStart);
                next = new OpenCandle(bucketStart, marketCap, volumeUsd);
                update = CandleUpdate.of(tokenAddress, timeframe, next.snapshot(false));

                closedUpdate = CandleUpdate.of(tokenAddress, timeframe, closed);
                outbound.add(closedUpdate);
                for (Candle gap : gaps) {
                    outbound.add(CandleUpdate.of(tokenAddress, timeframe, gap));
                }

                appendHistory(closed);
                gaps.forEach(this::appendHistory);
                candlesClosed.incrementAndGet();

                if (log.isTraceEnabled()) {
                    log.trace("Closed candle: token={}, timeframe={}, candle={}", tokenAddress, timeframe, closed);
                }
                if (!gaps.isEmpty()) {
                    log.debug("Gap-filled {} candles: token={}, timeframe={}", gaps.size(), tokenAddress, timeframe);
                }
            } else {
                next = current.copy();
                next.update(marketCap, volumeUsd);
                update = CandleUpdate.of(tokenAddress, timeframe, next.snapshot(false));
            }

            current = next;
            lastPriceUsd = swap.priceUsd();
            lastMarketCap = marketCap;
            swapsApplied.incrementAndGet();
            outbound.add(update);

        } catch (RuntimeException e) {
            log.error("Failed to aggregate swap {} for {}:{}", swap.signature(), tokenAddress, timeframe, e);
            return Optional.empty();
        } finally {
            lock.unlock();
        }

        outbound.forEach(messageBus::publishCandle);
        if (closedUpdate != null) {
            notifyClosed(closedUpdate);
        }
        return Optional.of(update);
    }

    private void notifyClosed(CandleUpdate closed) {
        for (ClosedCandleListener listener : closeListeners) {
            try {
                listener.onCandleClosed(tokenAddress, timeframe, closed);
            } catch (RuntimeException e) {
                log.debug("Close hook failed for {}:{}: {}", tokenAddress, timeframe, e.getMessage());
            }
        }
    }

    /**
     * Flat zero-volume candles for every empty bucket between the closed
     * candle and the new one. Only the newest {@code historySize} are
     * produced; older ones would be evicted immediately.
     */
    private List<Candle> gapsBetween(Candle previous, long nextBucketStart) {
        long first = timeframe.windowEnd(previous.time());
        long earliestKept = nextBucketStart - (long) historySize * timeframe.millis();
        long start = Math.max(first, earliestKept);

        List<Candle> gaps = new ArrayList<>();
        for (long bucket = start; bucket < nextBucketStart; bucket += timeframe.millis()) {
            gaps.add(Candle.gapFill(bucket, previous.close()));
        }
        return gaps;
    }

    private void appendHistory(Candle candle) {
        history.addLast(candle);
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    /**
     * Updates the circulating supply. The open candle is rescaled to the new
     * supply; closed history keeps the supply it was built with.
     *
     * @return the published notice, or empty if the supply did not change
     * @throws IllegalArgumentException if {@code newSupply} is not positive
     */
    public Optional<SupplyChange> setSupply(long newSupply) {
        if (newSupply <= 0) {
            throw new IllegalArgumentException("Supply must be positive, got " + newSupply);
        }

        SupplyChange change;
        lock.lock();
        try {
            long oldSupply = supply;
            if (newSupply == oldSupply) {
                return Optional.empty();
            }
            supply = newSupply;

            double oldMarketCap = lastPriceUsd > 0 ? lastPriceUsd * oldSupply : 0.0;
            if (lastPriceUsd > 0) {
                lastMarketCap = lastPriceUsd * newSupply;
            }

            if (current != null && lastPriceUsd > 0) {
                double ratio = oldSupply > 0 ? (double) newSupply / oldSupply : 1.0;
                current.rescale(ratio, lastMarketCap);
                log.info("Updated market cap for {}:{} due to supply change: {} -> {} (ratio: {})",
                        tokenAddress, timeframe, oldSupply, newSupply, String.format("%.6f", ratio));
            }

            change = new SupplyChange(
                tokenAddress,
                oldSupply,
                newSupply,
                oldMarketCap,
                lastPriceUsd > 0 ? lastMarketCap : 0.0,
                clock.millis()
            );
        } finally {
            lock.unlock();
        }

        messageBus.publishSupplyChange(change);
        return Optional.of(change);
    }

    /** Clears candles and last observations; supply is kept. */
    public void reset() {
        lock.lock();
        try {
            current = null;
            history.clear();
            lastPriceUsd = 0;
            lastMarketCap = 0;
        } finally {
            lock.unlock();
        }
    }

    // ============ Snapshots ============

    public Optional<Candle> currentCandle() {
        lock.lock();
        try {
            return current == null ? Optional.empty() : Optional.of(current.snapshot(false));
        } finally {
            lock.unlock();
        }
    }

    /** Closed candles, oldest first. */
    public List<Candle> closedCandles() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    /** Closed candles followed by the open one, if any. */
    public List<Candle> allCandles() {
        lock.lock();
        try {
            List<Candle> all = new ArrayList<>(history.size() + 1);
            all.addAll(history);
            if (current != null) {
                all.add(current.snapshot(false));
            }
            return all;
        } finally {
            lock.unlock();
        }
    }

    public List<ChartCandle> toChartFormat() {
        return allCandles().stream().map(Candle::toChartPoint).toList();
    }

    public double lastPriceUsd() {
        lock.lock();
        try {
            return lastPriceUsd;
        } finally {
            lock.unlock();
        }
    }

    public double lastMarketCap() {
        lock.lock();
        try {
            return lastMarketCap;
        } finally {
            lock.unlock();
        }
    }

    public long supply() {
        lock.lock();
        try {
            return supply;
        } finally {
            lock.unlock();
        }
    }

    public String tokenAddress() {
        return tokenAddress;
    }

    public Timeframe timeframe() {
        return timeframe;
    }

    public long getSwapsApplied() {
        return swapsApplied.get();
    }

    public long getCandlesClosed() {
        return candlesClosed.get();
    }

    public long getLateSwapsRejected() {
        return lateSwapsRejected.get();
    }

    /**
     * Bucket being built. Not thread-safe; only touched under the aggregator lock.
     */
    private static final class OpenCandle {
        final long bucketStart;
        double open;
        double high;
        double low;
        double close;
        double volume;
        long trades;

        OpenCandle(long bucketStart, double marketCap, double volumeUsd) {
            this(bucketStart, marketCap, marketCap, marketCap, marketCap, volumeUsd, 1);
        }

        private OpenCandle(long bucketStart, double open, double high, double low, double close,
                           double volume, long trades) {
            this.bucketStart = bucketStart;
            this.open = open;
            this.high = high;
            this.low = low;
            this.close = close;
            this.volume = volume;
            this.trades = trades;
        }

        OpenCandle copy() {
            return new OpenCandle(bucketStart, open, high, low, close, volume, trades);
        }

        void update(double marketCap, double volumeUsd) {
            this.high = Math.max(this.high, marketCap);
            this.low = Math.min(this.low, marketCap);
            this.close = marketCap;
            this.volume += volumeUsd;
            this.trades++;
        }

        /** Scales open/high/low, sets close, and widens high/low to keep close inside. */
        void rescale(double ratio, double newClose) {
            this.open *= ratio;
            this.high *= ratio;
            this.low *= ratio;
            this.close = newClose;
            this.high = Math.max(this.high, newClose);
            this.low = Math.min(this.low, newClose);
        }

        Candle snapshot(boolean closed) {
            return new Candle(bucketStart, open, high, low, close, volume, trades, closed);
        }
    }
}
