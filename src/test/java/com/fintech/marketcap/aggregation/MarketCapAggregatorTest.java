package com.fintech.marketcap.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketcap.bus.BrokerConnector;
import com.fintech.marketcap.bus.Channels;
import com.fintech.marketcap.bus.MessageBus;
import com.fintech.marketcap.domain.Candle;
import com.fintech.marketcap.domain.CandleUpdate;
import com.fintech.marketcap.domain.ChartCandle;
import com.fintech.marketcap.domain.SupplyChange;
import com.fintech.marketcap.domain.SwapEvent;
import com.fintech.marketcap.domain.SwapSource;
import com.fintech.marketcap.domain.Timeframe;
import com.fintech.marketcap.domain.TradeSide;
import com.fintech.marketcap.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link MarketCapAggregator}.
 *
 * <p>Runs against a real {@link MessageBus} in in-memory mode so published
 * candles can be captured in order.
 */
@DisplayName("MarketCapAggregator Tests")
class MarketCapAggregatorTest {

    private static final String TOKEN = "TOKEN";
    private static final long SUPPLY = 1_000_000L;
    private static final double EPSILON = 1e-6;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MessageBus bus;
    private List<CandleUpdate> published;
    private List<SupplyChange> supplyChanges;
    private List<CandleUpdate> closedHookCalls;
    private MarketCapAggregator aggregator;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpochMillis(1_000_000L);
        bus = new MessageBus(null, mock(BrokerConnector.class), objectMapper, clock, new SimpleMeterRegistry());
        bus.connect();

        published = new ArrayList<>();
        supplyChanges = new ArrayList<>();
        closedHookCalls = new ArrayList<>();
        bus.subscribe(Channels.candles(TOKEN, Timeframe.M1),
            (channel, payload) -> published.add(read(payload, CandleUpdate.class)));
        bus.subscribe(Channels.supplyChange(TOKEN),
            (channel, payload) -> supplyChanges.add(read(payload, SupplyChange.class)));

        aggregator = new MarketCapAggregator(TOKEN, Timeframe.M1, SUPPLY, 500, bus,
            List.of((token, timeframe, closed) -> closedHookCalls.add(closed)), clock);
    }

    @AfterEach
    void tearDown() {
        bus.disconnect();
    }

    private <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static SwapEvent swap(long timestamp, double priceUsd) {
        return swap(timestamp, priceUsd, 0.0);
    }

    private static SwapEvent swap(long timestamp, double priceUsd, double marketCapUsd) {
        return new SwapEvent("sig-" + timestamp, timestamp, SwapSource.RAYDIUM, TradeSide.BUY,
            TOKEN, 100.0, 1.0, priceUsd, marketCapUsd, "trader");
    }

    @Test
    @DisplayName("End-to-end: open, update in bucket, close on next bucket")
    void testEndToEndScenario() {
        // Given / When: first swap opens the bucket
        Optional<CandleUpdate> first = aggregator.processSwap(swap(1_000L, 0.01));

        // Then
        assertThat(first).isPresent();
        assertThat(first.get().open()).isCloseTo(10_000.0, within(EPSILON));
        assertThat(first.get().high()).isCloseTo(10_000.0, within(EPSILON));
        assertThat(first.get().low()).isCloseTo(10_000.0, within(EPSILON));
        assertThat(first.get().close()).isCloseTo(10_000.0, within(EPSILON));
        assertThat(first.get().closed()).isFalse();

        // When: same bucket
        Optional<CandleUpdate> second = aggregator.processSwap(swap(30_000L, 0.012));

        assertThat(second.get().close()).isCloseTo(12_000.0, within(EPSILON));
        assertThat(second.get().high()).isCloseTo(12_000.0, within(EPSILON));
        assertThat(second.get().low()).isCloseTo(10_000.0, within(EPSILON));
        assertThat(second.get().trades()).isEqualTo(2);

        // When: next bucket
        Optional<CandleUpdate> third = aggregator.processSwap(swap(65_000L, 0.009));

        // Then: bucket 0 closed at 12000, new bucket opened at 9000
        CandleUpdate closed = published.stream().filter(CandleUpdate::closed).findFirst().orElseThrow();
        assertThat(closed.time()).isZero();
        assertThat(closed.close()).isCloseTo(12_000.0, within(EPSILON));
        assertThat(closed.open()).isCloseTo(10_000.0, within(EPSILON));

        assertThat(third.get().time()).isEqualTo(60L);
        assertThat(third.get().open()).isCloseTo(9_000.0, within(EPSILON));
        assertThat(third.get().high()).isCloseTo(9_000.0, within(EPSILON));
        assertThat(third.get().low()).isCloseTo(9_000.0, within(EPSILON));
        assertThat(third.get().close()).isCloseTo(9_000.0, within(EPSILON));

        assertThat(published).hasSize(4);
        assertThat(closedHookCalls).containsExactly(closed);
        assertThat(aggregator.closedCandles()).hasSize(1);
    }

    @Test
    @DisplayName("Gap fill: buckets without swaps are closed flat at the previous close")
    void testGapFill() {
        aggregator.processSwap(swap(0L, 0.01));
        aggregator.processSwap(swap(185_000L, 0.02));

        List<Candle> history = aggregator.closedCandles();
        assertThat(history).extracting(Candle::time).containsExactly(0L, 60_000L, 120_000L);

        Candle real = history.get(0);
        for (Candle gap : history.subList(1, 3)) {
            assertThat(gap.open()).isEqualTo(real.close());
            assertThat(gap.high()).isEqualTo(real.close());
            assertThat(gap.low()).isEqualTo(real.close());
            assertThat(gap.close()).isEqualTo(real.close());
            assertThat(gap.volume()).isZero();
            assertThat(gap.trades()).isZero();
        }

        // Closed candles are all published before the new bucket opens
        assertThat(published).extracting(CandleUpdate::time).containsExactly(0L, 0L, 60L, 120L, 180L);
        assertThat(published).extracting(CandleUpdate::closed).containsExactly(false, true, true, true, false);
        assertThat(aggregator.currentCandle()).hasValueSatisfying(open -> assertThat(open.time()).isEqualTo(180_000L));
    }

    @Test
    @DisplayName("Long silences only fill the buckets history can hold")
    void testGapFillBoundedByHistory() {
        MarketCapAggregator small = new MarketCapAggregator(TOKEN, Timeframe.M1, SUPPLY, 5, bus, List.of(),
            MutableClock.atEpochMillis(0L));

        small.processSwap(swap(0L, 0.01));
        small.processSwap(swap(1_000 * 60_000L, 0.01));

        assertThat(small.closedCandles()).hasSize(5);
        assertThat(small.closedCandles().get(4).time()).isEqualTo(999 * 60_000L);
    }

    @Test
    @DisplayName("Non-positive price is ignored without state change")
    void testInvalidPrice() {
        assertThat(aggregator.processSwap(swap(1_000L, 0.0))).isEmpty();
        assertThat(aggregator.processSwap(swap(1_000L, -1.0))).isEmpty();
        assertThat(aggregator.processSwap(null)).isEmpty();

        assertThat(aggregator.currentCandle()).isEmpty();
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("Market cap override takes precedence over price x supply")
    void testMarketCapOverride() {
        Optional<CandleUpdate> update = aggregator.processSwap(swap(1_000L, 0.01, 55_555.0));

        assertThat(update.get().close()).isEqualTo(55_555.0);
        assertThat(aggregator.lastMarketCap()).isEqualTo(55_555.0);
    }

    @Test
    @DisplayName("Volume accumulates USD notional")
    void testVolume() {
        aggregator.processSwap(swap(1_000L, 0.01));
        aggregator.processSwap(swap(2_000L, 0.02));

        // 100 tokens at 0.01 plus 100 tokens at 0.02
        assertThat(aggregator.currentCandle().get().volume()).isCloseTo(3.0, within(EPSILON));
    }

    @Test
    @DisplayName("Late swaps are rejected and closed candles never change")
    void testLateSwapRejected() {
        aggregator.processSwap(swap(1_000L, 0.01));
        aggregator.processSwap(swap(61_000L, 0.02));
        List<Candle> before = aggregator.closedCandles();

        Optional<CandleUpdate> late = aggregator.processSwap(swap(30_000L, 0.5));

        assertThat(late).isEmpty();
        assertThat(aggregator.getLateSwapsRejected()).isEqualTo(1);
        assertThat(aggregator.closedCandles()).isEqualTo(before);
    }

    @Test
    @DisplayName("Every produced candle satisfies the OHLC invariant")
    void testOhlcInvariant() {
        Random random = new Random(42);
        long timestamp = 0L;
        for (int i = 0; i < 2_000; i++) {
            timestamp += random.nextInt(20_000);
            aggregator.processSwap(swap(timestamp, 0.001 + random.nextDouble()));
        }

        assertThat(published).isNotEmpty();
        for (CandleUpdate candle : published) {
            double bodyLow = Math.min(candle.open(), candle.close());
            double bodyHigh = Math.max(candle.open(), candle.close());
            assertThat(candle.low()).isLessThanOrEqualTo(bodyLow);
            assertThat(bodyHigh).isLessThanOrEqualTo(candle.high());
        }
    }

    @Test
    @DisplayName("Supply change rescales only the open candle")
    void testSetSupplyRescalesOpenCandleOnly() {
        aggregator.processSwap(swap(1_000L, 0.01));
        aggregator.processSwap(swap(61_000L, 0.02));
        aggregator.processSwap(swap(62_000L, 0.03));
        List<Candle> historyBefore = aggregator.closedCandles();
        Candle openBefore = aggregator.currentCandle().orElseThrow();

        Optional<SupplyChange> change = aggregator.setSupply(2 * SUPPLY);

        Candle openAfter = aggregator.currentCandle().orElseThrow();
        assertThat(openAfter.open()).isCloseTo(openBefore.open() * 2, within(EPSILON));
        assertThat(openAfter.high()).isCloseTo(openBefore.high() * 2, within(EPSILON));
        assertThat(openAfter.low()).isCloseTo(openBefore.low() * 2, within(EPSILON));
        assertThat(openAfter.close()).isCloseTo(0.03 * 2 * SUPPLY, within(EPSILON));
        assertThat(aggregator.closedCandles()).isEqualTo(historyBefore);

        assertThat(change).isPresent();
        assertThat(supplyChanges).hasSize(1);
        SupplyChange notice = supplyChanges.get(0);
        assertThat(notice.oldSupply()).isEqualTo(SUPPLY);
        assertThat(notice.newSupply()).isEqualTo(2 * SUPPLY);
        assertThat(notice.oldMarketCap()).isCloseTo(0.03 * SUPPLY, within(EPSILON));
        assertThat(notice.newMarketCap()).isCloseTo(0.03 * 2 * SUPPLY, within(EPSILON));
    }

    @Test
    @DisplayName("Unchanged supply publishes nothing")
    void testSetSameSupply() {
        aggregator.processSwap(swap(1_000L, 0.01));

        assertThat(aggregator.setSupply(SUPPLY)).isEmpty();
        assertThat(supplyChanges).isEmpty();
    }

    @Test
    @DisplayName("New swaps use the new supply")
    void testSwapAfterSupplyChange() {
        aggregator.setSupply(500_000L);

        Optional<CandleUpdate> update = aggregator.processSwap(swap(1_000L, 0.01));

        assertThat(update.get().close()).isCloseTo(5_000.0, within(EPSILON));
        assertThat(aggregator.supply()).isEqualTo(500_000L);
    }

    @Test
    @DisplayName("History keeps at most historySize closed candles")
    void testHistoryBound() {
        MarketCapAggregator small = new MarketCapAggregator(TOKEN, Timeframe.M1, SUPPLY, 3, bus, List.of(),
            MutableClock.atEpochMillis(0L));

        for (int i = 0; i < 10; i++) {
            small.processSwap(swap(i * 60_000L, 0.01 + i * 0.001));
        }

        assertThat(small.closedCandles()).hasSize(3);
        assertThat(small.closedCandles()).extracting(Candle::time).containsExactly(360_000L, 420_000L, 480_000L);
        assertThat(small.allCandles()).hasSize(4);
        assertThat(small.toChartFormat()).extracting(ChartCandle::time).containsExactly(360L, 420L, 480L, 540L);
    }

    @Test
    @DisplayName("A failing close hook does not break aggregation")
    void testFailingCloseHook() {
        MarketCapAggregator withBadHook = new MarketCapAggregator(TOKEN, Timeframe.M1, SUPPLY, 10, bus,
            List.of((token, timeframe, closed) -> {
                throw new IllegalStateException("indicator failure");
            }),
            MutableClock.atEpochMillis(0L));

        withBadHook.processSwap(swap(1_000L, 0.01));
        Optional<CandleUpdate> next = withBadHook.processSwap(swap(61_000L, 0.01));

        assertThat(next).isPresent();
        assertThat(withBadHook.getCandlesClosed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reset clears candles and observations but keeps supply")
    void testReset() {
        aggregator.processSwap(swap(1_000L, 0.01));
        aggregator.processSwap(swap(61_000L, 0.01));

        aggregator.reset();

        assertThat(aggregator.currentCandle()).isEmpty();
        assertThat(aggregator.closedCandles()).isEmpty();
        assertThat(aggregator.lastPriceUsd()).isZero();
        assertThat(aggregator.supply()).isEqualTo(SUPPLY);
    }

    @Test
    @DisplayName("Non-positive supply is rejected and later swaps still aggregate")
    void testInvalidSupplyRejected() {
        aggregator.processSwap(swap(1_000L, 0.01));
        aggregator.processSwap(swap(2_000L, 0.012));

        assertThatThrownBy(() -> aggregator.setSupply(-1_000_000L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> aggregator.setSupply(0L)).isInstanceOf(IllegalArgumentException.class);

        assertThat(aggregator.supply()).isEqualTo(SUPPLY);
        assertThat(supplyChanges).isEmpty();
        assertThat(aggregator.processSwap(swap(3_000L, 0.011))).isPresent();
        assertThat(aggregator.processSwap(swap(65_000L, 0.013))).isPresent();
        assertThat(aggregator.processSwap(swap(200_000L, 0.014))).isPresent();
        assertThat(aggregator.getSwapsApplied()).isEqualTo(5);
    }

    @Test
    @DisplayName("A slow bus does not hold the aggregator lock")
    void testPublishOutsideLock() throws Exception {
        MessageBus slowBus = mock(MessageBus.class);
        CountDownLatch publishing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        MarketCapAggregator slow = new MarketCapAggregator(TOKEN, Timeframe.M1, SUPPLY, 10, slowBus, List.of(),
            MutableClock.atEpochMillis(0L));
        slow.processSwap(swap(0L, 0.01));

        doAnswer(invocation -> {
            publishing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(slowBus).publishCandle(any());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            // Closes one candle and fills two gaps
            Future<Optional<CandleUpdate>> writer = executor.submit(() -> slow.processSwap(swap(185_000L, 0.02)));
            assertThat(publishing.await(5, TimeUnit.SECONDS)).isTrue();

            Optional<Candle> open = CompletableFuture.supplyAsync(slow::currentCandle).get(1, TimeUnit.SECONDS);
            assertThat(open).hasValueSatisfying(candle -> assertThat(candle.time()).isEqualTo(180_000L));
            assertThat(slow.closedCandles()).hasSize(3);

            release.countDown();
            assertThat(writer.get(5, TimeUnit.SECONDS)).isPresent();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Concurrent swaps on one stream are applied one at a time")
    void testConcurrentSwapsSameStream() throws Exception {
        MarketCapAggregator shared = new MarketCapAggregator(TOKEN, Timeframe.M1, SUPPLY, 10, mock(MessageBus.class),
            List.of(), MutableClock.atEpochMillis(0L));
        int threads = 8;
        int swapsPerThread = 250;
        Queue<CandleUpdate> results = new ConcurrentLinkedQueue<>();

        runConcurrently(threads, thread -> {
            for (int i = 0; i < swapsPerThread; i++) {
                double price = 0.001 * (1 + (thread * swapsPerThread + i) % 97);
                shared.processSwap(swap(1_000L + i, price)).ifPresent(results::add);
            }
        });

        int total = threads * swapsPerThread;
        assertThat(shared.getSwapsApplied()).isEqualTo(total);
        // Each update saw a distinct trade count: no two swaps interleaved
        assertThat(results).extracting(CandleUpdate::trades).doesNotHaveDuplicates().hasSize(total);
        Candle open = shared.currentCandle().orElseThrow();
        assertThat(open.trades()).isEqualTo(total);
        assertThat(open.high()).isCloseTo(0.097 * SUPPLY, within(EPSILON));
        assertThat(open.low()).isCloseTo(0.001 * SUPPLY, within(EPSILON));
    }

    @Test
    @DisplayName("Streams of different tokens aggregate independently in parallel")
    void testConcurrentSwapsAcrossStreams() throws Exception {
        MessageBus quietBus = mock(MessageBus.class);
        MarketCapAggregator first = new MarketCapAggregator("A", Timeframe.M1, SUPPLY, 10, quietBus, List.of(),
            MutableClock.atEpochMillis(0L));
        MarketCapAggregator second = new MarketCapAggregator("B", Timeframe.M1, SUPPLY, 10, quietBus, List.of(),
            MutableClock.atEpochMillis(0L));
        CountDownLatch firstHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        MarketCapAggregator blocking = new MarketCapAggregator("A", Timeframe.M1, SUPPLY, 10, quietBus,
            List.of((token, timeframe, closed) -> {
                firstHeld.countDown();
                awaitQuietly(release);
            }),
            MutableClock.atEpochMillis(0L));

        runConcurrently(4, thread -> {
            MarketCapAggregator target = thread % 2 == 0 ? first : second;
            for (int i = 0; i < 500; i++) {
                target.processSwap(swap(1_000L + i, 0.01));
            }
        });

        assertThat(first.getSwapsApplied()).isEqualTo(1_000);
        assertThat(second.getSwapsApplied()).isEqualTo(1_000);
        assertThat(first.currentCandle().orElseThrow().trades()).isEqualTo(1_000);
        assertThat(second.currentCandle().orElseThrow().trades()).isEqualTo(1_000);

        // A stream stuck in a close hook does not stop another stream
        blocking.processSwap(swap(0L, 0.01));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> blocking.processSwap(swap(60_000L, 0.01)));
            assertThat(firstHeld.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(CompletableFuture.supplyAsync(() -> second.processSwap(swap(600_000L, 0.02)))
                .get(1, TimeUnit.SECONDS)).isPresent();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    private interface ThreadBody {
        void run(int thread) throws Exception;
    }

    private static void runConcurrently(int threads, ThreadBody body) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    body.run(thread);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
