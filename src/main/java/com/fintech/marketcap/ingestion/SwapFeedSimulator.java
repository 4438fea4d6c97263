package com.fintech.marketcap.ingestion;

import com.fintech.marketcap.config.MarketCapProperties;
import com.fintech.marketcap.domain.SwapEvent;
import com.fintech.marketcap.domain.SwapSource;
import com.fintech.marketcap.domain.TradeSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates a random-walk swap feed for demos and local runs.
 *
 * Disabled by default; enable with {@code marketcap.simulation.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "marketcap.simulation.enabled", havingValue = "true", matchIfMissing = false)
public class SwapFeedSimulator {

    private static final Logger log = LoggerFactory.getLogger(SwapFeedSimulator.class);

    private static final double INITIAL_PRICE_USD = 0.00001;
    private static final double VOLATILITY = 0.002;  // per tick
    private static final SwapSource[] SOURCES = SwapSource.values();

    private final SwapEventPublisher eventPublisher;
    private final MarketCapProperties.Simulation settings;
    private final Map<String, Double> currentPrices = new ConcurrentHashMap<>();
    private final AtomicLong swapsGenerated = new AtomicLong(0);

    public SwapFeedSimulator(SwapEventPublisher eventPublisher, MarketCapProperties properties) {
        this.eventPublisher = eventPublisher;
        this.settings = properties.getSimulation();
        for (String token : settings.getTokens()) {
            currentPrices.put(token, INITIAL_PRICE_USD);
            log.info("Simulating swaps for {} starting at ${}", token, INITIAL_PRICE_USD);
        }
    }

    @Scheduled(fixedRateString = "${marketcap.simulation.update-frequency-ms:250}")
    public void generateSwaps() {
        long timestamp = System.currentTimeMillis();
        ThreadLocalRandom random = ThreadLocalRandom.current();

        for (String token : settings.getTokens()) {
            double price = nextPrice(token, random);
            double amountToken = random.nextDouble(1_000, 5_000_000);

            SwapEvent swap = new SwapEvent(
                UUID.randomUUID().toString(),
                timestamp,
                SOURCES[random.nextInt(SOURCES.length)],
                random.nextBoolean() ? TradeSide.BUY : TradeSide.SELL,
                token,
                amountToken,
                amountToken * price / 150.0,
                price,
                0.0,
                "sim-trader-" + random.nextInt(100)
            );

            if (!eventPublisher.tryPublish(swap)) {
                log.warn("Failed to publish simulated swap for {} - ring buffer full", token);
                break;
            }
            long generated = swapsGenerated.incrementAndGet();
            if (generated % 10_000 == 0) {
                log.info("Generated {} simulated swaps", generated);
            }
        }
    }

    private double nextPrice(String token, ThreadLocalRandom random) {
        double current = currentPrices.getOrDefault(token, INITIAL_PRICE_USD);
        double maxChange = current * VOLATILITY;
        double next = current + random.nextDouble(-maxChange, maxChange);
        if (next <= 0) {
            next = current;
        }
        currentPrices.put(token, next);
        return next;
    }

    public long getSwapsGenerated() {
        return swapsGenerated.get();
    }
}
