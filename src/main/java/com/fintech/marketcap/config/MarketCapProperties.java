package com.fintech.marketcap.config;

import com.fintech.marketcap.domain.Timeframe;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Externalized configuration for the market-cap candle service.
 * Maps to 'marketcap.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "marketcap")
public class MarketCapProperties {

    private Aggregation aggregation = new Aggregation();
    private Bus bus = new Bus();
    private Backpressure backpressure = new Backpressure();
    private Ingestion ingestion = new Ingestion();
    private Simulation simulation = new Simulation();

    @Data
    public static class Aggregation {
        private List<String> timeframes = List.of("1m", "5m", "15m", "1h");
        private int historySize = 500;
        private long defaultSupply = 1_000_000_000L;
        private Duration supplyTtl = Duration.ofMinutes(5);
        private long supplySweepIntervalMs = 60_000L;

        /** Parses the configured labels; a bad label fails startup. */
        public List<Timeframe> parsedTimeframes() {
            return timeframes.stream().map(Timeframe::parse).distinct().sorted().toList();
        }
    }

    @Data
    public static class Bus {
        private String brokerUrl;  // blank -> in-memory fallback
        private Duration connectTimeout = Duration.ofSeconds(2);
        private long cacheSweepIntervalMs = 30_000L;
    }

    @Data
    public static class Backpressure {
        private int maxQueueSize = 100;
        private long maxQueueBytes = 10L * 1024 * 1024;
        private double dropThreshold = 0.8;
        private Duration minSendInterval = Duration.ofMillis(10);
        private double healthFloor = 0.1;
    }

    @Data
    public static class Ingestion {
        private int bufferSize = 8192;
        private String waitStrategy = "BLOCKING";
        private int numConsumers = 1;  // consumers shard by token, order is kept per token
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private List<String> tokens = List.of("So11111111111111111111111111111111111111112");
        private long updateFrequencyMs = 250L;
    }
}
