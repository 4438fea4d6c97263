package com.fintech.marketcap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Market-Cap Candle Service
 *
 * Turns swap events into market-cap denominated OHLCV candles per token and
 * timeframe and fans them out to many subscribers.
 *
 * Key Features:
 * - LMAX Disruptor ring buffer in front of per-stream aggregators
 * - Redis pub/sub with an in-process fallback when no broker is reachable
 * - Per-connection bounded priority queues for downstream delivery
 * - Micrometer metrics for every stage
 *
 * The Redis connection is built by the message bus from
 * {@code marketcap.bus.broker-url}, so Spring Boot's own Redis setup is off.
 */
@SpringBootApplication(exclude = {RedisAutoConfiguration.class, RedisRepositoriesAutoConfiguration.class})
@EnableScheduling
public class MarketCapCandleApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketCapCandleApplication.class, args);
    }
}
